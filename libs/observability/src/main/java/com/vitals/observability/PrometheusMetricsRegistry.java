package com.vitals.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.util.concurrent.CompletableFuture;

/**
 * {@link MetricsRegistry} backed by a single Micrometer {@link PrometheusMeterRegistry}.
 */
public class PrometheusMetricsRegistry implements MetricsRegistry, AutoCloseable {

    /** Content type of the Prometheus text exposition format. */
    public static final String CONTENT_TYPE = TextFormat.CONTENT_TYPE_004;

    private final PrometheusMeterRegistry registry;

    public PrometheusMetricsRegistry() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public PrometheusMetricsRegistry(PrometheusMeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    @Override
    public MeterRegistry meterRegistry() {
        return registry;
    }

    @Override
    public CompletableFuture<String> metrics() {
        return scrape(registry);
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public void close() {
        registry.close();
    }

    static CompletableFuture<String> scrape(PrometheusMeterRegistry registry) {
        try {
            return CompletableFuture.completedFuture(registry.scrape());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
