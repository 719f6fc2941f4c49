package com.vitals.metricsserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitals.metricsserver.cluster.ClusterRuntime;
import com.vitals.metricsserver.cluster.HealthCallbackFactory;
import com.vitals.metricsserver.handler.HealthRequestHandler;
import com.vitals.metricsserver.handler.StatsRequestHandler;
import com.vitals.observability.AggregationMetrics;
import com.vitals.observability.AggregatorMetricsRegistry;
import com.vitals.observability.DefaultMetrics;
import com.vitals.observability.HealthCheckRegistry;
import com.vitals.observability.MetricsRegistry;
import com.vitals.observability.MetricsSetupCallback;
import com.vitals.observability.NodeHealthCallback;
import com.vitals.observability.PrometheusMetricsRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires registries, the cluster and the request handlers.
 *
 * <p>Applications contribute component checks by registering them with the {@link
 * HealthCheckRegistry} bean, and their own meters through {@link MetricsSetupCallback} beans, which
 * run once per node. A {@code @Primary} {@link HealthCallbackFactory} bean replaces the default
 * per-node health callback.
 */
@Configuration
public class MetricsServerConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsServerConfig.class);

    @Bean
    public HealthCheckRegistry healthCheckRegistry() {
        return new HealthCheckRegistry();
    }

    @Bean
    public HealthCallbackFactory healthCallbackFactory(HealthCheckRegistry healthCheckRegistry) {
        return nodeName -> new NodeHealthCallback(nodeName, healthCheckRegistry);
    }

    @Bean
    public MetricsRegistry metricsRegistry(
            MetricsServerProperties properties, ObjectProvider<MetricsSetupCallback> setupCallbacks) {
        MetricsRegistry registry = properties.cluster().enabled()
                ? new AggregatorMetricsRegistry()
                : new PrometheusMetricsRegistry();
        nodeMetricsSetup(setupCallbacks.orderedStream().toList()).accept(registry.meterRegistry());
        return registry;
    }

    @Bean
    public AggregationMetrics aggregationMetrics(MetricsRegistry metricsRegistry, MetricsServerProperties properties) {
        return new AggregationMetrics(metricsRegistry.meterRegistry(), properties.name());
    }

    @Bean(destroyMethod = "shutdown")
    public ClusterRuntime clusterRuntime(
            MetricsServerProperties properties,
            HealthCallbackFactory healthCallbackFactory,
            MetricsRegistry metricsRegistry,
            ObjectProvider<MetricsSetupCallback> setupCallbacks,
            AggregationMetrics aggregationMetrics) {
        MetricsServerProperties.Cluster cluster = properties.cluster();
        if (!cluster.enabled()) {
            return ClusterRuntime.singleProcess();
        }
        return ClusterRuntime.start(
                cluster.workers(),
                healthCallbackFactory,
                (AggregatorMetricsRegistry) metricsRegistry,
                nodeMetricsSetup(setupCallbacks.orderedStream().toList()),
                cluster.aggregationTimeout(),
                aggregationMetrics);
    }

    @Bean
    public HealthRequestHandler healthRequestHandler(
            MetricsServerProperties properties,
            HealthCallbackFactory healthCallbackFactory,
            ClusterRuntime clusterRuntime,
            ObjectMapper objectMapper) {
        log.info("Health endpoint at {} ({}, access token {})",
                properties.endpoints().health(),
                clusterRuntime.isClusterMode() ? "cluster of " + clusterRuntime.workerIds().size() : "single process",
                properties.accessTokenRequired() ? "required" : "not required");
        return new HealthRequestHandler(
                properties.accessToken(),
                healthCallbackFactory.create(properties.name()),
                clusterRuntime.coordinator().orElse(null),
                objectMapper);
    }

    @Bean
    public StatsRequestHandler statsRequestHandler(
            MetricsServerProperties properties, MetricsRegistry metricsRegistry) {
        log.info("Stats endpoint at {}", properties.endpoints().stats());
        return new StatsRequestHandler(
                properties.accessToken(), metricsRegistry, properties.cluster().enabled());
    }

    private static Consumer<MeterRegistry> nodeMetricsSetup(List<MetricsSetupCallback> callbacks) {
        return registry -> {
            DefaultMetrics.bindTo(registry);
            callbacks.forEach(callback -> callback.setup(registry));
        };
    }
}
