package com.vitals.observability;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.CompletableFuture;

/**
 * A metrics registry whose contents can be exported as exposition text.
 * <p>
 * Instances are created explicitly during setup and passed to whatever needs them (metric setup
 * callbacks, the stats endpoint). There is no process-wide default instance.
 */
public interface MetricsRegistry {

    /**
     * Returns the Micrometer registry that collectors and meters are registered with.
     */
    MeterRegistry meterRegistry();

    /**
     * Renders a snapshot of this registry's meters.
     *
     * @return a future completing with the exposition text
     */
    CompletableFuture<String> metrics();

    /**
     * Returns the HTTP content type of the text produced by {@link #metrics()}.
     */
    String contentType();
}
