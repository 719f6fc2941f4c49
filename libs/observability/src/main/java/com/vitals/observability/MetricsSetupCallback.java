package com.vitals.observability;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Application hook that registers its own meters.
 * <p>
 * Invoked once for every node's registry during startup: once for the coordinator (or the single
 * process) and once per worker in multi-process mode.
 */
@FunctionalInterface
public interface MetricsSetupCallback {

    /**
     * Registers meters with the given registry.
     *
     * @param registry the node's meter registry
     */
    void setup(MeterRegistry registry);
}
