package com.vitals.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate result of every registered component health check on one node.
 *
 * @param state     overall node state (the worst state among the components)
 * @param checks    individual component results keyed by component name, in registration order
 * @param timestamp when the checks completed
 */
public record HealthResult(
        HealthState state,
        Map<String, ComponentHealth> checks,
        Instant timestamp
) {

    public HealthResult {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }
}
