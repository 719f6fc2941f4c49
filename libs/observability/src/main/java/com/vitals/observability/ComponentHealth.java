package com.vitals.observability;

/**
 * Health result for a single component.
 *
 * @param name component name (e.g., "disk", "queue", "upstream")
 * @param state health state of this component
 * @param message optional human-readable message (e.g., error details)
 * @param latencyMs time taken to check this component (in milliseconds)
 */
public record ComponentHealth(String name, HealthState state, String message, long latencyMs) {

    /** Creates a healthy component result. */
    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthState.HEALTHY, null, latencyMs);
    }

    /** Creates a degraded component result. */
    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthState.DEGRADED, message, latencyMs);
    }

    /** Creates an unhealthy component result. */
    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthState.UNHEALTHY, message, latencyMs);
    }
}
