package com.vitals.observability;

/**
 * Health state of an individual component or of a whole node.
 */
public enum HealthState {

    /** All components are functioning normally. */
    HEALTHY,

    /** Some components are impaired but the node can still serve requests. */
    DEGRADED,

    /** One or more critical components are down. */
    UNHEALTHY
}
