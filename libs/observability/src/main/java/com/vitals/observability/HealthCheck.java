package com.vitals.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for a single health check component.
 * <p>
 * Implementations perform a lightweight probe of a dependency and return the result
 * asynchronously. {@link HealthCheckRegistry} runs all registered checks concurrently.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCheck diskCheck = () -> {
 *     long start = System.currentTimeMillis();
 *     long free = new File("/").getUsableSpace();
 *     long elapsed = System.currentTimeMillis() - start;
 *     return CompletableFuture.completedFuture(free > MIN_FREE
 *             ? ComponentHealth.healthy("disk", elapsed)
 *             : ComponentHealth.degraded("disk", "low disk space", elapsed));
 * };
 * }</pre>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Performs a health check and returns the result asynchronously.
     *
     * @return a future that completes with the component health result
     */
    CompletableFuture<ComponentHealth> check();
}
