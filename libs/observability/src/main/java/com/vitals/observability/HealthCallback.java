package com.vitals.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Produces the local health status of a node.
 * <p>
 * Called once per health query on the node that serves the HTTP request and, in multi-process
 * mode, once per fan-out request on every worker. The result may complete on any thread.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthCallback callback = () -> CompletableFuture.completedFuture(
 *         HealthStatus.of(Map.of("queueDepth", queue.size())));
 * }</pre>
 */
@FunctionalInterface
public interface HealthCallback {

    /**
     * Computes the local health status.
     *
     * @return a future that completes with the status, or exceptionally if it cannot be computed
     */
    CompletableFuture<HealthStatus> getHealth();

    /**
     * Returns a callback that always reports the given status.
     */
    static HealthCallback fixed(HealthStatus status) {
        return () -> CompletableFuture.completedFuture(status);
    }

    /**
     * Invokes a callback so that every failure, including a synchronous throw or a missing result,
     * surfaces as an exceptionally completed future.
     */
    static CompletableFuture<HealthStatus> invoke(HealthCallback callback) {
        try {
            CompletableFuture<HealthStatus> result = callback.getHealth();
            if (result == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Health callback returned no result"));
            }
            return result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
