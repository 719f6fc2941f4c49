package com.vitals.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry that aggregates multiple {@link HealthCheck} instances and runs them
 * concurrently to produce a single {@link HealthResult}.
 * <p>
 * Health checks are registered by component name. {@link #checkAll()} starts every check at once
 * and completes when all of them have either answered or exceeded the timeout. A check that fails
 * or times out is reported as {@link HealthState#UNHEALTHY}; it never fails the aggregate.
 */
public final class HealthCheckRegistry {

    /** Default timeout for individual health checks (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    /**
     * Creates a registry with the default timeout.
     */
    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * Creates a registry with a custom timeout.
     *
     * @param timeoutMs timeout in milliseconds for each individual health check
     */
    public HealthCheckRegistry(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a health check under the given component name.
     * Replaces any existing check for the same name.
     *
     * @param name  component name (e.g., "disk", "queue")
     * @param check the health check to register
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Removes a health check by component name.
     *
     * @param name component name to deregister
     * @return true if a check was removed
     */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs all registered health checks concurrently and aggregates the results.
     * <p>
     * Completes immediately with {@link HealthState#HEALTHY} if no checks are registered.
     *
     * @return a future that completes with the aggregate health result; it never completes
     *         exceptionally
     */
    public CompletableFuture<HealthResult> checkAll() {
        if (checks.isEmpty()) {
            return CompletableFuture.completedFuture(
                    new HealthResult(HealthState.HEALTHY, Map.of(), Instant.now()));
        }

        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            futures.put(entry.getKey(), start(entry.getKey(), entry.getValue()));
        }

        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> aggregate(futures));
    }

    private CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        long startNanos = System.nanoTime();
        CompletableFuture<ComponentHealth> future;
        try {
            future = check.check();
            if (future == null) {
                future = CompletableFuture.failedFuture(new IllegalStateException("no result"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(e -> ComponentHealth.unhealthy(
                        name, describe(e), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
    }

    private static HealthResult aggregate(Map<String, CompletableFuture<ComponentHealth>> futures) {
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthState overall = HealthState.HEALTHY;

        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            ComponentHealth result = entry.getValue().join();
            results.put(entry.getKey(), result);

            if (result.state() == HealthState.UNHEALTHY) {
                overall = HealthState.UNHEALTHY;
            } else if (result.state() == HealthState.DEGRADED && overall == HealthState.HEALTHY) {
                overall = HealthState.DEGRADED;
            }
        }

        return new HealthResult(overall, results, Instant.now());
    }

    private String describe(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Timeout after " + timeoutMs + "ms";
        }
        return "Error: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }

    /**
     * Returns the number of registered health checks.
     */
    public int size() {
        return checks.size();
    }

    /**
     * Returns the configured timeout in milliseconds.
     */
    public long timeoutMs() {
        return timeoutMs;
    }
}
