package com.vitals.metricsserver.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the metrics server, bound from {@code vitals.server.*}.
 *
 * <pre>
 * vitals:
 *   server:
 *     name: checkout
 *     access-token: s3cret
 *     endpoints:
 *       health: /health
 *       stats: /stats
 *     cluster:
 *       enabled: true
 *       workers: 4
 *       aggregation-timeout: 5s
 * </pre>
 *
 * <p>Host and port are Spring Boot's own {@code server.address} and {@code server.port}.
 *
 * @param name Node name of the coordinator (or single process), also the {@code service} metric tag.
 * @param accessToken Token required on every request; empty or absent disables the check.
 * @param endpoints Paths of the two endpoints.
 * @param cluster Multi-process settings.
 */
@ConfigurationProperties(prefix = "vitals.server")
@Validated
public record MetricsServerProperties(
        @NotBlank String name, String accessToken, @Valid Endpoints endpoints, @Valid Cluster cluster) {

    public MetricsServerProperties {
        if (endpoints == null) {
            endpoints = new Endpoints(null, null);
        }
        if (cluster == null) {
            cluster = new Cluster(false, 0, null);
        }
    }

    /** Whether a non-empty access token is configured. */
    public boolean accessTokenRequired() {
        return accessToken != null && !accessToken.isEmpty();
    }

    /**
     * Endpoint paths. Each must start with {@code /} and contain only letters, digits, {@code .},
     * {@code _}, {@code -} and {@code /}; the two must differ.
     *
     * @param health Path of the health endpoint (default {@code /health}).
     * @param stats Path of the stats endpoint (default {@code /stats}).
     */
    public record Endpoints(String health, String stats) {

        public static final String DEFAULT_HEALTH = "/health";
        public static final String DEFAULT_STATS = "/stats";

        private static final Pattern VALID_PATH = Pattern.compile("^(?:/[A-Za-z0-9._-]*)+$");

        public Endpoints {
            if (health == null || health.isBlank()) {
                health = DEFAULT_HEALTH;
            }
            if (stats == null || stats.isBlank()) {
                stats = DEFAULT_STATS;
            }
            requireValidPath("health", health);
            requireValidPath("stats", stats);
            if (health.equals(stats)) {
                throw new IllegalArgumentException(
                        "Health and stats endpoints must differ, both are " + health);
            }
        }

        private static void requireValidPath(String endpoint, String path) {
            if (!VALID_PATH.matcher(path).matches()) {
                throw new IllegalArgumentException("Invalid " + endpoint + " endpoint path: " + path);
            }
        }
    }

    /**
     * @param enabled Run as coordinator with in-process workers.
     * @param workers Number of workers started in cluster mode (default 2).
     * @param aggregationTimeout Deadline for all workers to answer a health query (default 5s).
     */
    public record Cluster(boolean enabled, int workers, Duration aggregationTimeout) {

        public static final int DEFAULT_WORKERS = 2;
        public static final Duration DEFAULT_AGGREGATION_TIMEOUT = Duration.ofSeconds(5);

        public Cluster {
            if (workers <= 0) {
                workers = DEFAULT_WORKERS;
            }
            if (aggregationTimeout == null) {
                aggregationTimeout = DEFAULT_AGGREGATION_TIMEOUT;
            }
            if (aggregationTimeout.isNegative() || aggregationTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "Aggregation timeout must be positive: " + aggregationTimeout);
            }
        }
    }
}
