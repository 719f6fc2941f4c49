package com.vitals.metricsserver.handler;

import com.vitals.metricsserver.infrastructure.web.ResponseWriter;
import com.vitals.observability.AggregatorMetricsRegistry;
import com.vitals.observability.MetricsRegistry;
import com.vitals.security.AccessGuard;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;

/**
 * Serves the metrics snapshot: the local registry in single-process mode, the meters of every
 * worker in cluster mode.
 */
public class StatsRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(StatsRequestHandler.class);

    private final String accessToken;
    private final MetricsRegistry registry;
    private final boolean clusterMode;

    /**
     * @throws IllegalArgumentException if cluster mode is requested without an aggregating registry
     */
    public StatsRequestHandler(String accessToken, MetricsRegistry registry, boolean clusterMode) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (clusterMode && !(registry instanceof AggregatorMetricsRegistry)) {
            throw new IllegalArgumentException("Cluster mode requires an AggregatorMetricsRegistry");
        }
        this.accessToken = accessToken;
        this.registry = registry;
        this.clusterMode = clusterMode;
    }

    public CompletableFuture<ResponseEntity<String>> handle(AccessGuard.HeaderSource headers) {
        if (!AccessGuard.checkAccess(headers, accessToken)) {
            log.debug("Stats request denied: missing or wrong access token");
            return CompletableFuture.completedFuture(ResponseWriter.forbidden());
        }

        return snapshot()
                .thenApply(text -> ResponseWriter.ok(text, registry.contentType()))
                .exceptionally(error -> {
                    log.warn("Stats request failed", HealthRequestHandler.unwrap(error));
                    return ResponseWriter.serverError();
                });
    }

    private CompletableFuture<String> snapshot() {
        try {
            return clusterMode ? ((AggregatorMetricsRegistry) registry).clusterMetrics() : registry.metrics();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public boolean isClusterMode() {
        return clusterMode;
    }
}
