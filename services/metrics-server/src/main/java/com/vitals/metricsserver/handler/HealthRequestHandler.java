package com.vitals.metricsserver.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitals.cluster.AggregationCoordinator;
import com.vitals.metricsserver.infrastructure.web.ResponseWriter;
import com.vitals.observability.HealthCallback;
import com.vitals.observability.HealthStatus;
import com.vitals.security.AccessGuard;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Serves one health query.
 *
 * <p>Invokes the local health callback and, in cluster mode, lets the coordinator merge the status
 * of every worker over it. Responds 200 with the status as JSON, 403 if the access token does not
 * match and 500 with an empty body if anything on the way fails.
 */
public class HealthRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(HealthRequestHandler.class);

    private final String accessToken;
    private final HealthCallback localCallback;
    private final AggregationCoordinator coordinator;
    private final ObjectMapper mapper;

    /**
     * @param accessToken configured token, {@code null} or empty to allow everyone
     * @param localCallback status of this node
     * @param coordinator coordinator of the worker pool, {@code null} in single-process mode
     * @param mapper serializer of the status
     */
    public HealthRequestHandler(
            String accessToken,
            HealthCallback localCallback,
            AggregationCoordinator coordinator,
            ObjectMapper mapper) {
        if (localCallback == null) {
            throw new IllegalArgumentException("localCallback must not be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.accessToken = accessToken;
        this.localCallback = localCallback;
        this.coordinator = coordinator;
        this.mapper = mapper;
    }

    public CompletableFuture<ResponseEntity<String>> handle(AccessGuard.HeaderSource headers) {
        if (!AccessGuard.checkAccess(headers, accessToken)) {
            log.debug("Health request denied: missing or wrong access token");
            return CompletableFuture.completedFuture(ResponseWriter.forbidden());
        }

        CompletableFuture<HealthStatus> status = HealthCallback.invoke(localCallback)
                .thenApply(local -> local == null ? HealthStatus.empty() : local);
        if (coordinator != null) {
            status = status.thenCompose(local -> coordinator.gather(local, coordinator.nextRequestId()));
        }

        return status
                .thenApply(merged -> ResponseWriter.ok(toJson(merged), MediaType.APPLICATION_JSON_VALUE))
                .exceptionally(error -> {
                    log.warn("Health request failed", unwrap(error));
                    return ResponseWriter.serverError();
                });
    }

    public boolean isClusterMode() {
        return coordinator != null;
    }

    private String toJson(HealthStatus status) {
        try {
            return mapper.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
