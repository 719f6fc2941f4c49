package com.vitals.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HealthCallback} that reports the component checks of a {@link HealthCheckRegistry}
 * under the node's own name.
 * <p>
 * The status has a single top-level key, so statuses from the coordinator and from every
 * worker can be merged without overwriting each other:
 * <pre>
 * {
 *   "worker-1": {
 *     "status": "HEALTHY",
 *     "checks": { "disk": { "status": "HEALTHY", "latencyMs": 2 } },
 *     "timestamp": "2025-07-12T10:30:00Z"
 *   }
 * }
 * </pre>
 */
public final class NodeHealthCallback implements HealthCallback {

    private final String nodeName;
    private final HealthCheckRegistry registry;

    public NodeHealthCallback(String nodeName, HealthCheckRegistry registry) {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("nodeName must not be null or blank");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.nodeName = nodeName;
        this.registry = registry;
    }

    @Override
    public CompletableFuture<HealthStatus> getHealth() {
        return registry.checkAll().thenApply(this::toStatus);
    }

    HealthStatus toStatus(HealthResult result) {
        Map<String, Object> checks = new LinkedHashMap<>();
        result.checks().forEach((name, component) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", component.state().name());
            if (component.message() != null) {
                entry.put("message", component.message());
            }
            entry.put("latencyMs", component.latencyMs());
            checks.put(name, entry);
        });

        Map<String, Object> node = new LinkedHashMap<>();
        node.put("status", result.state().name());
        node.put("checks", checks);
        node.put("timestamp", result.timestamp().toString());
        return HealthStatus.of(nodeName, node);
    }

    public String nodeName() {
        return nodeName;
    }
}
