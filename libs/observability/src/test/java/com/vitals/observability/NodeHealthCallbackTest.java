package com.vitals.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vitals.observability.testing.InMemoryHealthCheck;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link NodeHealthCallback} and the {@link HealthCallback} helpers. */
@DisplayName("NodeHealthCallback")
class NodeHealthCallbackTest {

    @Test
    @DisplayName("reports component checks under the node name")
    @SuppressWarnings("unchecked")
    void reportsChecksUnderNodeName() throws Exception {
        var registry = new HealthCheckRegistry();
        registry.register("disk", new InMemoryHealthCheck("disk").setLatencyMs(3));
        registry.register("queue", new InMemoryHealthCheck("queue").setDegraded("backlog"));

        HealthStatus status = new NodeHealthCallback("worker-1", registry)
                .getHealth()
                .get(5, TimeUnit.SECONDS);

        assertThat(status.asMap()).containsOnlyKeys("worker-1");
        var node = (Map<String, Object>) status.get("worker-1");
        assertThat(node).containsEntry("status", "DEGRADED").containsKey("timestamp");
        var checks = (Map<String, Map<String, Object>>) node.get("checks");
        assertThat(checks.get("disk")).containsEntry("status", "HEALTHY").containsEntry("latencyMs", 3L);
        assertThat(checks.get("queue")).containsEntry("message", "backlog");
    }

    @Test
    @DisplayName("statuses of different nodes merge without overwriting each other")
    void differentNodesMerge() throws Exception {
        var registry = new HealthCheckRegistry();

        HealthStatus coordinator = new NodeHealthCallback("coordinator", registry).getHealth().get();
        HealthStatus worker = new NodeHealthCallback("worker-1", registry).getHealth().get();

        assertThat(coordinator.merge(worker).asMap()).containsOnlyKeys("coordinator", "worker-1");
    }

    @Test
    @DisplayName("rejects blank node name")
    void rejectsBlankNodeName() {
        assertThatThrownBy(() -> new NodeHealthCallback(" ", new HealthCheckRegistry()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("invoke turns a synchronous throw into a failed future")
    void invokeWrapsSynchronousThrow() {
        HealthCallback throwing = () -> {
            throw new IllegalStateException("boom");
        };

        CompletableFuture<HealthStatus> result = HealthCallback.invoke(throwing);

        assertThat(result).isCompletedExceptionally();
    }

    @Test
    @DisplayName("invoke turns a missing result into a failed future")
    void invokeRejectsNullResult() {
        CompletableFuture<HealthStatus> result = HealthCallback.invoke(() -> null);

        assertThat(result).isCompletedExceptionally();
    }
}
