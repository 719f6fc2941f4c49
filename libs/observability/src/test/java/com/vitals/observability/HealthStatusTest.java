package com.vitals.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link HealthStatus}. */
@DisplayName("HealthStatus")
class HealthStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should copy the source map")
        void shouldCopySourceMap() {
            var source = new HashMap<String, Object>();
            source.put("a", 1);

            HealthStatus status = HealthStatus.of(source);
            source.put("b", 2);

            assertThat(status.size()).isEqualTo(1);
            assertThatThrownBy(() -> status.asMap().put("c", 3))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("should allow null values but reject null keys")
        void shouldRejectNullKeys() {
            var withNullValue = new HashMap<String, Object>();
            withNullValue.put("a", null);
            assertThat(HealthStatus.of(withNullValue).containsKey("a")).isTrue();

            var withNullKey = new HashMap<String, Object>();
            withNullKey.put(null, 1);
            assertThatThrownBy(() -> HealthStatus.of(withNullKey))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> HealthStatus.of((Map<String, ?>) null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("should add new keys and overwrite colliding ones")
        void shouldOverwriteKeyWise() {
            HealthStatus base = HealthStatus.of(Map.of("a", 1, "shared", "coordinator"));
            HealthStatus merged = base.merge(HealthStatus.of(Map.of("b", 2, "shared", "worker")));

            assertThat(merged.asMap())
                    .containsEntry("a", 1)
                    .containsEntry("b", 2)
                    .containsEntry("shared", "worker");
            assertThat(base.get("shared")).isEqualTo("coordinator");
        }

        @Test
        @DisplayName("should apply merges in order, last writer wins")
        void shouldApplyInOrder() {
            HealthStatus merged = HealthStatus.of("k", 0)
                    .merge(HealthStatus.of("k", 1))
                    .merge(HealthStatus.of("k", 2));

            assertThat(merged.get("k")).isEqualTo(2);
        }

        @Test
        @DisplayName("should return itself when merging empty or null")
        void shouldIgnoreEmpty() {
            HealthStatus status = HealthStatus.of("a", 1);

            assertThat(status.merge(HealthStatus.empty())).isSameAs(status);
            assertThat(status.merge(null)).isSameAs(status);
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        @DisplayName("should serialize as a bare JSON object")
        void shouldSerializeAsObject() throws Exception {
            var values = new LinkedHashMap<String, Object>();
            values.put("value", 64);
            values.put("ready", true);

            String json = mapper.writeValueAsString(HealthStatus.of(values));

            assertThat(json).isEqualTo("{\"value\":64,\"ready\":true}");
        }

        @Test
        @DisplayName("should parse back to an equal status regardless of key order")
        void shouldRoundTrip() throws Exception {
            HealthStatus original = HealthStatus.of(Map.of(
                    "a", 1,
                    "name", "coordinator",
                    "nested", Map.of("ok", true),
                    "list", List.of("x", "y")));

            String json = mapper.writeValueAsString(original);
            HealthStatus parsed = mapper.readValue(json, HealthStatus.class);

            assertThat(parsed).isEqualTo(original);
        }
    }
}
