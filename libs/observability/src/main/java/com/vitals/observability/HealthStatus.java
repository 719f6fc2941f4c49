package com.vitals.observability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key-value health status reported by a node and returned by the health endpoint.
 * <p>
 * Immutable and insertion-ordered. Values must be JSON-compatible (strings, numbers, booleans,
 * lists, nested maps or {@code null}). Serializes to and from a bare JSON object.
 * <p>
 * Statuses from several nodes are combined with {@link #merge(HealthStatus)}: keys of the merged-in
 * status overwrite keys already present (last writer wins).
 */
public final class HealthStatus {

    private static final HealthStatus EMPTY = new HealthStatus(Collections.emptyMap());

    private final Map<String, Object> values;

    private HealthStatus(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * Returns a status with no entries.
     */
    public static HealthStatus empty() {
        return EMPTY;
    }

    /**
     * Creates a status holding a single entry.
     */
    public static HealthStatus of(String key, Object value) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(key, value);
        return of(values);
    }

    /**
     * Creates a status from a copy of the given map.
     *
     * @throws IllegalArgumentException if the map is null or contains a null key
     */
    public static HealthStatus of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.containsKey(null)) {
            throw new IllegalArgumentException("keys must not be null");
        }
        return new HealthStatus(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static HealthStatus fromJson(Map<String, Object> values) {
        return values == null ? EMPTY : of(values);
    }

    /**
     * Returns a new status equal to this one with every entry of {@code other} applied on top.
     */
    public HealthStatus merge(HealthStatus other) {
        if (other == null || other.values.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(other.values);
        return new HealthStatus(Collections.unmodifiableMap(merged));
    }

    /**
     * Returns the value for a key, or {@code null} if absent.
     */
    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the entries.
     */
    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HealthStatus)) {
            return false;
        }
        return values.equals(((HealthStatus) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "HealthStatus" + values;
    }
}
