package com.vitals.cluster;

import java.util.HashMap;
import java.util.Map;

/**
 * In-flight aggregation requests keyed by request id.
 * <p>
 * Not thread-safe: owned by the coordinator loop, which is the only thread that reads or
 * writes it.
 */
final class AggregationRequestTable {

    private final Map<Long, AggregationRequest> requests = new HashMap<>();

    /**
     * @throws IllegalStateException if a request with the same id is already in flight
     */
    void register(AggregationRequest request) {
        AggregationRequest existing = requests.putIfAbsent(request.requestId(), request);
        if (existing != null) {
            throw new IllegalStateException(
                    "Aggregation request " + request.requestId() + " is already in flight");
        }
    }

    /**
     * Returns the in-flight request with the given id, or {@code null} if it has been resolved.
     */
    AggregationRequest get(long requestId) {
        return requests.get(requestId);
    }

    /**
     * Removes the request if it is still registered.
     *
     * @return true if this call removed it
     */
    boolean remove(AggregationRequest request) {
        return requests.remove(request.requestId(), request);
    }

    int size() {
        return requests.size();
    }

    boolean isEmpty() {
        return requests.isEmpty();
    }
}
