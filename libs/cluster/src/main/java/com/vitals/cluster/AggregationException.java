package com.vitals.cluster;

/**
 * Base class for failures of a health aggregation request.
 */
public abstract class AggregationException extends RuntimeException {

    private final long requestId;

    protected AggregationException(long requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    /** The aggregation request that failed. */
    public long requestId() {
        return requestId;
    }
}
