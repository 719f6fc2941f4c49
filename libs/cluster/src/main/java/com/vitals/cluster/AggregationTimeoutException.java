package com.vitals.cluster;

/**
 * Thrown when not every worker replied before the aggregation deadline.
 */
public class AggregationTimeoutException extends AggregationException {

    private final long timeoutMs;
    private final int pendingReplies;

    public AggregationTimeoutException(long requestId, long timeoutMs, int pendingReplies) {
        super(requestId, "Operation timed out");
        this.timeoutMs = timeoutMs;
        this.pendingReplies = pendingReplies;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    /** Number of workers that had not replied when the deadline passed. */
    public int pendingReplies() {
        return pendingReplies;
    }
}
