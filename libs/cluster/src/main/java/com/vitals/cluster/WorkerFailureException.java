package com.vitals.cluster;

/**
 * Thrown when a worker answered a fan-out request with an error. The message is the error text
 * the worker reported.
 */
public class WorkerFailureException extends AggregationException {

    private final String workerId;

    public WorkerFailureException(long requestId, String workerId, String error) {
        super(requestId, error);
        this.workerId = workerId;
    }

    public String workerId() {
        return workerId;
    }
}
