package com.vitals.cluster;

import com.vitals.observability.HealthStatus;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one in-flight fan-out. Mutable fields are only touched on the coordinator loop;
 * {@link #fulfilled} is atomic so that resolution happens at most once whichever path gets there
 * first.
 */
final class AggregationRequest {

    private final long requestId;
    private final CompletableFuture<HealthStatus> result;
    private final AtomicBoolean fulfilled = new AtomicBoolean(false);
    private final long startNanos = System.nanoTime();

    private HealthStatus mergedStatus;
    private int pendingCount;
    private ScheduledFuture<?> completionTimer;

    AggregationRequest(long requestId, HealthStatus localStatus, CompletableFuture<HealthStatus> result) {
        this.requestId = requestId;
        this.mergedStatus = localStatus;
        this.result = result;
    }

    long requestId() {
        return requestId;
    }

    HealthStatus mergedStatus() {
        return mergedStatus;
    }

    int pendingCount() {
        return pendingCount;
    }

    boolean isFulfilled() {
        return fulfilled.get();
    }

    Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    void expectReply() {
        pendingCount++;
    }

    void armTimer(ScheduledFuture<?> timer) {
        this.completionTimer = timer;
    }

    /**
     * Merges one worker's status and counts its reply.
     *
     * @return true if this was the last outstanding reply
     */
    boolean mergeReply(HealthStatus workerStatus) {
        mergedStatus = mergedStatus.merge(workerStatus);
        pendingCount--;
        return pendingCount == 0;
    }

    /**
     * Resolves the request successfully.
     *
     * @return false if it had already been resolved
     */
    boolean fulfill(HealthStatus status) {
        if (!fulfilled.compareAndSet(false, true)) {
            return false;
        }
        cancelTimer();
        result.complete(status);
        return true;
    }

    /**
     * Resolves the request with a failure.
     *
     * @return false if it had already been resolved
     */
    boolean fail(Throwable error) {
        if (!fulfilled.compareAndSet(false, true)) {
            return false;
        }
        cancelTimer();
        result.completeExceptionally(error);
        return true;
    }

    private void cancelTimer() {
        if (completionTimer != null) {
            completionTimer.cancel(false);
        }
    }
}
