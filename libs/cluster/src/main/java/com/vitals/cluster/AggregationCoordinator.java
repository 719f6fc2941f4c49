package com.vitals.cluster;

import com.vitals.cluster.ClusterMessage.GetStatsRequest;
import com.vitals.cluster.ClusterMessage.GetStatsResponse;
import com.vitals.observability.AggregationMetrics;
import com.vitals.observability.AggregationMetrics.Outcome;
import com.vitals.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans a health query out to every connected worker and merges the replies into one status.
 * <p>
 * Each call to {@link #gather(HealthStatus, long)} becomes an {@link AggregationRequest} seeded
 * with the coordinator's own status. Replies are merged in arrival order; the request resolves
 * once every worker that was sent the request has answered. It fails with a
 * {@link WorkerFailureException} as soon as one worker reports an error, and with an
 * {@link AggregationTimeoutException} if the replies are not all in before the timeout. Replies
 * for a request that has already been resolved are ignored.
 * <p>
 * Every state change, timer expiry included, runs as a task on one private thread, the
 * coordinator loop, which is the sole owner of the request table.
 */
public final class AggregationCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregationCoordinator.class);

    /** Default deadline for all workers to reply (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private final CoordinatorTransport transport;
    private final long timeoutMs;
    private final AggregationMetrics metrics;
    private final ScheduledThreadPoolExecutor loop;
    private final CoordinatorTransport.MessageHandler handler = this::onMessage;
    private final AggregationRequestTable table = new AggregationRequestTable();
    private final AtomicLong nextRequestId = new AtomicLong();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile boolean shuttingDown;

    /**
     * Creates a coordinator with the default timeout and detached instrumentation.
     */
    public AggregationCoordinator(CoordinatorTransport transport) {
        this(transport, DEFAULT_TIMEOUT_MS, AggregationMetrics.detached());
    }

    /**
     * Creates a coordinator and installs it as the transport's message handler.
     *
     * @param transport channel to the workers
     * @param timeoutMs deadline in milliseconds for all workers to reply
     * @param metrics   instrumentation recording each resolved request
     */
    public AggregationCoordinator(CoordinatorTransport transport, long timeoutMs, AggregationMetrics metrics) {
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.transport = transport;
        this.timeoutMs = timeoutMs;
        this.metrics = metrics;
        this.loop = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "aggregation-coordinator");
            thread.setDaemon(true);
            return thread;
        });
        this.loop.setRemoveOnCancelPolicy(true);
        transport.setMessageHandler(handler);
    }

    /**
     * Returns a fresh request id. Ids are unique for the lifetime of this coordinator.
     */
    public long nextRequestId() {
        return nextRequestId.getAndIncrement();
    }

    /**
     * Collects the health status of every connected worker and merges it over the local one.
     * <p>
     * Never completes on the caller's thread. When no worker is connected the result is the local
     * status unchanged.
     *
     * @param localStatus the coordinator's own status, used as the base of the merge
     * @param requestId   id correlating the workers' replies; must not be in flight already
     * @return a future completing with the merged status, or exceptionally with an
     *         {@link AggregationException} (or {@link IllegalStateException} after shutdown or
     *         for a duplicate id)
     */
    public CompletableFuture<HealthStatus> gather(HealthStatus localStatus, long requestId) {
        if (localStatus == null) {
            throw new IllegalArgumentException("localStatus must not be null");
        }
        if (shuttingDown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Coordinator is shut down"));
        }
        CompletableFuture<HealthStatus> result = new CompletableFuture<>();
        try {
            loop.execute(() -> fanOut(new AggregationRequest(requestId, localStatus, result)));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new IllegalStateException("Coordinator is shut down", e));
        }
        return result;
    }

    private void fanOut(AggregationRequest request) {
        if (terminated.isDone()) {
            request.fail(new IllegalStateException("Coordinator is shut down"));
            return;
        }
        try {
            table.register(request);
        } catch (IllegalStateException e) {
            request.fail(e);
            return;
        }

        GetStatsRequest message = new GetStatsRequest(request.requestId());
        for (WorkerPeer worker : transport.workers()) {
            // an abruptly exited worker can still be listed
            if (worker.isConnected() && send(worker, message)) {
                request.expectReply();
            }
        }

        if (request.pendingCount() == 0) {
            log.debug("No connected workers for health request {}", request.requestId());
            table.remove(request);
            resolve(request, request.mergedStatus(), Outcome.NO_WORKERS);
            return;
        }

        request.armTimer(loop.schedule(() -> onTimeout(request), timeoutMs, TimeUnit.MILLISECONDS));
        log.debug("Health request {} sent to {} workers", request.requestId(), request.pendingCount());
    }

    private boolean send(WorkerPeer worker, GetStatsRequest message) {
        try {
            return worker.send(message);
        } catch (RuntimeException e) {
            log.warn("Failed to send health request {} to worker {}", message.requestId(), worker.id(), e);
            return false;
        }
    }

    private void onMessage(WorkerPeer from, ClusterMessage message) {
        if (!(message instanceof GetStatsResponse response)) {
            return;
        }
        try {
            loop.execute(() -> onResponse(from, response));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping reply to health request {} from worker {} after shutdown",
                    response.requestId(), from.id());
        }
    }

    private void onResponse(WorkerPeer from, GetStatsResponse response) {
        AggregationRequest request = table.get(response.requestId());
        if (request == null) {
            log.debug("Ignoring reply from worker {} to resolved health request {}",
                    from.id(), response.requestId());
            return;
        }

        if (response.failed()) {
            table.remove(request);
            log.warn("Worker {} failed health request {}: {}", from.id(), request.requestId(), response.error());
            fail(request, new WorkerFailureException(request.requestId(), from.id(), response.error()),
                    Outcome.WORKER_ERROR);
            return;
        }

        if (request.mergeReply(response.healthStatus())) {
            table.remove(request);
            resolve(request, request.mergedStatus(), Outcome.SUCCESS);
        }
    }

    private void onTimeout(AggregationRequest request) {
        if (!table.remove(request)) {
            return;
        }
        log.warn("Health request {} timed out after {}ms with {} replies outstanding",
                request.requestId(), timeoutMs, request.pendingCount());
        fail(request, new AggregationTimeoutException(request.requestId(), timeoutMs, request.pendingCount()),
                Outcome.TIMEOUT);
    }

    private void resolve(AggregationRequest request, HealthStatus status, Outcome outcome) {
        if (request.fulfill(status)) {
            metrics.record(outcome, request.elapsed());
        }
        terminateIfDrained();
    }

    private void fail(AggregationRequest request, AggregationException error, Outcome outcome) {
        if (request.fail(error)) {
            metrics.record(outcome, request.elapsed());
        }
        terminateIfDrained();
    }

    /**
     * Stops accepting new requests. Requests already in flight still complete or time out; the
     * returned future completes once the last of them has been resolved and the loop has stopped.
     */
    public CompletableFuture<Void> shutdown() {
        if (!shuttingDown) {
            shuttingDown = true;
            log.info("Shutting down aggregation coordinator");
            try {
                loop.execute(this::terminateIfDrained);
            } catch (RejectedExecutionException e) {
                terminated.complete(null);
            }
        }
        return terminated;
    }

    private void terminateIfDrained() {
        if (shuttingDown && table.isEmpty() && !terminated.isDone()) {
            transport.removeMessageHandler(handler);
            loop.shutdown();
            terminated.complete(null);
            log.info("Aggregation coordinator stopped");
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Returns the number of requests currently in flight.
     */
    public int activeRequestCount() {
        try {
            return CompletableFuture.supplyAsync(table::size, loop).join();
        } catch (RejectedExecutionException e) {
            // the loop only stops once the table is empty
            return 0;
        }
    }

    public boolean isShutdown() {
        return shuttingDown;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
