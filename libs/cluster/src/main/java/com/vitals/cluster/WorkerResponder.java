package com.vitals.cluster;

import com.vitals.cluster.ClusterMessage.GetStatsRequest;
import com.vitals.cluster.ClusterMessage.GetStatsResponse;
import com.vitals.observability.HealthCallback;
import com.vitals.observability.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Answers the coordinator's fan-out requests on a worker.
 * <p>
 * For every {@link GetStatsRequest} the worker's health callback is invoked and its outcome sent
 * back as a {@link GetStatsResponse} carrying the same request id: the status on success, the
 * error message on failure. Other messages are ignored.
 */
public final class WorkerResponder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerResponder.class);

    private final ResponderContext context;
    private final Consumer<ClusterMessage> listener;
    private final AtomicBoolean attached = new AtomicBoolean(true);

    private WorkerResponder(ResponderContext context) {
        this.context = context;
        this.listener = message -> handle(context, message);
    }

    /**
     * Starts answering requests arriving on the context's transport.
     */
    public static WorkerResponder attach(ResponderContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        WorkerResponder responder = new WorkerResponder(context);
        context.transport().addMessageListener(responder.listener);
        log.debug("Worker {} answering health requests", context.transport().workerId());
        return responder;
    }

    static void handle(ResponderContext context, ClusterMessage message) {
        if (!(message instanceof GetStatsRequest request)) {
            return;
        }
        WorkerTransport transport = context.transport();
        HealthCallback.invoke(context.healthCallback()).whenComplete((status, error) -> {
            Throwable failure = error;
            if (failure == null) {
                try {
                    reply(transport, GetStatsResponse.success(request.requestId(),
                            status == null ? HealthStatus.empty() : status));
                    return;
                } catch (RuntimeException e) {
                    failure = e;
                }
            }
            String reason = describe(failure);
            log.warn("Health request {} failed on worker {}: {}", request.requestId(), transport.workerId(), reason);
            try {
                reply(transport, GetStatsResponse.failure(request.requestId(), reason));
            } catch (RuntimeException e) {
                log.error("Worker {} could not report failure of health request {}",
                        transport.workerId(), request.requestId(), e);
            }
        });
    }

    private static void reply(WorkerTransport transport, GetStatsResponse response) {
        if (!transport.sendToCoordinator(response)) {
            log.warn("Worker {} could not reply to health request {}: coordinator unreachable",
                    transport.workerId(), response.requestId());
        }
    }

    static String describe(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getName() : message;
    }

    public String workerId() {
        return context.transport().workerId();
    }

    /**
     * Stops answering requests. Replies already being computed are still sent.
     */
    @Override
    public void close() {
        if (attached.compareAndSet(true, false)) {
            context.transport().removeMessageListener(listener);
        }
    }
}
