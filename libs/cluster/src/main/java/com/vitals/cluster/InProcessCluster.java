package com.vitals.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Coordinator and workers linked inside one JVM.
 * <p>
 * Every message crosses the link in its JSON wire form, so both ends see exactly what a remote peer
 * would send. Each side reads its inbox on its own thread, which keeps messages between two ends in
 * send order. A disconnected worker stays listed in {@link #workers()} but drops all traffic.
 */
public final class InProcessCluster implements CoordinatorTransport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InProcessCluster.class);

    private final ClusterMessageCodec codec;
    private final ExecutorService coordinatorInbox;
    private final Map<String, Link> links = new ConcurrentHashMap<>();
    private final AtomicReference<MessageHandler> handler = new AtomicReference<>();

    public InProcessCluster() {
        this(new ClusterMessageCodec());
    }

    public InProcessCluster(ClusterMessageCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec must not be null");
        }
        this.codec = codec;
        this.coordinatorInbox = Executors.newSingleThreadExecutor(daemon("cluster-coordinator-inbox"));
    }

    /**
     * Connects a new worker and returns its end of the link.
     *
     * @throws IllegalStateException if a worker with this id already exists
     */
    public WorkerTransport addWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be null or blank");
        }
        Link link = new Link(workerId);
        if (links.putIfAbsent(workerId, link) != null) {
            link.inbox.shutdown();
            throw new IllegalStateException("Worker " + workerId + " already exists");
        }
        log.debug("Worker {} joined the cluster", workerId);
        return link;
    }

    /**
     * Cuts the link to a worker as if its process had exited. The worker remains listed.
     *
     * @return false if no such worker exists
     */
    public boolean disconnect(String workerId) {
        Link link = links.get(workerId);
        if (link == null) {
            return false;
        }
        link.connected = false;
        log.info("Worker {} disconnected", workerId);
        return true;
    }

    @Override
    public List<WorkerPeer> workers() {
        return List.copyOf(links.values());
    }

    @Override
    public void setMessageHandler(MessageHandler handler) {
        this.handler.set(handler);
    }

    @Override
    public boolean removeMessageHandler(MessageHandler handler) {
        return handler != null && this.handler.compareAndSet(handler, null);
    }

    private void deliverToCoordinator(Link from, String json) {
        if (!from.connected) {
            return;
        }
        MessageHandler current = handler.get();
        if (current == null) {
            log.debug("No coordinator handler, dropping message from worker {}", from.id);
            return;
        }
        codec.tryDecode(json).ifPresentOrElse(
                message -> {
                    try {
                        current.onMessage(from, message);
                    } catch (RuntimeException e) {
                        log.error("Coordinator handler failed on message from worker {}", from.id, e);
                    }
                },
                () -> log.warn("Dropping unrecognized message from worker {}", from.id));
    }

    @Override
    public void close() {
        links.values().forEach(link -> {
            link.connected = false;
            link.inbox.shutdownNow();
        });
        coordinatorInbox.shutdownNow();
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class Link implements WorkerPeer, WorkerTransport {

        private final String id;
        private final ExecutorService inbox;
        private final List<Consumer<ClusterMessage>> listeners = new CopyOnWriteArrayList<>();
        private volatile boolean connected = true;

        private Link(String id) {
            this.id = id;
            this.inbox = Executors.newSingleThreadExecutor(daemon("cluster-worker-" + id));
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String workerId() {
            return id;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        /** Coordinator to worker. */
        @Override
        public boolean send(ClusterMessage message) {
            if (!connected) {
                return false;
            }
            String json = codec.encode(message);
            try {
                inbox.execute(() -> deliverToWorker(json));
                return true;
            } catch (RejectedExecutionException e) {
                log.debug("Worker {} inbox closed", id);
                return false;
            }
        }

        @Override
        public boolean sendToCoordinator(ClusterMessage message) {
            if (!connected) {
                return false;
            }
            String json = codec.encode(message);
            try {
                coordinatorInbox.execute(() -> deliverToCoordinator(this, json));
                return true;
            } catch (RejectedExecutionException e) {
                log.debug("Coordinator inbox closed, worker {} cannot send", id);
                return false;
            }
        }

        @Override
        public void addMessageListener(Consumer<ClusterMessage> listener) {
            listeners.add(listener);
        }

        @Override
        public void removeMessageListener(Consumer<ClusterMessage> listener) {
            listeners.remove(listener);
        }

        private void deliverToWorker(String json) {
            if (!connected) {
                return;
            }
            codec.tryDecode(json).ifPresentOrElse(
                    message -> listeners.forEach(listener -> {
                        try {
                            listener.accept(message);
                        } catch (RuntimeException e) {
                            log.error("Listener on worker {} failed for request {}", id, message.requestId(), e);
                        }
                    }),
                    () -> log.warn("Worker {} dropping unrecognized message", id));
        }

        @Override
        public String toString() {
            return "Worker[" + id + (connected ? "" : ", disconnected") + "]";
        }
    }
}
