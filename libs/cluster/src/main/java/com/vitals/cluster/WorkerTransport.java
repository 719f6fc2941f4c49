package com.vitals.cluster;

import java.util.function.Consumer;

/**
 * Worker side of the inter-process channel.
 */
public interface WorkerTransport {

    /** Identifier of the worker this transport belongs to. */
    String workerId();

    /**
     * Sends a message to the coordinator.
     *
     * @return false if the worker is disconnected and the message was not sent
     */
    boolean sendToCoordinator(ClusterMessage message);

    /**
     * Adds a listener for messages from the coordinator. Listeners run on the worker's own
     * message thread, one message at a time.
     */
    void addMessageListener(Consumer<ClusterMessage> listener);

    /**
     * Removes a listener previously added with {@link #addMessageListener(Consumer)}.
     */
    void removeMessageListener(Consumer<ClusterMessage> listener);
}
