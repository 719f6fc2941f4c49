package com.vitals.cluster;

/**
 * The coordinator's handle on one worker.
 */
public interface WorkerPeer {

    /** Stable identifier of the worker. */
    String id();

    /**
     * Whether the worker can currently receive messages. A worker that exited abruptly may still
     * be listed by the transport while reporting {@code false} here.
     */
    boolean isConnected();

    /**
     * Sends a message to the worker. Messages to one worker are delivered in send order.
     *
     * @return false if the worker is no longer connected and the message was not sent
     */
    boolean send(ClusterMessage message);
}
