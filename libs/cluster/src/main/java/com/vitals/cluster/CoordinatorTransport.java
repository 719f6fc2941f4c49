package com.vitals.cluster;

import java.util.List;

/**
 * Coordinator side of the inter-process channel.
 */
public interface CoordinatorTransport {

    /**
     * Returns the workers currently known to the transport, connected or not.
     */
    List<WorkerPeer> workers();

    /**
     * Installs the handler receiving every message sent by a worker, replacing any previous one.
     * Passing {@code null} detaches the current handler.
     */
    void setMessageHandler(MessageHandler handler);

    /**
     * Detaches {@code handler} if it is still the installed one. A handler installed later by
     * another owner is left in place.
     *
     * @return whether the handler was detached
     */
    boolean removeMessageHandler(MessageHandler handler);

    /**
     * Receives messages sent by workers. Messages from one worker arrive in send order; messages
     * from different workers may interleave and may arrive on any thread.
     */
    @FunctionalInterface
    interface MessageHandler {
        void onMessage(WorkerPeer from, ClusterMessage message);
    }
}
