package com.vitals.cluster;

import com.vitals.observability.HealthCallback;

/**
 * What a worker needs to answer fan-out requests.
 *
 * @param transport      the worker's channel to the coordinator
 * @param healthCallback producer of the worker's local status
 */
public record ResponderContext(WorkerTransport transport, HealthCallback healthCallback) {

    public ResponderContext {
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        if (healthCallback == null) {
            throw new IllegalArgumentException("healthCallback must not be null");
        }
    }
}
