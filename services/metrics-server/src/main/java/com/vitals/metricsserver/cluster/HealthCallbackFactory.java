package com.vitals.metricsserver.cluster;

import com.vitals.observability.HealthCallback;

/**
 * Supplies the health callback of each node, keyed by node name. The coordinator (or single
 * process) asks for the configured server name; in cluster mode each worker asks for its own id.
 */
@FunctionalInterface
public interface HealthCallbackFactory {

    HealthCallback create(String nodeName);
}
