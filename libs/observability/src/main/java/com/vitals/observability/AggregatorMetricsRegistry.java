package com.vitals.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordinator-side registry that, besides its own meters, collects the meters of every worker.
 * <p>
 * Each worker obtains its own {@link MetricsRegistry} through {@link #registerWorker(String)}.
 * Meters registered there are written to a per-worker Prometheus registry and, tagged with
 * {@code worker=<id>}, to a shared cluster registry. {@link #clusterMetrics()} renders that shared
 * registry, i.e. the meters of all workers side by side. The coordinator's own meters (the ones
 * registered on {@link #meterRegistry()}) are not part of the cluster snapshot.
 */
public final class AggregatorMetricsRegistry extends PrometheusMetricsRegistry {

    /** Tag key identifying the worker a meter belongs to in the cluster snapshot. */
    public static final String TAG_WORKER = "worker";

    private final PrometheusMeterRegistry cluster = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    private final Map<String, WorkerMetricsRegistry> workers = new ConcurrentHashMap<>();

    /**
     * Returns the registry for the given worker, creating it on first use.
     *
     * @param workerId worker identifier used as the {@code worker} tag value
     */
    public MetricsRegistry registerWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be null or blank");
        }
        return workers.computeIfAbsent(workerId, id -> new WorkerMetricsRegistry(id, cluster));
    }

    /**
     * Returns the identifiers of all registered workers.
     */
    public Set<String> workerIds() {
        return Set.copyOf(workers.keySet());
    }

    /**
     * Renders the meters of every registered worker.
     */
    public CompletableFuture<String> clusterMetrics() {
        return scrape(cluster);
    }

    @Override
    public void close() {
        workers.values().forEach(WorkerMetricsRegistry::close);
        cluster.close();
        super.close();
    }

    private static final class WorkerMetricsRegistry implements MetricsRegistry {

        private final PrometheusMeterRegistry local = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        private final CompositeMeterRegistry composite = new CompositeMeterRegistry();
        private final PrometheusMeterRegistry cluster;

        WorkerMetricsRegistry(String workerId, PrometheusMeterRegistry cluster) {
            this.cluster = cluster;
            composite.config().commonTags(TAG_WORKER, workerId);
            composite.add(local);
            composite.add(cluster);
        }

        @Override
        public MeterRegistry meterRegistry() {
            return composite;
        }

        @Override
        public CompletableFuture<String> metrics() {
            return scrape(local);
        }

        @Override
        public String contentType() {
            return CONTENT_TYPE;
        }

        void close() {
            // the cluster registry is shared and closed by the owner
            composite.remove(cluster);
            composite.close();
            local.close();
        }
    }
}
