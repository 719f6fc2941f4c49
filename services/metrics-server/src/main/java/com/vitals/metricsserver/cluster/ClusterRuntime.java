package com.vitals.metricsserver.cluster;

import com.vitals.cluster.AggregationCoordinator;
import com.vitals.cluster.InProcessCluster;
import com.vitals.cluster.ResponderContext;
import com.vitals.cluster.WorkerResponder;
import com.vitals.observability.AggregationMetrics;
import com.vitals.observability.AggregatorMetricsRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The coordinator and workers of cluster mode, or nothing at all in single-process mode.
 */
public final class ClusterRuntime {

    private static final Logger log = LoggerFactory.getLogger(ClusterRuntime.class);

    private final InProcessCluster cluster;
    private final AggregationCoordinator coordinator;
    private final List<WorkerResponder> responders;

    private ClusterRuntime(
            InProcessCluster cluster, AggregationCoordinator coordinator, List<WorkerResponder> responders) {
        this.cluster = cluster;
        this.coordinator = coordinator;
        this.responders = responders;
    }

    /** Runtime of a single process: no coordinator, no workers. */
    public static ClusterRuntime singleProcess() {
        return new ClusterRuntime(null, null, List.of());
    }

    /**
     * Starts {@code workers} in-process workers named {@code worker-1..N} and a coordinator in front
     * of them.
     *
     * @param workers number of workers
     * @param callbacks health callback of each worker
     * @param metricsRegistry coordinator registry handing out each worker's registry
     * @param nodeMetricsSetup applied once to every worker's meter registry
     * @param aggregationTimeout deadline for all workers to answer
     * @param aggregationMetrics instrumentation of the coordinator
     */
    public static ClusterRuntime start(
            int workers,
            HealthCallbackFactory callbacks,
            AggregatorMetricsRegistry metricsRegistry,
            Consumer<MeterRegistry> nodeMetricsSetup,
            Duration aggregationTimeout,
            AggregationMetrics aggregationMetrics) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive");
        }
        InProcessCluster cluster = new InProcessCluster();
        List<WorkerResponder> responders = new ArrayList<>(workers);
        for (int i = 1; i <= workers; i++) {
            String workerId = "worker-" + i;
            nodeMetricsSetup.accept(metricsRegistry.registerWorker(workerId).meterRegistry());
            ResponderContext context = new ResponderContext(cluster.addWorker(workerId), callbacks.create(workerId));
            responders.add(WorkerResponder.attach(context));
        }
        AggregationCoordinator coordinator =
                new AggregationCoordinator(cluster, aggregationTimeout.toMillis(), aggregationMetrics);
        log.info("Cluster started with {} workers, aggregation timeout {}ms", workers, coordinator.timeoutMs());
        return new ClusterRuntime(cluster, coordinator, List.copyOf(responders));
    }

    public boolean isClusterMode() {
        return coordinator != null;
    }

    public Optional<AggregationCoordinator> coordinator() {
        return Optional.ofNullable(coordinator);
    }

    public List<String> workerIds() {
        return responders.stream().map(WorkerResponder::workerId).toList();
    }

    /**
     * Detaches every worker responder and shuts the coordinator down. Aggregations in flight still
     * complete or time out; the transport is closed once the coordinator has drained.
     */
    public CompletableFuture<Void> shutdown() {
        if (coordinator == null) {
            return CompletableFuture.completedFuture(null);
        }
        responders.forEach(WorkerResponder::close);
        return coordinator.shutdown().whenComplete((ignored, error) -> {
            cluster.close();
            log.info("Cluster stopped");
        });
    }
}
