package com.vitals.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.vitals.cluster.ClusterMessage.GetStatsRequest;
import com.vitals.cluster.ClusterMessage.GetStatsResponse;
import com.vitals.observability.AggregationMetrics;
import com.vitals.observability.AggregationMetrics.Outcome;
import com.vitals.observability.HealthStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AggregationCoordinator} driven through a scripted transport, so each test
 * decides when and in which order workers reply.
 */
@DisplayName("AggregationCoordinator")
class AggregationCoordinatorTest {

    private static final HealthStatus LOCAL = HealthStatus.of("primary", "ok");

    private ScriptedTransport transport;
    private AggregationMetrics metrics;
    private AggregationCoordinator coordinator;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        metrics = new AggregationMetrics(new SimpleMeterRegistry(), "test");
        coordinator = new AggregationCoordinator(transport, 2000, metrics);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
        return future.handle((value, error) -> error).join();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should install itself as the transport handler")
        void shouldInstallHandler() {
            assertThat(transport.handler).isNotNull();
        }

        @Test
        @DisplayName("should default to a five second timeout")
        void shouldDefaultTimeout() {
            try (AggregationCoordinator defaults = new AggregationCoordinator(new ScriptedTransport())) {
                assertThat(defaults.timeoutMs()).isEqualTo(5000);
            }
        }

        @Test
        @DisplayName("should reject invalid arguments")
        void shouldRejectInvalidArguments() {
            assertThatThrownBy(() -> new AggregationCoordinator(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new AggregationCoordinator(new ScriptedTransport(), 0, metrics))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> coordinator.gather(null, 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should hand out distinct request ids")
        void shouldHandOutDistinctIds() {
            long first = coordinator.nextRequestId();
            long second = coordinator.nextRequestId();

            assertThat(second).isNotEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("should return the local status when no worker is connected")
        void shouldReturnLocalWithoutWorkers() throws Exception {
            assertThat(await(coordinator.gather(LOCAL, 1))).isEqualTo(LOCAL);
            assertThat(metrics.count(Outcome.NO_WORKERS)).isEqualTo(1);
        }

        @Test
        @DisplayName("should resolve a request without workers on the coordinator thread")
        void shouldResolveWithoutWorkersOnLoop() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            AtomicReference<String> listingThread = new AtomicReference<>();
            GatedTransport gated = new GatedTransport(release, listingThread);

            try (AggregationCoordinator gatedCoordinator = new AggregationCoordinator(gated, 2000, metrics)) {
                CompletableFuture<HealthStatus> result = gatedCoordinator.gather(LOCAL, 1);
                assertThat(result).isNotDone();
                CompletableFuture<String> completingThread =
                        result.thenApply(status -> Thread.currentThread().getName());

                release.countDown();

                assertThat(await(completingThread)).isEqualTo("aggregation-coordinator");
                assertThat(listingThread.get()).isEqualTo("aggregation-coordinator");
                assertThat(await(result)).isEqualTo(LOCAL);
                assertThat(gatedCoordinator.activeRequestCount()).isZero();
            }
        }

        @Test
        @DisplayName("should merge every worker status over the local one")
        void shouldMergeAllWorkers() throws Exception {
            ScriptedPeer a = transport.addPeer("a");
            ScriptedPeer b = transport.addPeer("b");

            CompletableFuture<HealthStatus> result = coordinator.gather(HealthStatus.of("a", 1), 5);
            a.awaitRequest();
            b.awaitRequest();
            transport.reply(a, GetStatsResponse.success(5, HealthStatus.of("b", 2)));
            assertThat(result).isNotDone();
            transport.reply(b, GetStatsResponse.success(5, HealthStatus.of("c", 3)));

            assertThat(await(result).asMap()).containsExactly(
                    Map.entry("a", 1), Map.entry("b", 2), Map.entry("c", 3));
            assertThat(metrics.count(Outcome.SUCCESS)).isEqualTo(1);
        }

        @Test
        @DisplayName("should let the last reply to arrive win on a key conflict")
        void shouldApplyRepliesInArrivalOrder() throws Exception {
            ScriptedPeer a = transport.addPeer("a");
            ScriptedPeer b = transport.addPeer("b");

            CompletableFuture<HealthStatus> result = coordinator.gather(HealthStatus.of("owner", "local"), 1);
            a.awaitRequest();
            b.awaitRequest();
            transport.reply(b, GetStatsResponse.success(1, HealthStatus.of("owner", "b")));
            transport.reply(a, GetStatsResponse.success(1, HealthStatus.of("owner", "a")));

            assertThat(await(result).get("owner")).isEqualTo("a");
        }

        @Test
        @DisplayName("should treat an empty reply as a reply")
        void shouldCountEmptyReply() throws Exception {
            ScriptedPeer a = transport.addPeer("a");

            CompletableFuture<HealthStatus> result = coordinator.gather(LOCAL, 2);
            a.awaitRequest();
            transport.reply(a, GetStatsResponse.success(2, HealthStatus.empty()));

            assertThat(await(result)).isEqualTo(LOCAL);
        }

        @Test
        @DisplayName("should keep concurrent requests apart")
        void shouldKeepRequestsApart() throws Exception {
            ScriptedPeer a = transport.addPeer("a");

            CompletableFuture<HealthStatus> first = coordinator.gather(HealthStatus.empty(), 1);
            CompletableFuture<HealthStatus> second = coordinator.gather(HealthStatus.empty(), 2);
            assertThat(a.awaitRequest().requestId()).isEqualTo(1);
            assertThat(a.awaitRequest().requestId()).isEqualTo(2);

            transport.reply(a, GetStatsResponse.success(2, HealthStatus.of("x", 2)));
            assertThat(await(second).get("x")).isEqualTo(2);
            assertThat(first).isNotDone();

            transport.reply(a, GetStatsResponse.success(1, HealthStatus.of("x", 1)));
            assertThat(await(first).get("x")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fail on the first worker error and ignore later replies")
        void shouldAbortOnWorkerError() {
            ScriptedPeer a = transport.addPeer("a");
            ScriptedPeer b = transport.addPeer("b");

            CompletableFuture<HealthStatus> result = coordinator.gather(LOCAL, 3);
            a.awaitRequest();
            b.awaitRequest();
            transport.reply(a, GetStatsResponse.failure(3, "disk unavailable"));

            Throwable error = failureOf(result);
            assertThat(error).isInstanceOf(WorkerFailureException.class).hasMessage("disk unavailable");
            assertThat(((WorkerFailureException) error).workerId()).isEqualTo("a");
            assertThat(((WorkerFailureException) error).requestId()).isEqualTo(3);

            transport.reply(b, GetStatsResponse.success(3, HealthStatus.of("b", 1)));
            assertThat(coordinator.activeRequestCount()).isZero();
            assertThat(metrics.count(Outcome.WORKER_ERROR)).isEqualTo(1);
            assertThat(metrics.count(Outcome.SUCCESS)).isZero();
        }

        @Test
        @DisplayName("should time out when a worker stays silent")
        void shouldTimeOut() {
            try (AggregationCoordinator shortDeadline = new AggregationCoordinator(transport, 100, metrics)) {
                ScriptedPeer a = transport.addPeer("a");
                ScriptedPeer b = transport.addPeer("b");

                CompletableFuture<HealthStatus> result = shortDeadline.gather(LOCAL, 4);
                a.awaitRequest();
                b.awaitRequest();
                transport.reply(a, GetStatsResponse.success(4, HealthStatus.of("a", 1)));

                Throwable error = failureOf(result);
                assertThat(error).isInstanceOf(AggregationTimeoutException.class)
                        .hasMessage("Operation timed out");
                assertThat(((AggregationTimeoutException) error).pendingReplies()).isEqualTo(1);

                transport.reply(b, GetStatsResponse.success(4, HealthStatus.of("b", 1)));
                assertThat(shortDeadline.activeRequestCount()).isZero();
                assertThat(metrics.count(Outcome.TIMEOUT)).isEqualTo(1);
                assertThat(metrics.count(Outcome.SUCCESS)).isZero();
            }
        }

        @Test
        @DisplayName("should reject a request id already in flight")
        void shouldRejectDuplicateId() {
            ScriptedPeer a = transport.addPeer("a");

            CompletableFuture<HealthStatus> first = coordinator.gather(LOCAL, 9);
            CompletableFuture<HealthStatus> duplicate = coordinator.gather(LOCAL, 9);

            assertThat(failureOf(duplicate)).isInstanceOf(IllegalStateException.class);
            a.awaitRequest();
            assertThat(a.sent).hasSize(1);
            assertThat(first).isNotDone();
        }
    }

    @Nested
    @DisplayName("Worker selection")
    class WorkerSelection {

        @Test
        @DisplayName("should skip disconnected workers")
        void shouldSkipDisconnected() throws Exception {
            ScriptedPeer a = transport.addPeer("a");
            ScriptedPeer gone = transport.addPeer("gone");
            gone.connected = false;

            CompletableFuture<HealthStatus> result = coordinator.gather(LOCAL, 1);
            a.awaitRequest();
            transport.reply(a, GetStatsResponse.success(1, HealthStatus.of("a", 1)));

            assertThat(await(result).asMap()).containsOnlyKeys("primary", "a");
            assertThat(gone.sent).isEmpty();
        }

        @Test
        @DisplayName("should skip a worker whose send throws")
        void shouldSkipThrowingWorker() throws Exception {
            WorkerPeer broken = mock(WorkerPeer.class);
            when(broken.id()).thenReturn("broken");
            when(broken.isConnected()).thenReturn(true);
            when(broken.send(any())).thenThrow(new IllegalStateException("channel closed"));
            transport.peers.add(broken);

            assertThat(await(coordinator.gather(LOCAL, 1))).isEqualTo(LOCAL);
            verify(broken).send(new GetStatsRequest(1));
            assertThat(metrics.count(Outcome.NO_WORKERS)).isEqualTo(1);
        }

        @Test
        @DisplayName("should skip a worker that refuses the message")
        void shouldSkipRefusingWorker() throws Exception {
            ScriptedPeer refusing = transport.addPeer("refusing");
            refusing.accepting = false;

            assertThat(await(coordinator.gather(LOCAL, 1))).isEqualTo(LOCAL);
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("should terminate at once when idle")
        void shouldTerminateWhenIdle() throws Exception {
            await(coordinator.shutdown());

            assertThat(coordinator.isShutdown()).isTrue();
            assertThat(transport.handler).isNull();
            assertThat(coordinator.activeRequestCount()).isZero();
        }

        @Test
        @DisplayName("should leave a handler installed by a newer coordinator in place")
        void shouldKeepSuccessorHandler() throws Exception {
            CoordinatorTransport.MessageHandler previous = transport.handler;
            AggregationCoordinator successor = new AggregationCoordinator(transport, 2000, metrics);
            CoordinatorTransport.MessageHandler installed = transport.handler;
            assertThat(installed).isNotSameAs(previous);

            await(coordinator.shutdown());

            assertThat(transport.handler).isSameAs(installed);
            ScriptedPeer a = transport.addPeer("a");
            CompletableFuture<HealthStatus> result = successor.gather(LOCAL, 1);
            a.awaitRequest();
            transport.reply(a, GetStatsResponse.success(1, HealthStatus.of("a", 1)));
            assertThat(await(result).get("a")).isEqualTo(1);

            await(successor.shutdown());
            assertThat(transport.handler).isNull();
        }

        @Test
        @DisplayName("should refuse new requests but finish those in flight")
        void shouldDrainInFlight() throws Exception {
            ScriptedPeer a = transport.addPeer("a");
            CompletableFuture<HealthStatus> inFlight = coordinator.gather(LOCAL, 1);
            a.awaitRequest();

            CompletableFuture<Void> terminated = coordinator.shutdown();
            assertThat(failureOf(coordinator.gather(LOCAL, 2))).isInstanceOf(IllegalStateException.class);
            assertThat(coordinator.activeRequestCount()).isEqualTo(1);
            assertThat(terminated).isNotDone();

            transport.reply(a, GetStatsResponse.success(1, HealthStatus.of("a", 1)));

            assertThat(await(inFlight).get("a")).isEqualTo(1);
            await(terminated);
            assertThat(transport.handler).isNull();
        }
    }

    private static final class ScriptedTransport implements CoordinatorTransport {

        private final List<WorkerPeer> peers = new CopyOnWriteArrayList<>();
        private volatile MessageHandler handler;

        ScriptedPeer addPeer(String id) {
            ScriptedPeer peer = new ScriptedPeer(id);
            peers.add(peer);
            return peer;
        }

        void reply(WorkerPeer from, ClusterMessage message) {
            MessageHandler current = handler;
            if (current != null) {
                current.onMessage(from, message);
            }
        }

        @Override
        public List<WorkerPeer> workers() {
            return List.copyOf(peers);
        }

        @Override
        public synchronized void setMessageHandler(MessageHandler handler) {
            this.handler = handler;
        }

        @Override
        public synchronized boolean removeMessageHandler(MessageHandler handler) {
            if (handler == null || this.handler != handler) {
                return false;
            }
            this.handler = null;
            return true;
        }
    }

    /** Lists no workers, but only once released, so the caller returns before the request resolves. */
    private static final class GatedTransport implements CoordinatorTransport {

        private final CountDownLatch release;
        private final AtomicReference<String> listingThread;

        private GatedTransport(CountDownLatch release, AtomicReference<String> listingThread) {
            this.release = release;
            this.listingThread = listingThread;
        }

        @Override
        public List<WorkerPeer> workers() {
            listingThread.set(Thread.currentThread().getName());
            try {
                assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of();
        }

        @Override
        public void setMessageHandler(MessageHandler handler) {
        }

        @Override
        public boolean removeMessageHandler(MessageHandler handler) {
            return false;
        }
    }

    private static final class ScriptedPeer implements WorkerPeer {

        private final String id;
        private final BlockingQueue<ClusterMessage> inbox = new LinkedBlockingQueue<>();
        private final List<ClusterMessage> sent = new CopyOnWriteArrayList<>();
        private volatile boolean connected = true;
        private volatile boolean accepting = true;

        private ScriptedPeer(String id) {
            this.id = id;
        }

        GetStatsRequest awaitRequest() {
            try {
                ClusterMessage message = inbox.poll(5, TimeUnit.SECONDS);
                assertThat(message).as("request delivered to %s", id).isInstanceOf(GetStatsRequest.class);
                return (GetStatsRequest) message;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }

        @Override
        public boolean send(ClusterMessage message) {
            if (!accepting) {
                return false;
            }
            sent.add(message);
            inbox.add(message);
            return true;
        }
    }
}
