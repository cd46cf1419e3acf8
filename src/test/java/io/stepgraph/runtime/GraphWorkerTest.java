package io.stepgraph.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.graph.Graph;
import io.stepgraph.graph.GraphBuilder;
import io.stepgraph.graph.StateUpdate;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.ExecutorPhase;
import io.stepgraph.model.RunOutcome;
import io.stepgraph.model.RunStatus;
import io.stepgraph.storage.StoreFixture;
import io.stepgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class GraphWorkerTest {

    @Test
    void drainsFiniteSourceAcrossThreads() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-drain-")) {
            GraphRegistry registry = new GraphRegistry().register(counterGraph());
            GraphWorker worker = new GraphWorker(fx.store, registry, fx.config.withWorkerThreads(2));
            List<WorkItem> items = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                items.add(new WorkItem("counter", "run-" + i, count(i)));
            }

            worker.start(WorkSource.of(items));
            Assertions.assertTrue(worker.awaitDrained(Duration.ofSeconds(30)));
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(5)));
            Assertions.assertFalse(worker.isRunning());

            List<RunOutcome> outcomes = worker.outcomes();
            Assertions.assertEquals(5, outcomes.size());
            for (RunOutcome outcome : outcomes) {
                Assertions.assertEquals(RunStatus.COMPLETED, outcome.status());
                Assertions.assertEquals(2L, outcome.lastSequence());
            }
            Assertions.assertEquals(6, fx.store.loadLatest("run-3").orElseThrow().state().path("count").asInt());
            Assertions.assertTrue(worker.phase("run-0").isEmpty());
            Assertions.assertEquals(0, worker.trackedRuns());
            Assertions.assertEquals(5, worker.count(RunStatus.COMPLETED));
            Assertions.assertEquals(0, worker.activeRuns());
        }
    }

    @Test
    void itemsForUnknownGraphsAreRejected() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-unknown-")) {
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry().register(counterGraph()), fx.config);

            worker.start(WorkSource.of(List.of(
                    new WorkItem("missing", "run-x", null),
                    new WorkItem("counter", "run-y", null))));
            Assertions.assertTrue(worker.awaitDrained(Duration.ofSeconds(30)));
            worker.stop(Duration.ofSeconds(5));

            Assertions.assertEquals(1, worker.rejectedCount());
            Assertions.assertEquals(1, worker.outcomes().size());
            Assertions.assertTrue(worker.phase("run-x").isEmpty());
            Assertions.assertTrue(fx.store.loadLatest("run-x").isEmpty());
        }
    }

    @Test
    void stopLetsRunningStepFinishThenCancelsBeforeTheNext() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-stop-")) {
            CountDownLatch entered = new CountDownLatch(1);
            AtomicReference<GraphWorker> holder = new AtomicReference<>();
            Graph slow = new GraphBuilder("slow")
                    .addNode("first", state -> {
                        entered.countDown();
                        while (holder.get().isRunning()) {
                            Thread.sleep(10L);
                        }
                        return StateUpdate.of("first", true);
                    })
                    .addNode("second", state -> StateUpdate.of("second", true))
                    .addEdge(Graph.START, "first")
                    .addEdge("first", "second")
                    .addEdge("second", Graph.END)
                    .compile();
            GraphRegistry registry = new GraphRegistry().register(slow);
            GraphWorker worker = new GraphWorker(fx.store, registry, fx.config);
            holder.set(worker);

            worker.start(WorkSource.of(List.of(new WorkItem("slow", "run-slow", null))));
            Assertions.assertTrue(entered.await(10, TimeUnit.SECONDS));
            Assertions.assertEquals(Optional.of(ExecutorPhase.RUNNING), worker.phase("run-slow"));
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(10)));

            List<RunOutcome> outcomes = worker.outcomes();
            Assertions.assertEquals(1, outcomes.size());
            Assertions.assertEquals(RunStatus.CANCELLED, outcomes.get(0).status());
            Assertions.assertEquals(0L, outcomes.get(0).lastSequence());
            Assertions.assertEquals("first", fx.store.loadLatest("run-slow").orElseThrow().producedBy());

            RunOutcome resumed = new GraphExecutor(fx.store).execute(slow, "run-slow", null);
            Assertions.assertEquals(RunStatus.COMPLETED, resumed.status());
            Assertions.assertTrue(resumed.state().path("second").asBoolean());
        }
    }

    @Test
    void stepOutlastingGracePeriodStillGetsItsCheckpoint() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-overrun-")) {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Graph longStep = new GraphBuilder("long")
                    .addNode("crunch", state -> {
                        entered.countDown();
                        release.await(30, TimeUnit.SECONDS);
                        return StateUpdate.of("crunched", true);
                    })
                    .addEdge(Graph.START, "crunch")
                    .addEdge("crunch", Graph.END)
                    .compile();
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry().register(longStep), fx.config);

            worker.start(WorkSource.of(List.of(new WorkItem("long", "run-long", null))));
            Assertions.assertTrue(entered.await(10, TimeUnit.SECONDS));
            Assertions.assertFalse(worker.stop(Duration.ofMillis(100)));
            Assertions.assertFalse(worker.awaitTermination(Duration.ofMillis(50)));
            Assertions.assertEquals(1, worker.activeRuns());

            release.countDown();
            Assertions.assertTrue(worker.awaitTermination(Duration.ofSeconds(10)));

            Assertions.assertEquals(0, worker.storageFailureCount());
            Assertions.assertEquals(1, worker.count(RunStatus.COMPLETED));
            Checkpoint latest = fx.store.loadLatest("run-long").orElseThrow();
            Assertions.assertEquals("crunch", latest.producedBy());
            Assertions.assertTrue(latest.state().path("crunched").asBoolean());
        }
    }

    @Test
    void finishedRunsAreNotRetained() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-retain-")) {
            Graph single = new GraphBuilder("single")
                    .addNode("only", state -> StateUpdate.of("done", true))
                    .addEdge(Graph.START, "only")
                    .addEdge("only", Graph.END)
                    .compile();
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry().register(single),
                    fx.config.withWorkerThreads(2));
            int runs = GraphWorker.RECENT_OUTCOMES + 20;
            List<WorkItem> items = new ArrayList<>();
            for (int i = 0; i < runs; i++) {
                items.add(new WorkItem("single", "run-" + i, null));
            }

            worker.start(WorkSource.of(items));
            Assertions.assertTrue(worker.awaitDrained(Duration.ofSeconds(60)));
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(5)));

            Assertions.assertEquals(0, worker.trackedRuns());
            Assertions.assertEquals(runs, worker.count(RunStatus.COMPLETED));
            Assertions.assertEquals(runs, worker.finishedCount());
            Assertions.assertEquals(GraphWorker.RECENT_OUTCOMES, worker.outcomes().size());
        }
    }

    @Test
    void listenerErrorsAreCountedAndDoNotStopTheWorker() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-listener-")) {
            ExecutionListener failing = new ExecutionListener() {
                @Override
                public void onFinished(RunOutcome outcome) {
                    if ("run-bad".equals(outcome.runId())) {
                        throw new IllegalStateException("listener broke");
                    }
                }
            };
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry().register(counterGraph()),
                    fx.config.withWorkerThreads(1), failing);

            worker.start(WorkSource.of(List.of(
                    new WorkItem("counter", "run-bad", null),
                    new WorkItem("counter", "run-good", null))));
            Assertions.assertTrue(worker.awaitDrained(Duration.ofSeconds(30)));
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(5)));

            Assertions.assertEquals(1, worker.runErrorCount());
            Assertions.assertEquals(0, worker.storageFailureCount());
            Assertions.assertEquals(1, worker.count(RunStatus.COMPLETED));
            Assertions.assertEquals("run-good", worker.outcomes().get(0).runId());
            Assertions.assertEquals(0, worker.trackedRuns());
            Assertions.assertEquals(2L, fx.store.loadLatest("run-bad").orElseThrow().sequence());
        }
    }

    @Test
    void pollingSourcePicksUpLateWork() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-poll-")) {
            ConcurrentLinkedQueue<WorkItem> queue = new ConcurrentLinkedQueue<>();
            WorkSource polling = () -> Optional.ofNullable(queue.poll());
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry().register(counterGraph()), fx.config);

            worker.start(polling);
            Assertions.assertFalse(worker.awaitDrained(Duration.ofMillis(300)));
            queue.add(new WorkItem("counter", "run-late", count(10)));

            long deadline = System.currentTimeMillis() + 20_000L;
            while (worker.outcomes().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(5)));
            Assertions.assertEquals(1, worker.outcomes().size());
            Assertions.assertEquals(13, worker.outcomes().get(0).state().path("count").asInt());
        }
    }

    @Test
    void workerCanOnlyStartOnce() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-worker-once-")) {
            GraphWorker worker = new GraphWorker(fx.store, new GraphRegistry(), fx.config);
            Assertions.assertTrue(worker.stop(Duration.ofMillis(10)));
            worker.start(WorkSource.of(List.of()));
            Assertions.assertThrows(IllegalStateException.class, () -> worker.start(WorkSource.of(List.of())));
            Assertions.assertTrue(worker.awaitDrained(Duration.ofSeconds(5)));
            Assertions.assertTrue(worker.stop(Duration.ofSeconds(5)));
        }
    }

    @Test
    void registryRejectsDuplicateNames() {
        GraphRegistry registry = new GraphRegistry().register(counterGraph());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(counterGraph()));
        Assertions.assertEquals(List.of("counter"), new ArrayList<>(registry.names()));
        Assertions.assertTrue(registry.find("counter").isPresent());
        Assertions.assertTrue(registry.find(null).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new WorkItem("counter", " ", null));
    }

    private static Graph counterGraph() {
        return new GraphBuilder("counter")
                .addNode("intake", state -> StateUpdate.of("count", state.number("count", 0) + 1))
                .addNode("enrich", state -> StateUpdate.of("count", state.number("count", 0) + 1))
                .addNode("finalize", state -> StateUpdate.of("count", state.number("count", 0) + 1))
                .addEdge(Graph.START, "intake")
                .addEdge("intake", "enrich")
                .addEdge("enrich", "finalize")
                .addEdge("finalize", Graph.END)
                .compile();
    }

    private static ObjectNode count(int value) {
        ObjectNode node = Jsons.newObject();
        node.put("count", value);
        return node;
    }
}
