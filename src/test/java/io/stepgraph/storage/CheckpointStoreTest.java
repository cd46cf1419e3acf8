package io.stepgraph.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.RunSummary;
import io.stepgraph.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

final class CheckpointStoreTest {

    @Test
    void ensureSchemaIsIdempotentAndToleratesConcurrentCallers() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-schema-")) {
            fx.store.ensureSchema();
            fx.store.ensureSchema();

            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                CyclicBarrier barrier = new CyclicBarrier(4);
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    futures.add(pool.submit(() -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        fx.reopen().ensureSchema();
                        return null;
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            List<Database.SchemaMigrationRow> migrations = fx.database.listSchemaMigrations(50);
            Assertions.assertEquals(1, migrations.size());
            Assertions.assertEquals("20261019_001_checkpoint_written_index", migrations.get(0).version());
            Assertions.assertTrue(migrations.get(0).success());
        }
    }

    @Test
    void appendThenLoadLatestReturnsNewestCheckpoint() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-append-")) {
            Assertions.assertTrue(fx.store.loadLatest("run-1").isEmpty());

            fx.store.append("run-1", 0, state("count", 1), "intake");
            fx.store.append("run-1", 1, state("count", 2), "enrich");
            Checkpoint written = fx.store.append("run-1", 2, state("count", 3), "finalize");
            Assertions.assertEquals(2L, written.sequence());

            Optional<Checkpoint> latest = fx.store.loadLatest("run-1");
            Assertions.assertTrue(latest.isPresent());
            Assertions.assertEquals(2L, latest.get().sequence());
            Assertions.assertEquals("finalize", latest.get().producedBy());
            Assertions.assertEquals(3, latest.get().state().path("count").asInt());
            Assertions.assertNotNull(latest.get().writtenAt());
        }
    }

    @Test
    void appendFromAnotherWriterAtTakenSequenceConflicts() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-conflict-")) {
            fx.store.append("run-c", 0, state("owner", "a"), "intake", "writer-a");

            ConflictException conflict = Assertions.assertThrows(ConflictException.class,
                    () -> fx.store.append("run-c", 0, state("owner", "b"), "intake", "writer-b"));
            Assertions.assertEquals("run-c", conflict.runId());
            Assertions.assertEquals(0L, conflict.sequence());
            Assertions.assertEquals("writer-a", conflict.winnerWriterId());

            Checkpoint latest = fx.store.loadLatest("run-c").orElseThrow();
            Assertions.assertEquals("a", latest.state().path("owner").asText());
            Assertions.assertEquals("writer-a", latest.writerId());
        }
    }

    @Test
    void retriedAppendBySameWriterIsAcceptedOnce() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-retry-")) {
            fx.store.append("run-r", 0, state("v", 1), "intake", "writer-x");
            Checkpoint again = fx.store.append("run-r", 0, state("v", 1), "intake", "writer-x");

            Assertions.assertEquals(0L, again.sequence());
            Assertions.assertEquals("writer-x", again.writerId());
            List<Checkpoint> all = toList(fx.store.listCheckpoints("run-r"));
            Assertions.assertEquals(1, all.size());
        }
    }

    @Test
    void appendThatWouldLeaveAGapIsRejected() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-gap-")) {
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append("run-g", 1, state("v", 1), "intake"));

            fx.store.append("run-g", 0, state("v", 1), "intake");
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append("run-g", 2, state("v", 3), "finalize"));
            Assertions.assertEquals(0L, fx.store.loadLatest("run-g").orElseThrow().sequence());
        }
    }

    @Test
    void appendValidatesArguments() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-args-")) {
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append(" ", 0, state("v", 1), "intake"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append("run-a", -1, state("v", 1), "intake"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append("run-a", 0, null, "intake"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> fx.store.append("run-a", 0, state("v", 1), ""));
            Assertions.assertThrows(IllegalArgumentException.class, () -> fx.store.loadLatest(null));
        }
    }

    @Test
    void storedStateIsIsolatedFromCallerMutation() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-isolation-")) {
            ObjectNode original = state("items", 1);
            fx.store.append("run-i", 0, original, "intake");
            original.put("items", 99);

            Checkpoint loaded = fx.store.loadLatest("run-i").orElseThrow();
            loaded.state().put("items", 42);

            Assertions.assertEquals(1, fx.store.loadLatest("run-i").orElseThrow().state().path("items").asInt());
            Assertions.assertEquals(1, loaded.state().path("items").asInt());
        }
    }

    @Test
    void listCheckpointsPagesInOrderAndCanBeRestarted() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-list-", c -> c.withPageSize(2))) {
            for (int i = 0; i < 5; i++) {
                fx.store.append("run-l", i, state("i", i), "step-" + i);
            }
            fx.store.append("other", 0, state("i", 0), "step-0");

            Iterable<Checkpoint> listing = fx.store.listCheckpoints("run-l");
            Assertions.assertEquals(List.of(0L, 1L, 2L, 3L, 4L), sequences(listing));
            Assertions.assertEquals(List.of(0L, 1L, 2L, 3L, 4L), sequences(listing));

            fx.store.append("run-l", 5, state("i", 5), "step-5");
            Assertions.assertEquals(6, sequences(listing).size());

            Assertions.assertFalse(fx.store.listCheckpoints("missing").iterator().hasNext());
        }
    }

    @Test
    void listRunsReportsLatestCheckpointPerRun() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-runs-")) {
            fx.store.append("run-a", 0, state("v", 0), "intake");
            fx.store.append("run-a", 1, state("v", 1), "enrich");
            fx.store.append("run-b", 0, state("v", 0), "intake");

            Map<String, RunSummary> runs = fx.store.listRuns(10).stream()
                    .collect(Collectors.toMap(RunSummary::runId, Function.identity()));
            Assertions.assertEquals(2, runs.size());
            Assertions.assertEquals(1L, runs.get("run-a").latestSequence());
            Assertions.assertEquals("enrich", runs.get("run-a").lastProducedBy());
            Assertions.assertEquals(0L, runs.get("run-b").latestSequence());

            Assertions.assertEquals(1, fx.store.listRuns(1).size());
        }
    }

    @Test
    void concurrentAppendsAtSameSequenceHaveExactlyOneWinner() throws Exception {
        try (StoreFixture fx = StoreFixture.create("stepgraph-race-")) {
            int writers = 6;
            ExecutorService pool = Executors.newFixedThreadPool(writers);
            try {
                CyclicBarrier barrier = new CyclicBarrier(writers);
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int i = 0; i < writers; i++) {
                    String writerId = "writer-" + i;
                    futures.add(pool.submit(() -> {
                        barrier.await(5, TimeUnit.SECONDS);
                        try {
                            fx.store.append("run-race", 0, state("writer", writerId), "intake", writerId);
                            return true;
                        } catch (ConflictException e) {
                            return false;
                        }
                    }));
                }
                int winners = 0;
                for (Future<Boolean> f : futures) {
                    if (f.get(30, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                Assertions.assertEquals(1, winners);
            } finally {
                pool.shutdownNow();
            }
            Checkpoint latest = fx.store.loadLatest("run-race").orElseThrow();
            Assertions.assertEquals(latest.writerId(), latest.state().path("writer").asText());
        }
    }

    private static ObjectNode state(String field, Object value) {
        ObjectNode node = Jsons.newObject();
        node.set(field, Jsons.mapper().valueToTree(value));
        return node;
    }

    private static List<Long> sequences(Iterable<Checkpoint> checkpoints) {
        List<Long> out = new ArrayList<>();
        for (Checkpoint checkpoint : checkpoints) {
            out.add(checkpoint.sequence());
        }
        return out;
    }

    private static List<Checkpoint> toList(Iterable<Checkpoint> checkpoints) {
        List<Checkpoint> out = new ArrayList<>();
        checkpoints.forEach(out::add);
        return out;
    }
}
