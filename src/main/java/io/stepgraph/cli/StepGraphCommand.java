package io.stepgraph.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.config.StepGraphConfig;
import io.stepgraph.graph.Graph;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.RunOutcome;
import io.stepgraph.model.RunStatus;
import io.stepgraph.observability.AuditLogger;
import io.stepgraph.runtime.GraphExecutor;
import io.stepgraph.runtime.GraphRegistry;
import io.stepgraph.runtime.GraphWorker;
import io.stepgraph.runtime.WorkItem;
import io.stepgraph.runtime.WorkSource;
import io.stepgraph.sample.ExampleGraph;
import io.stepgraph.storage.CheckpointStore;
import io.stepgraph.storage.ConnectionPool;
import io.stepgraph.storage.Database;
import io.stepgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "stepgraph",
        mixinStandardHelpOptions = true,
        description = "Stateful graph worker with durable checkpoints",
        subcommands = {
                StepGraphCommand.InitCommand.class,
                StepGraphCommand.RunCommand.class,
                StepGraphCommand.WorkerCommand.class,
                StepGraphCommand.CheckpointsCommand.class,
                StepGraphCommand.LatestCommand.class,
                StepGraphCommand.RunsCommand.class,
                StepGraphCommand.GraphsCommand.class,
                StepGraphCommand.SchemaMigrationsCommand.class
        }
)
public final class StepGraphCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(StepGraphCommand.class);

    @Option(names = {"--root"}, description = "Data root directory (holds .env, the SQLite file and the audit log)", defaultValue = "data")
    String root;

    @Option(names = {"--database-url"}, description = "Overrides STEPGRAPH_DATABASE_URL / DATABASE_URL")
    String databaseUrl;

    @Option(names = {"--debug"}, defaultValue = "false", description = "Log at DEBUG level")
    boolean debug;

    private final GraphRegistry registry;

    public StepGraphCommand() {
        this(defaultRegistry());
    }

    public StepGraphCommand(GraphRegistry registry) {
        this.registry = registry;
    }

    public static GraphRegistry defaultRegistry() {
        return new GraphRegistry().register(ExampleGraph.create());
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | worker | checkpoints | latest | runs | graphs | schema-migrations");
    }

    StepGraphConfig config() {
        StepGraphConfig config = StepGraphConfig.fromEnvironment(root);
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            config = config.withDatabaseUrl(databaseUrl);
        }
        if (debug) {
            config = config.withDebug(true);
        }
        applyLogLevel(config.debug());
        return config;
    }

    Session open() {
        return Session.open(config());
    }

    static void applyLogLevel(boolean debug) {
        if (LoggerFactory.getLogger("io.stepgraph") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(debug ? Level.DEBUG : Level.INFO);
        }
    }

    /**
     * Reads a JSON array of {@code {"graph": ..., "run_id": ..., "input": {...}}} objects.
     * {@code graph} defaults to the example graph.
     */
    static List<WorkItem> readWorkItems(Path file) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read work items from " + file + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Work item file must contain a JSON array: " + file);
        }
        List<WorkItem> items = new ArrayList<>();
        for (JsonNode entry : root) {
            String graph = entry.path("graph").asText(ExampleGraph.NAME);
            String runId = entry.path("run_id").asText("");
            JsonNode input = entry.get("input");
            ObjectNode initial = input instanceof ObjectNode object ? object : null;
            items.add(new WorkItem(graph, runId, initial));
        }
        return items;
    }

    /**
     * Connection pool, store adapter and checkpoint store for one command invocation.
     */
    static final class Session implements AutoCloseable {
        final StepGraphConfig config;
        final ConnectionPool pool;
        final Database database;
        final CheckpointStore store;

        private Session(StepGraphConfig config, ConnectionPool pool) {
            this.config = config;
            this.pool = pool;
            this.database = new Database(pool, config);
            this.store = new CheckpointStore(database, config.pageSize());
        }

        static Session open(StepGraphConfig config) {
            ConnectionPool pool = ConnectionPool.open(config);
            Session session = new Session(config, pool);
            try {
                session.database.init();
                session.store.ensureSchema();
                return session;
            } catch (RuntimeException e) {
                pool.close();
                throw e;
            }
        }

        AuditLogger auditLogger() {
            return new AuditLogger(config.auditDir().resolve("audit.log"), config.workerName());
        }

        @Override
        public void close() {
            pool.close();
        }
    }

    @Command(name = "init", description = "Create the data root and the checkpoint schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", session.config.rootDir().toString());
                out.put("database", session.config.redactedDatabaseUrl());
                out.put("schema", "ready");
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Run (or resume) one run of a registered graph in this process")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--graph"}, defaultValue = ExampleGraph.NAME, description = "Registered graph name")
        String graphName;

        @Option(names = {"--run-id"}, required = true, description = "Run identifier; reusing one resumes it")
        String runId;

        @Option(names = {"--input"}, description = "Initial state as a JSON object; used only for a new run")
        String input;

        @Override
        public Integer call() {
            Optional<Graph> graph = parent.registry.find(graphName);
            if (graph.isEmpty()) {
                System.err.println("Unknown graph: " + graphName + " (registered: " + parent.registry.names() + ")");
                return 2;
            }
            ObjectNode initial = input != null
                    ? Jsons.parseObject(input)
                    : ExampleGraph.NAME.equals(graphName) ? ExampleGraph.initialState() : Jsons.newObject();
            try (Session session = parent.open()) {
                GraphExecutor executor = new GraphExecutor(
                        session.store,
                        session.auditLogger().listener(),
                        session.config.maxStepsPerRun()
                );
                RunOutcome outcome = executor.execute(graph.get(), runId, initial);
                System.out.println(Jsons.toJson(outcome));
                return outcome.hasFailed() ? 1 : 0;
            }
        }
    }

    @Command(name = "worker", description = "Run the worker over a file of work items until drained or signalled")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--items"}, description = "JSON array of work items; defaults to one example run")
        Path items;

        @Option(names = {"--run-id"}, defaultValue = "example-thread-1", description = "Run id of the default example run")
        String runId;

        @Option(names = {"--wait"}, defaultValue = "false",
                description = "Keep running after the items are drained until SIGTERM/SIGINT")
        boolean waitForSignal;

        @Option(names = {"--graceful-timeout-ms"}, defaultValue = "30000",
                description = "Grace period for in-flight runs on shutdown; longer steps are still awaited before the pool closes")
        long gracefulTimeoutMs;

        @Override
        public Integer call() throws Exception {
            List<WorkItem> work = items != null
                    ? readWorkItems(items)
                    : List.of(new WorkItem(ExampleGraph.NAME, runId, ExampleGraph.initialState()));
            AtomicBoolean running = new AtomicBoolean(true);
            CountDownLatch cleanedUp = new CountDownLatch(1);
            long grace = Math.max(0L, gracefulTimeoutMs);
            Thread hook = new Thread(() -> {
                log.info("Shutdown requested");
                running.set(false);
                try {
                    cleanedUp.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "stepgraph-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            try (Session session = parent.open()) {
                StepGraphConfig config = session.config;
                log.info("Starting {}", config.workerName());
                log.info("Database URL: {}", config.redactedDatabaseUrl());
                log.info("Debug mode: {}", config.debug());
                GraphWorker worker = new GraphWorker(
                        session.store,
                        parent.registry,
                        config,
                        session.auditLogger().listener()
                );
                worker.start(WorkSource.of(work));
                while (running.get()) {
                    boolean drained = worker.awaitDrained(Duration.ofMillis(200));
                    if (drained && !waitForSignal) {
                        break;
                    }
                    if (drained) {
                        Thread.sleep(200L);
                    }
                }
                boolean clean = worker.stop(Duration.ofMillis(grace));
                while (!worker.awaitTermination(Duration.ofSeconds(5))) {
                    log.warn("Waiting for {} run(s) to finish their current step before releasing the pool",
                            worker.activeRuns());
                }
                WorkerSummary summary = WorkerSummary.of(config.workerName(), worker, clean);
                System.out.println(Jsons.toJson(summary));
                return summary.failed() + summary.storageFailures() + summary.runErrors() > 0 ? 1 : 0;
            } finally {
                cleanedUp.countDown();
                if (running.get()) {
                    try {
                        Runtime.getRuntime().removeShutdownHook(hook);
                    } catch (IllegalStateException e) {
                        log.debug("Shutdown already in progress");
                    }
                }
            }
        }
    }

    public record WorkerSummary(
            String worker,
            int completed,
            int cancelled,
            int superseded,
            int failed,
            int rejected,
            int storageFailures,
            int runErrors,
            boolean stoppedCleanly,
            List<RunOutcome> recentOutcomes
    ) {
        static WorkerSummary of(String workerName, GraphWorker worker, boolean stoppedCleanly) {
            return new WorkerSummary(
                    workerName,
                    worker.count(RunStatus.COMPLETED),
                    worker.count(RunStatus.CANCELLED),
                    worker.count(RunStatus.SUPERSEDED),
                    worker.count(RunStatus.FAILED),
                    worker.rejectedCount(),
                    worker.storageFailureCount(),
                    worker.runErrorCount(),
                    stoppedCleanly,
                    worker.outcomes()
            );
        }
    }

    @Command(name = "checkpoints", description = "List the checkpoints of one run, oldest first")
    static final class CheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run identifier")
        String runId;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max rows to print; 0 prints all")
        int limit;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                List<Checkpoint> out = new ArrayList<>();
                for (Checkpoint checkpoint : session.store.listCheckpoints(runId)) {
                    if (limit > 0 && out.size() >= limit) {
                        break;
                    }
                    out.add(checkpoint);
                }
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "latest", description = "Show the latest checkpoint of one run")
    static final class LatestCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run identifier")
        String runId;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                Optional<Checkpoint> latest = session.store.loadLatest(runId);
                if (latest.isEmpty()) {
                    System.err.println("No checkpoint for run: " + runId);
                    return 1;
                }
                System.out.println(Jsons.toJson(latest.get()));
                return 0;
            }
        }
    }

    @Command(name = "runs", description = "List recently updated runs with their latest checkpoint")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                System.out.println(Jsons.toJson(session.store.listRuns(limit)));
                return 0;
            }
        }
    }

    @Command(name = "graphs", description = "List registered graphs")
    static final class GraphsCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.registry.names()));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        StepGraphCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try (Session session = parent.open()) {
                System.out.println(Jsons.toJson(session.database.listSchemaMigrations(limit)));
                return 0;
            }
        }
    }
}
