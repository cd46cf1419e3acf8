package io.stepgraph.runtime;

import io.stepgraph.config.StepGraphConfig;
import io.stepgraph.graph.Graph;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.ExecutorPhase;
import io.stepgraph.model.RunOutcome;
import io.stepgraph.model.RunStatus;
import io.stepgraph.storage.CheckpointStore;
import io.stepgraph.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Long-running shell around {@link GraphExecutor}.
 *
 * <p>A dispatcher thread takes {@link WorkItem}s from a {@link WorkSource} and hands each one to
 * a fixed pool of {@code workerThreads} threads; it never takes more items than there are free
 * threads. {@link #stop(Duration)} stops taking new items, asks in-flight runs to stop at their
 * next step boundary and waits for them. The connection pool belongs to the caller, who closes
 * it only once {@link #awaitTermination(Duration)} reports that every run has returned.
 *
 * <p>Only runs that are queued or executing are tracked; finished runs leave behind their status
 * count and, for the last {@value #RECENT_OUTCOMES}, their outcome.
 */
public final class GraphWorker {
    private static final Logger log = LoggerFactory.getLogger(GraphWorker.class);
    private static final long IDLE_POLL_MS = 250L;
    static final int RECENT_OUTCOMES = 100;

    private final GraphRegistry registry;
    private final GraphExecutor executor;
    private final String workerName;
    private final int threads;
    private final Semaphore slots;
    private final CancellationToken token = CancellationToken.create();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch dispatcherDone = new CountDownLatch(1);
    private final Map<String, ExecutorPhase> phases = new ConcurrentHashMap<>();
    private final Map<RunStatus, AtomicInteger> statusCounts = new EnumMap<>(RunStatus.class);
    private final Deque<RunOutcome> recentOutcomes = new ArrayDeque<>();
    private final AtomicInteger rejected = new AtomicInteger(0);
    private final AtomicInteger storageFailures = new AtomicInteger(0);
    private final AtomicInteger runErrors = new AtomicInteger(0);
    private ExecutorService pool;
    private Thread dispatcher;

    public GraphWorker(CheckpointStore store, GraphRegistry registry, StepGraphConfig config) {
        this(store, registry, config, ExecutionListener.NONE);
    }

    public GraphWorker(CheckpointStore store, GraphRegistry registry, StepGraphConfig config, ExecutionListener listener) {
        this.registry = registry;
        this.workerName = config.workerName();
        this.threads = config.workerThreads();
        this.slots = new Semaphore(threads);
        this.executor = new GraphExecutor(store, new PhaseTracker(listener), config.maxStepsPerRun());
        for (RunStatus status : RunStatus.values()) {
            statusCounts.put(status, new AtomicInteger(0));
        }
    }

    public synchronized void start(WorkSource source) {
        if (dispatcher != null) {
            throw new IllegalStateException("worker " + workerName + " was already started");
        }
        AtomicInteger counter = new AtomicInteger(0);
        pool = Executors.newFixedThreadPool(threads,
                r -> new Thread(r, workerName + "-run-" + counter.incrementAndGet()));
        running.set(true);
        dispatcher = new Thread(() -> dispatch(source), workerName + "-dispatcher");
        dispatcher.start();
        log.info("Worker {} started with {} thread(s)", workerName, threads);
    }

    /**
     * Waits until a finite source is used up and every run taken from it has returned.
     *
     * @return false when the timeout elapsed first
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (!dispatcherDone.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            return false;
        }
        long remaining = Math.max(0L, deadline - System.nanoTime());
        if (!slots.tryAcquire(threads, remaining, TimeUnit.NANOSECONDS)) {
            return false;
        }
        slots.release(threads);
        return true;
    }

    /**
     * Stops taking work, cancels in-flight runs between steps and waits up to {@code grace} for
     * them to return. Running steps are never interrupted, and a run that outlasts {@code grace}
     * keeps running; follow up with {@link #awaitTermination(Duration)} before releasing the store.
     *
     * @return true when every in-flight run returned within {@code grace}
     */
    public synchronized boolean stop(Duration grace) {
        if (dispatcher == null || !running.get()) {
            return true;
        }
        log.info("Worker {} stopping, {} run(s) in flight", workerName, activeRuns());
        token.cancel();
        running.set(false);
        dispatcher.interrupt();
        pool.shutdown();
        try {
            dispatcher.join(grace.toMillis() + 1L);
            boolean drained = pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                log.warn("Worker {} grace period of {}ms ran out with {} run(s) still in flight",
                        workerName, grace.toMillis(), activeRuns());
            } else {
                log.info("Worker {} stopped", workerName);
            }
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits for runs still in flight after {@link #stop(Duration)}.
     *
     * @return true once every run has returned; false when the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService current;
        synchronized (this) {
            current = pool;
        }
        return current == null || current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running.get();
    }

    public int activeRuns() {
        return threads - slots.availablePermits();
    }

    /**
     * Last phase reported for {@code runId}; {@link ExecutorPhase#IDLE} while it waits for a thread.
     */
    public Optional<ExecutorPhase> phase(String runId) {
        return Optional.ofNullable(phases.get(runId));
    }

    /**
     * Outcomes of the most recently finished runs, oldest first.
     */
    public List<RunOutcome> outcomes() {
        synchronized (recentOutcomes) {
            return new ArrayList<>(recentOutcomes);
        }
    }

    public int count(RunStatus status) {
        return statusCounts.get(status).get();
    }

    public int finishedCount() {
        int total = 0;
        for (AtomicInteger value : statusCounts.values()) {
            total += value.get();
        }
        return total;
    }

    /**
     * Number of runs queued or executing.
     */
    public int trackedRuns() {
        return phases.size();
    }

    public int rejectedCount() {
        return rejected.get();
    }

    public int storageFailureCount() {
        return storageFailures.get();
    }

    public int runErrorCount() {
        return runErrors.get();
    }

    private void dispatch(WorkSource source) {
        try {
            while (running.get() && !source.isExhausted()) {
                slots.acquire();
                if (!running.get()) {
                    slots.release();
                    break;
                }
                Optional<WorkItem> item;
                try {
                    item = source.poll();
                } catch (RuntimeException e) {
                    slots.release();
                    log.error("Worker {} failed to poll its work source", workerName, e);
                    Thread.sleep(IDLE_POLL_MS);
                    continue;
                }
                if (item.isEmpty()) {
                    slots.release();
                    if (!source.isExhausted()) {
                        Thread.sleep(IDLE_POLL_MS);
                    }
                    continue;
                }
                submit(item.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            dispatcherDone.countDown();
            log.debug("Worker {} dispatcher exited", workerName);
        }
    }

    private void submit(WorkItem item) {
        phases.put(item.runId(), ExecutorPhase.IDLE);
        try {
            pool.execute(() -> runOne(item));
        } catch (RejectedExecutionException e) {
            phases.remove(item.runId());
            slots.release();
            log.warn("Worker {} is shutting down; run {} was not started", workerName, item.runId());
        }
    }

    private void runOne(WorkItem item) {
        try {
            Optional<Graph> graph = registry.find(item.graphName());
            if (graph.isEmpty()) {
                rejected.incrementAndGet();
                log.warn("Skipping run {}: no graph named '{}' is registered", item.runId(), item.graphName());
                return;
            }
            RunOutcome outcome = executor.execute(graph.get(), item.runId(), item.initialState(), token);
            record(outcome);
            log.info("Run {} finished with status {}", item.runId(), outcome.status());
        } catch (StorageException e) {
            storageFailures.incrementAndGet();
            log.error("Run {} aborted on storage failure; it can be resumed later", item.runId(), e);
        } catch (RuntimeException e) {
            runErrors.incrementAndGet();
            log.error("Run {} aborted by an unexpected error; it can be resumed later", item.runId(), e);
        } finally {
            phases.remove(item.runId());
            slots.release();
        }
    }

    private void record(RunOutcome outcome) {
        statusCounts.get(outcome.status()).incrementAndGet();
        synchronized (recentOutcomes) {
            if (recentOutcomes.size() == RECENT_OUTCOMES) {
                recentOutcomes.removeFirst();
            }
            recentOutcomes.addLast(outcome);
        }
    }

    private final class PhaseTracker implements ExecutionListener {
        private final ExecutionListener delegate;

        private PhaseTracker(ExecutionListener delegate) {
            this.delegate = delegate == null ? ExecutionListener.NONE : delegate;
        }

        @Override
        public void onPhase(String runId, ExecutorPhase phase, String step) {
            phases.put(runId, phase);
            delegate.onPhase(runId, phase, step);
        }

        @Override
        public void onCheckpoint(Checkpoint checkpoint) {
            delegate.onCheckpoint(checkpoint);
        }

        @Override
        public void onFinished(RunOutcome outcome) {
            delegate.onFinished(outcome);
        }
    }
}
