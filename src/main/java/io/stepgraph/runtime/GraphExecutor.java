package io.stepgraph.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.graph.Graph;
import io.stepgraph.graph.Node;
import io.stepgraph.graph.RunState;
import io.stepgraph.graph.StateUpdate;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.ExecutorPhase;
import io.stepgraph.model.FailureKind;
import io.stepgraph.model.RunOutcome;
import io.stepgraph.storage.CheckpointStore;
import io.stepgraph.storage.ConflictException;
import io.stepgraph.storage.StorageException;
import io.stepgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Drives one run of a {@link Graph} against a {@link CheckpointStore}.
 *
 * <p>Each {@code execute} call resumes from the latest checkpoint (or starts from the initial
 * state), then loops: run the step, reduce its update into a private copy of the state, append
 * the next checkpoint, route to the next step. Losing an append race to another executor ends
 * the call quietly with {@link io.stepgraph.model.RunStatus#SUPERSEDED}.
 *
 * <p>Only {@link StorageException} escapes; every other failure is reported in the outcome.
 * The executor itself is stateless and may serve many runs concurrently.
 */
public final class GraphExecutor {
    private static final Logger log = LoggerFactory.getLogger(GraphExecutor.class);

    private final CheckpointStore store;
    private final ExecutionListener listener;
    private final int defaultMaxSteps;

    public GraphExecutor(CheckpointStore store) {
        this(store, ExecutionListener.NONE, 0);
    }

    /**
     * @param defaultMaxSteps step guard for graphs that do not set their own; 0 disables it
     */
    public GraphExecutor(CheckpointStore store, ExecutionListener listener, int defaultMaxSteps) {
        this.store = store;
        this.listener = listener == null ? ExecutionListener.NONE : listener;
        this.defaultMaxSteps = Math.max(0, defaultMaxSteps);
    }

    public RunOutcome execute(Graph graph, String runId, ObjectNode initialState) {
        return execute(graph, runId, initialState, CancellationToken.create());
    }

    public RunOutcome execute(Graph graph, String runId, ObjectNode initialState, CancellationToken token) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        try {
            RunOutcome outcome = run(graph, runId, initialState, token);
            listener.onPhase(runId, outcome.hasFailed() ? ExecutorPhase.FAILED : ExecutorPhase.TERMINATED, null);
            listener.onFinished(outcome);
            return outcome;
        } catch (StorageException e) {
            log.error("Run {} stopped on storage failure: {}", runId, e.getMessage());
            listener.onPhase(runId, ExecutorPhase.FAILED, null);
            throw e;
        }
    }

    private RunOutcome run(Graph graph, String runId, ObjectNode initialState, CancellationToken token) {
        String writerId = "exec_" + UUID.randomUUID();
        int stepLimit = graph.maxSteps() > 0 ? graph.maxSteps() : defaultMaxSteps;

        listener.onPhase(runId, ExecutorPhase.LOADING, null);
        Optional<Checkpoint> latest = store.loadLatest(runId);
        ObjectNode state;
        long lastSequence;
        String previous;
        if (latest.isPresent()) {
            Checkpoint checkpoint = latest.get();
            state = checkpoint.state();
            lastSequence = checkpoint.sequence();
            previous = checkpoint.producedBy();
            log.info("Resuming run {} of graph {} after checkpoint {} ({})",
                    runId, graph.name(), lastSequence, previous);
        } else {
            state = initialState == null ? Jsons.newObject() : initialState.deepCopy();
            lastSequence = -1L;
            previous = Graph.START;
            log.info("Starting run {} of graph {}", runId, graph.name());
        }

        int stepsExecuted = 0;
        String current;
        try {
            current = graph.route(previous, new RunState(runId, state));
        } catch (RuntimeException e) {
            return invalidTransition(runId, previous, "routing failed: " + e.getMessage(), state, lastSequence, 0);
        }

        while (true) {
            if (Graph.END.equals(current)) {
                log.info("Run {} completed at checkpoint {}", runId, lastSequence);
                return RunOutcome.completed(runId, state, lastSequence, stepsExecuted);
            }
            Optional<Node> node = graph.node(current);
            if (node.isEmpty()) {
                return invalidTransition(runId, previous, "unknown step '" + current + "'",
                        state, lastSequence, stepsExecuted);
            }
            if (token.isCancelled()) {
                log.info("Run {} cancelled before step {}, resumable from checkpoint {}", runId, current, lastSequence);
                return RunOutcome.cancelled(runId, state, lastSequence, stepsExecuted);
            }
            long sequence = lastSequence + 1;
            if (stepLimit > 0 && sequence >= stepLimit) {
                log.warn("Run {} exceeded the step limit of {} before step {}", runId, stepLimit, current);
                return RunOutcome.failed(runId, FailureKind.STEP_LIMIT_EXCEEDED, current,
                        "step limit of " + stepLimit + " exceeded", state, lastSequence, stepsExecuted);
            }

            listener.onPhase(runId, ExecutorPhase.RUNNING, current);
            StateUpdate update;
            try {
                update = node.get().apply(new RunState(runId, state));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return stepFailed(runId, current, e, state, lastSequence, stepsExecuted);
            } catch (Exception e) {
                return stepFailed(runId, current, e, state, lastSequence, stepsExecuted);
            }

            ObjectNode next = state.deepCopy();
            try {
                graph.reduce(next, update == null ? StateUpdate.empty() : update);
            } catch (RuntimeException e) {
                return stepFailed(runId, current, e, state, lastSequence, stepsExecuted);
            }

            listener.onPhase(runId, ExecutorPhase.PERSISTING, current);
            Checkpoint checkpoint;
            try {
                checkpoint = store.append(runId, sequence, next, current, writerId);
            } catch (ConflictException e) {
                log.info("Run {} was advanced past checkpoint {} by {}; abandoning this attempt",
                        runId, sequence, e.winnerWriterId());
                return RunOutcome.superseded(runId, state, lastSequence, stepsExecuted);
            }
            listener.onCheckpoint(checkpoint);
            log.debug("Run {} persisted checkpoint {} from step {}", runId, sequence, current);

            state = next;
            lastSequence = sequence;
            stepsExecuted++;
            previous = current;
            try {
                current = graph.route(previous, new RunState(runId, state));
            } catch (RuntimeException e) {
                return invalidTransition(runId, previous, "routing failed: " + e.getMessage(),
                        state, lastSequence, stepsExecuted);
            }
        }
    }

    private RunOutcome stepFailed(String runId, String step, Exception e, ObjectNode state, long lastSequence, int steps) {
        log.warn("Run {} failed in step {}: {}", runId, step, e.toString());
        String message = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
        return RunOutcome.failed(runId, FailureKind.STEP_ERROR, step, message, state, lastSequence, steps);
    }

    private RunOutcome invalidTransition(String runId, String from, String reason, ObjectNode state, long lastSequence, int steps) {
        log.warn("Run {} has an invalid transition out of {}: {}", runId, from, reason);
        return RunOutcome.failed(runId, FailureKind.INVALID_TRANSITION, from,
                "invalid transition from '" + from + "': " + reason, state, lastSequence, steps);
    }
}
