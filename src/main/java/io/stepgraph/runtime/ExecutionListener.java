package io.stepgraph.runtime;

import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.ExecutorPhase;
import io.stepgraph.model.RunOutcome;

/**
 * Observes executor progress. Callbacks run on the executing thread and must not block.
 */
public interface ExecutionListener {
    ExecutionListener NONE = new ExecutionListener() {
    };

    default void onPhase(String runId, ExecutorPhase phase, String step) {
    }

    default void onCheckpoint(Checkpoint checkpoint) {
    }

    default void onFinished(RunOutcome outcome) {
    }
}
