package io.stepgraph.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Terminal result of one {@code execute} call.
 *
 * @param lastSequence  sequence of the newest checkpoint this run has, or -1 when none
 * @param stepsExecuted steps executed and persisted by this call only
 * @param failedStep    step that failed or produced the invalid transition, null otherwise
 */
public record RunOutcome(
        String runId,
        RunStatus status,
        FailureKind failure,
        String failedStep,
        String error,
        ObjectNode state,
        long lastSequence,
        int stepsExecuted
) {
    public static RunOutcome completed(String runId, ObjectNode state, long lastSequence, int stepsExecuted) {
        return new RunOutcome(runId, RunStatus.COMPLETED, null, null, null, state, lastSequence, stepsExecuted);
    }

    public static RunOutcome cancelled(String runId, ObjectNode state, long lastSequence, int stepsExecuted) {
        return new RunOutcome(runId, RunStatus.CANCELLED, null, null, null, state, lastSequence, stepsExecuted);
    }

    public static RunOutcome superseded(String runId, ObjectNode state, long lastSequence, int stepsExecuted) {
        return new RunOutcome(runId, RunStatus.SUPERSEDED, null, null, null, state, lastSequence, stepsExecuted);
    }

    public static RunOutcome failed(
            String runId,
            FailureKind failure,
            String failedStep,
            String error,
            ObjectNode state,
            long lastSequence,
            int stepsExecuted
    ) {
        return new RunOutcome(runId, RunStatus.FAILED, failure, failedStep, error, state, lastSequence, stepsExecuted);
    }

    public boolean hasFailed() {
        return status == RunStatus.FAILED;
    }
}
