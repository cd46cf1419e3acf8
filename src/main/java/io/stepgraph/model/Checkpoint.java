package io.stepgraph.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * Immutable snapshot of a run's state, written after one step.
 *
 * <p>{@code writerId} identifies the executor attempt that appended the row. The state
 * accessor hands out a copy, so a checkpoint can be shared between threads.
 */
public record Checkpoint(
        String runId,
        long sequence,
        ObjectNode state,
        String producedBy,
        String writerId,
        Instant writtenAt
) {
    public Checkpoint {
        state = state == null ? null : state.deepCopy();
    }

    @Override
    public ObjectNode state() {
        return state == null ? null : state.deepCopy();
    }
}
