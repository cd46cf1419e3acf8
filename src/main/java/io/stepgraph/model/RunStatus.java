package io.stepgraph.model;

public enum RunStatus {
    /** The run reached END. */
    COMPLETED,
    /** Stopped between steps on request; resumable from the last checkpoint. */
    CANCELLED,
    /** Another executor appended the same sequence first; this attempt stopped. */
    SUPERSEDED,
    FAILED
}
