package io.stepgraph.model;

public enum FailureKind {
    STEP_ERROR,
    INVALID_TRANSITION,
    STEP_LIMIT_EXCEEDED
}
