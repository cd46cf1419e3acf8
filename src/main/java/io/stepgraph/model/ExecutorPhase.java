package io.stepgraph.model;

public enum ExecutorPhase {
    IDLE,
    LOADING,
    RUNNING,
    PERSISTING,
    TERMINATED,
    FAILED
}
