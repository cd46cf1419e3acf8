package io.stepgraph.model;

public record RunSummary(
        String runId,
        long latestSequence,
        String lastProducedBy,
        long updatedAtMs
) {
}
