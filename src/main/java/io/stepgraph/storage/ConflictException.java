package io.stepgraph.storage;

/**
 * Another writer already appended the checkpoint at {@code (runId, sequence)}.
 *
 * <p>Never retried. The caller re-reads the latest checkpoint instead.
 */
public final class ConflictException extends StorageException {
    private final String runId;
    private final long sequence;
    private final String winnerWriterId;

    public ConflictException(String runId, long sequence, String winnerWriterId) {
        super("Checkpoint already exists: run=" + runId + ", sequence=" + sequence + ", writer=" + winnerWriterId);
        this.runId = runId;
        this.sequence = sequence;
        this.winnerWriterId = winnerWriterId;
    }

    public String runId() {
        return runId;
    }

    public long sequence() {
        return sequence;
    }

    public String winnerWriterId() {
        return winnerWriterId;
    }
}
