package io.stepgraph.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.RunSummary;
import io.stepgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only checkpoint log keyed by {@code (run_id, seq)}.
 *
 * <p>Sequences start at 0 and have no gaps. {@link #append} is the only write path and
 * relies on the primary key, not on in-process locks, to pick a single winner per sequence.
 */
public final class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    static final String TABLE = "checkpoints";

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS checkpoints (
                run_id VARCHAR(255) NOT NULL,
                seq BIGINT NOT NULL,
                state TEXT NOT NULL,
                produced_by VARCHAR(255) NOT NULL,
                writer_id VARCHAR(64) NOT NULL,
                written_at_ms BIGINT NOT NULL,
                PRIMARY KEY (run_id, seq)
            )
            """;

    private static final List<Database.MigrationStep> MIGRATIONS = List.of(
            new Database.MigrationStep(
                    "20261019_001_checkpoint_written_index",
                    "Index checkpoints by write time for recent-run listings",
                    List.of("CREATE INDEX IF NOT EXISTS idx_checkpoints_written ON checkpoints(written_at_ms)")
            )
    );

    private static final String COLUMNS = "run_id,seq,state,produced_by,writer_id,written_at_ms";

    private final Database database;
    private final String defaultWriterId;
    private final int pageSize;

    public CheckpointStore(Database database, int pageSize) {
        this.database = database;
        this.defaultWriterId = "store_" + UUID.randomUUID();
        this.pageSize = Math.max(1, pageSize);
    }

    /**
     * Creates the checkpoint table and applies pending migrations. Idempotent and safe to run
     * from several processes at once.
     */
    public void ensureSchema() {
        database.execute("ensure checkpoint schema", c -> {
            database.createTableIfAbsent(c, TABLE, CREATE_TABLE);
            database.applyMigrations(c, MIGRATIONS);
            return null;
        });
        log.debug("Checkpoint schema ready");
    }

    public Optional<Checkpoint> loadLatest(String runId) {
        requireRunId(runId);
        return database.execute("load latest checkpoint", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM checkpoints WHERE run_id=? ORDER BY seq DESC LIMIT 1")) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(read(rs)) : Optional.empty();
                }
            }
        });
    }

    public Checkpoint append(String runId, long sequence, ObjectNode state, String producedBy) {
        return append(runId, sequence, state, producedBy, defaultWriterId);
    }

    /**
     * Appends the checkpoint at {@code sequence}, which must directly follow the latest one.
     *
     * <p>A retried insert that turns out to have committed on an earlier attempt is recognised
     * by its {@code writerId} and returned as a success.
     *
     * @throws ConflictException        when another writer already owns {@code (runId, sequence)}
     * @throws IllegalArgumentException when {@code sequence} would leave a gap
     */
    public Checkpoint append(String runId, long sequence, ObjectNode state, String producedBy, String writerId) {
        requireRunId(runId);
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, got " + sequence);
        }
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        if (producedBy == null || producedBy.isBlank()) {
            throw new IllegalArgumentException("producedBy must not be blank");
        }
        if (writerId == null || writerId.isBlank()) {
            throw new IllegalArgumentException("writerId must not be blank");
        }
        String payload = Jsons.toCompactJson(state);
        long nowMs = Instant.now().toEpochMilli();
        return database.execute("append checkpoint", c -> {
            int inserted;
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO checkpoints(run_id,seq,state,produced_by,writer_id,written_at_ms)
                    SELECT ?,?,?,?,?,?
                    WHERE COALESCE((SELECT MAX(seq) FROM checkpoints WHERE run_id=?), -1) = ?
                    ON CONFLICT(run_id,seq) DO NOTHING
                    """)) {
                ps.setString(1, runId);
                ps.setLong(2, sequence);
                ps.setString(3, payload);
                ps.setString(4, producedBy);
                ps.setString(5, writerId);
                ps.setLong(6, nowMs);
                ps.setString(7, runId);
                ps.setLong(8, sequence - 1);
                inserted = ps.executeUpdate();
            }
            if (inserted == 1) {
                return new Checkpoint(runId, sequence, state, producedBy, writerId, Instant.ofEpochMilli(nowMs));
            }
            Optional<Checkpoint> existing = find(c, runId, sequence);
            if (existing.isPresent()) {
                Checkpoint winner = existing.get();
                if (writerId.equals(winner.writerId())) {
                    return winner;
                }
                throw new ConflictException(runId, sequence, winner.writerId());
            }
            throw new IllegalArgumentException(
                    "Checkpoint sequence " + sequence + " for run " + runId + " would leave a gap");
        });
    }

    /**
     * All checkpoints of {@code runId}, ascending. Each {@code iterator()} call starts a new scan
     * that fetches one page per connection borrow.
     */
    public Iterable<Checkpoint> listCheckpoints(String runId) {
        requireRunId(runId);
        return () -> new PageIterator(runId);
    }

    public List<RunSummary> listRuns(int limit) {
        int safeLimit = Math.max(1, limit);
        return database.execute("list runs", c -> {
            List<RunSummary> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT c.run_id, c.seq, c.produced_by, c.written_at_ms
                    FROM checkpoints c
                    JOIN (SELECT run_id, MAX(seq) AS max_seq FROM checkpoints GROUP BY run_id) m
                      ON c.run_id = m.run_id AND c.seq = m.max_seq
                    ORDER BY c.written_at_ms DESC, c.run_id ASC
                    LIMIT ?
                    """)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new RunSummary(
                                rs.getString(1),
                                rs.getLong(2),
                                rs.getString(3),
                                rs.getLong(4)
                        ));
                    }
                }
            }
            return out;
        });
    }

    private List<Checkpoint> page(String runId, long afterSequence) {
        return database.execute("list checkpoints", c -> {
            List<Checkpoint> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT " + COLUMNS + " FROM checkpoints WHERE run_id=? AND seq>? ORDER BY seq ASC LIMIT ?")) {
                ps.setString(1, runId);
                ps.setLong(2, afterSequence);
                ps.setInt(3, pageSize);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(read(rs));
                    }
                }
            }
            return out;
        });
    }

    private Optional<Checkpoint> find(Connection c, String runId, long sequence) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM checkpoints WHERE run_id=? AND seq=?")) {
            ps.setString(1, runId);
            ps.setLong(2, sequence);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        }
    }

    private Checkpoint read(ResultSet rs) throws SQLException {
        return new Checkpoint(
                rs.getString("run_id"),
                rs.getLong("seq"),
                Jsons.parseObject(rs.getString("state")),
                rs.getString("produced_by"),
                rs.getString("writer_id"),
                Instant.ofEpochMilli(rs.getLong("written_at_ms"))
        );
    }

    private static void requireRunId(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
    }

    private final class PageIterator implements Iterator<Checkpoint> {
        private final String runId;
        private final Deque<Checkpoint> buffer = new ArrayDeque<>();
        private long lastSequence = -1L;
        private boolean exhausted;

        private PageIterator(String runId) {
            this.runId = runId;
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<Checkpoint> next = page(runId, lastSequence);
                buffer.addAll(next);
                if (next.size() < pageSize) {
                    exhausted = true;
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public Checkpoint next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Checkpoint checkpoint = buffer.removeFirst();
            lastSequence = checkpoint.sequence();
            return checkpoint;
        }
    }
}
