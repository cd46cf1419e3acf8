package io.stepgraph.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stepgraph.model.Checkpoint;
import io.stepgraph.model.ExecutorPhase;
import io.stepgraph.model.RunOutcome;
import io.stepgraph.runtime.ExecutionListener;
import io.stepgraph.util.Hashing;
import io.stepgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Append-only JSONL audit trail of run events. Each row carries the hash of the row before it,
 * so edits and deletions inside the file are detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);

    public static final String RUN_START = "run.start";
    public static final String STEP_PERSISTED = "step.persisted";
    public static final String RUN_FINISHED = "run.finished";

    private final Path auditFile;
    private final String actor;
    private String previousHash;

    public AuditLogger(Path auditFile, String actor) {
        this.auditFile = auditFile;
        this.actor = actor == null || actor.isBlank() ? "unknown" : actor.trim();
        try {
            Files.createDirectories(auditFile.toAbsolutePath().getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // created by another process in between
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", actor);
        row.put("run_id", event.runId());
        row.put("step", event.step());
        row.put("result", event.result());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    /**
     * Recomputes every row hash and checks each row points at the one before it.
     */
    public synchronized Integrity verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new Integrity(false, checked, i + 1, "invalid_json");
            }
            if (!parsed.isObject()) {
                return new Integrity(false, checked, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new Integrity(false, checked, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = ((ObjectNode) parsed).deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new Integrity(false, checked, i + 1, "hash_mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new Integrity(true, checked, 0, "");
    }

    /**
     * Listener that records run start, each persisted checkpoint and the final outcome.
     * Audit write failures are logged and do not stop the run.
     */
    public ExecutionListener listener() {
        return new ExecutionListener() {
            @Override
            public void onPhase(String runId, ExecutorPhase phase, String step) {
                if (phase == ExecutorPhase.LOADING) {
                    safeLog(new AuditEvent(RUN_START, runId, null, "ok", Map.of()));
                }
            }

            @Override
            public void onCheckpoint(Checkpoint checkpoint) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("sequence", checkpoint.sequence());
                details.put("writer_id", checkpoint.writerId());
                safeLog(new AuditEvent(STEP_PERSISTED, checkpoint.runId(), checkpoint.producedBy(), "ok", details));
            }

            @Override
            public void onFinished(RunOutcome outcome) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("last_sequence", outcome.lastSequence());
                details.put("steps_executed", outcome.stepsExecuted());
                if (outcome.failure() != null) {
                    details.put("failure", outcome.failure().name());
                    details.put("error", outcome.error());
                }
                safeLog(new AuditEvent(RUN_FINISHED, outcome.runId(), outcome.failedStep(),
                        outcome.status().name().toLowerCase(Locale.ROOT), details));
            }
        };
    }

    private void safeLog(AuditEvent event) {
        try {
            log(event);
        } catch (RuntimeException e) {
            logger.warn("Failed to record audit event {} for run {}: {}", event.action(), event.runId(), e.getMessage());
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            logger.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(String action, String runId, String step, String result, Map<String, Object> details) {
    }

    /**
     * @param brokenLine 1-based line of the first bad row, 0 when the chain is intact
     */
    public record Integrity(boolean ok, int checkedRows, int brokenLine, String reason) {
    }
}
