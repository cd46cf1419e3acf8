package io.stepgraph.storage;

import io.stepgraph.config.StepGraphConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Store adapter over a {@link ConnectionPool}.
 *
 * <p>Every {@link #execute} call borrows one connection for one logical operation and retries
 * transient failures (lost connections, pool exhaustion, SQLite busy/locked) with bounded
 * exponential backoff before surfacing a {@link StorageException}.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "stepgraph.schema.migration.v1";

    private final ConnectionPool pool;
    private final StepGraphConfig config;

    public Database(ConnectionPool pool, StepGraphConfig config) {
        this.pool = pool;
        this.config = config;
    }

    public void init() {
        initDirectories();
        if (config.isSqlite()) {
            applyAndValidatePragmas();
        }
    }

    public boolean isSqlite() {
        return config.isSqlite();
    }

    public ConnectionPool pool() {
        return pool;
    }

    public <T> T execute(String operation, SqlWork<T> work) {
        int maxAttempts = config.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try (ConnectionPool.PooledConnection pooled = pool.acquire()) {
                try {
                    return work.apply(pooled.connection());
                } catch (SQLException e) {
                    if (isTransient(e)) {
                        pooled.invalidate();
                    }
                    throw e;
                }
            } catch (SQLException e) {
                if (!isTransient(e) || attempt >= maxAttempts) {
                    throw new StorageException(
                            "Failed to " + operation + " after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                long delayMs = backoffMs(attempt);
                log.warn("Transient failure during {} (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delayMs, e.getMessage());
                sleep(delayMs, operation);
            }
        }
    }

    static boolean isTransient(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientException || t instanceof SQLRecoverableException) {
                return true;
            }
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && (state.startsWith("08") || "40001".equals(state) || "40P01".equals(state))) {
                    return true;
                }
                String message = sql.getMessage();
                if (message != null && (message.contains("SQLITE_BUSY") || message.contains("SQLITE_LOCKED"))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * True when DDL failed because another instance created the same object first. The schema
     * statements commit one by one, so the loser of a startup race can see the object before the
     * winner has recorded its migration row.
     */
    static boolean isAlreadyExists(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                String state = sql.getSQLState();
                if ("42P07".equals(state) || "42710".equals(state) || "23505".equals(state)) {
                    return true;
                }
                String message = sql.getMessage();
                if (message != null && message.toLowerCase(Locale.ROOT).contains("already exists")) {
                    return true;
                }
            }
        }
        return false;
    }

    long backoffMs(int attempt) {
        long base = config.baseBackoffMs();
        if (base <= 0L) {
            return 0L;
        }
        long exp = base << Math.min(attempt - 1, 20);
        long capped = Math.min(config.maxBackoffMs(), exp);
        long jitter = ThreadLocalRandom.current().nextLong(capped / 4 + 1);
        return Math.min(config.maxBackoffMs(), capped + jitter);
    }

    private void sleep(long delayMs, String operation) {
        if (delayMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying " + operation, e);
        }
    }

    /**
     * Runs {@code ddl} unless the table is already there. A creation failure is accepted when
     * the table exists afterwards, which is the case when another process won the race.
     */
    public void createTableIfAbsent(Connection conn, String table, String ddl) throws SQLException {
        if (tableExists(conn, table)) {
            return;
        }
        try (Statement st = conn.createStatement()) {
            st.execute(ddl);
        } catch (SQLException e) {
            if (tableExists(conn, table)) {
                log.debug("Table {} was created concurrently by another instance", table);
                return;
            }
            throw e;
        }
    }

    public boolean tableExists(Connection conn, String table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        for (String candidate : List.of(table, table.toLowerCase(Locale.ROOT), table.toUpperCase(Locale.ROOT))) {
            try (ResultSet rs = meta.getTables(null, null, candidate, new String[]{"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    public void applyMigrations(Connection conn, List<MigrationStep> steps) throws SQLException {
        createTableIfAbsent(conn, "schema_migrations", """
                CREATE TABLE IF NOT EXISTS schema_migrations (
                    version VARCHAR(128) PRIMARY KEY,
                    description TEXT NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    applied_at_ms BIGINT NOT NULL,
                    success INTEGER NOT NULL
                )
                """);
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    try {
                        st.execute(sql);
                    } catch (SQLException e) {
                        if (!isAlreadyExists(e)) {
                            throw e;
                        }
                        log.debug("Migration {} found its object already created: {}", step.version(), e.getMessage());
                    }
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO schema_migrations(version,description,checksum,applied_at_ms,success)
                    VALUES(?,?,?,?,1)
                    ON CONFLICT(version) DO NOTHING
                    """)) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum(step));
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            log.info("Applied schema migration {}", step.version());
        } catch (SQLException e) {
            if (isMigrationApplied(conn, step.version())) {
                log.debug("Migration {} was applied concurrently by another instance", step.version());
                return;
            }
            throw e;
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return execute("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            if (!tableExists(c, "schema_migrations")) {
                return out;
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Path dbFile = sqliteFile();
            if (dbFile != null && dbFile.getParent() != null) {
                Files.createDirectories(dbFile.getParent());
            }
        } catch (IOException e) {
            throw new StorageException("Failed to initialize directories", e);
        }
    }

    private Path sqliteFile() {
        if (!config.isSqlite()) {
            return null;
        }
        String path = config.databaseUrl().substring("jdbc:sqlite:".length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isBlank() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return null;
        }
        return Paths.get(path).toAbsolutePath();
    }

    private void applyAndValidatePragmas() {
        execute("apply SQLite pragmas", c -> {
            try (Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                validatePragma(st, "journal_mode", "wal");
                validatePragma(st, "synchronous", "1");
            }
            return null;
        });
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    public record MigrationStep(String version, String description, List<String> sql) {
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
