package io.stepgraph.storage;

import io.stepgraph.config.StepGraphConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.Properties;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded JDBC connection pool.
 *
 * <p>At most {@code maxSize} connections are handed out at once; callers block up to the
 * acquire timeout for a free slot. Idle connections are reused and checked before reuse.
 * The pool is opened and closed explicitly by its owner; {@link Database} only borrows from it.
 */
public final class ConnectionPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;
    private static final int SQLITE_BUSY_TIMEOUT_MS = 5_000;

    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final int maxSize;
    private final long acquireTimeoutMs;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<Connection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger openConnections = new AtomicInteger(0);
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private volatile boolean closed;

    public ConnectionPool(String jdbcUrl, String user, String password, int maxSize, long acquireTimeoutMs) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got " + maxSize);
        }
        this.jdbcUrl = jdbcUrl;
        this.connectionProperties = new Properties();
        if (user != null) {
            connectionProperties.setProperty("user", user);
        }
        if (password != null) {
            connectionProperties.setProperty("password", password);
        }
        this.maxSize = maxSize;
        this.acquireTimeoutMs = Math.max(1L, acquireTimeoutMs);
        this.permits = new Semaphore(maxSize, true);
    }

    public static ConnectionPool open(StepGraphConfig config) {
        log.info("Opening connection pool for {} with size {}", config.redactedDatabaseUrl(), config.poolSize());
        return new ConnectionPool(
                config.databaseUrl(),
                config.databaseUser(),
                config.databasePassword(),
                config.poolSize(),
                config.acquireTimeoutMs()
        );
    }

    /**
     * Borrows a connection. Close the returned handle to give it back.
     *
     * @throws SQLTransientConnectionException when no connection frees up within the acquire timeout
     * @throws StorageException                when the pool is closed
     */
    public PooledConnection acquire() throws SQLException {
        ensureOpen();
        boolean granted;
        try {
            granted = permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for a pooled connection", e);
        }
        if (!granted) {
            throw new SQLTransientConnectionException(
                    "Timed out after " + acquireTimeoutMs + "ms waiting for a pooled connection (size=" + maxSize + ")");
        }
        try {
            ensureOpen();
            Connection connection = takeIdleOrCreate();
            activeConnections.incrementAndGet();
            return new PooledConnection(this, connection);
        } catch (SQLException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    void release(Connection connection, boolean broken) {
        activeConnections.decrementAndGet();
        try {
            if (closed || broken || connection.isClosed()) {
                discard(connection);
                return;
            }
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            idle.offerFirst(connection);
        } catch (SQLException e) {
            log.debug("Discarding connection that failed to reset: {}", e.getMessage());
            discard(connection);
        } finally {
            permits.release();
        }
    }

    private Connection takeIdleOrCreate() throws SQLException {
        Connection candidate;
        while ((candidate = idle.pollFirst()) != null) {
            if (isUsable(candidate)) {
                return candidate;
            }
            discard(candidate);
        }
        Connection created = DriverManager.getConnection(jdbcUrl, connectionProperties);
        openConnections.incrementAndGet();
        try {
            configure(created);
        } catch (SQLException e) {
            discard(created);
            throw e;
        }
        log.debug("Opened pooled connection ({} open)", openConnections.get());
        return created;
    }

    private void configure(Connection connection) throws SQLException {
        connection.setAutoCommit(true);
        if (jdbcUrl.startsWith("jdbc:sqlite:")) {
            try (Statement st = connection.createStatement()) {
                st.execute("PRAGMA busy_timeout=" + SQLITE_BUSY_TIMEOUT_MS);
                st.execute("PRAGMA synchronous=NORMAL");
            }
        }
    }

    private boolean isUsable(Connection connection) {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void discard(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Ignoring close failure on discarded connection: {}", e.getMessage());
        } finally {
            openConnections.decrementAndGet();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Connection pool is closed");
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public int openConnections() {
        return openConnections.get();
    }

    public int activeConnections() {
        return activeConnections.get();
    }

    public int idleConnections() {
        return idle.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes idle connections and refuses new borrowers. Connections still borrowed are
     * closed when they are returned.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Connection connection;
        while ((connection = idle.pollFirst()) != null) {
            discard(connection);
        }
        log.info("Connection pool closed ({} still borrowed)", activeConnections.get());
    }

    /**
     * A borrowed connection. {@link #close()} returns it to the pool.
     */
    public static final class PooledConnection implements AutoCloseable {
        private final ConnectionPool pool;
        private final Connection connection;
        private boolean broken;
        private boolean returned;

        private PooledConnection(ConnectionPool pool, Connection connection) {
            this.pool = pool;
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        /**
         * Marks the connection as unusable so it is closed instead of reused.
         */
        public void invalidate() {
            broken = true;
        }

        @Override
        public void close() {
            if (returned) {
                return;
            }
            returned = true;
            pool.release(connection, broken);
        }
    }
}
