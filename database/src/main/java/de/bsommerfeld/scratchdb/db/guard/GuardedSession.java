package de.bsommerfeld.scratchdb.db.guard;

import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.ProgressHandler;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteLimits;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Optional;

/**
 * One sandboxed connection to a scratch database file.
 *
 * <p>
 * Opening a session disables extension loading, keeps temp storage in
 * memory, registers the {@link SafeFunctions} and installs a progress
 * handler that interrupts a statement once its deadline has passed. Any
 * failure while installing these guards closes the connection and raises
 * {@link GuardInstallException}; there is no unguarded fallback.
 *
 * <h3>Statement flow</h3>
 * Every statement passes through {@link #execute(String, StatementWork)}:
 * <ol>
 * <li>lexical shape check ({@link StatementClassifier#blockReason})</li>
 * <li>token gate ({@link StatementAuthorizer})</li>
 * <li>prepare, arm the deadline, run the caller's work, disarm</li>
 * </ol>
 * A denied statement raises {@link SandboxViolationException} and is never
 * prepared. An interrupted statement raises {@link QueryTimeoutException}.
 *
 * <h3>Timeout state</h3>
 * The deadline lives in this object and nowhere else. It is re-armed for
 * each statement and cleared on {@link #close()}, so nothing outlives the
 * session.
 *
 * <p>
 * Not thread-safe. One session serves one processing cycle.
 */
public final class GuardedSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GuardedSession.class);

    /** Work performed on a prepared, guarded statement. */
    @FunctionalInterface
    public interface StatementWork<T> {
        T run(PreparedStatement statement) throws SQLException;
    }

    private final Connection connection;
    private final Path path;
    private final Duration timeout;
    private final StatementClassifier classifier;
    private final StatementAuthorizer authorizer;

    private volatile long deadlineNanos;
    private volatile boolean timedOut;
    private boolean closed;

    private GuardedSession(Connection connection, Path path, Duration timeout, SandboxPolicy policy) {
        this.connection = connection;
        this.path = path;
        this.timeout = timeout;
        this.classifier = new StatementClassifier(policy);
        this.authorizer = new StatementAuthorizer(policy);
    }

    public static GuardedSession open(Path path, SessionConfig config) throws SQLException {
        return open(path, config, DefaultSandboxPolicy.instance(), false);
    }

    /** Same guards, but the engine rejects every write. */
    public static GuardedSession openReadOnly(Path path, SessionConfig config) throws SQLException {
        return open(path, config, DefaultSandboxPolicy.instance(), true);
    }

    public static GuardedSession open(Path path, SessionConfig config, SandboxPolicy policy, boolean readOnly)
            throws SQLException {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.enableLoadExtension(false);
        sqliteConfig.setTempStore(SQLiteConfig.TempStore.MEMORY);
        // the engine refuses ATTACH even if a statement gets past the gate
        sqliteConfig.setLimit(SQLiteLimits.SQLITE_LIMIT_ATTACHED, 0);
        if (readOnly)
            sqliteConfig.setReadOnly(true);

        Connection connection = DriverManager.getConnection(
                "jdbc:sqlite:" + path.toAbsolutePath(), sqliteConfig.toProperties());
        GuardedSession session = new GuardedSession(connection, path, config.getQueryTimeout(), policy);
        session.installGuards(config.getProgressInterval());
        return session;
    }

    private void installGuards(int progressInterval) throws GuardInstallException {
        try {
            SafeFunctions.install(connection);
            ProgressHandler.setHandler(connection, progressInterval, new ProgressHandler() {
                @Override
                protected int progress() {
                    return checkDeadline();
                }
            });
        } catch (SQLException | RuntimeException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new GuardInstallException("Failed to enable SQLite guardrails", e);
        }
    }

    private int checkDeadline() {
        long deadline = deadlineNanos;
        if (deadline != 0 && System.nanoTime() - deadline > 0) {
            timedOut = true;
            return 1;
        }
        return 0;
    }

    // =====================================================================
    // Guarding
    // =====================================================================

    /**
     * Runs both checks without executing anything.
     *
     * @return the block reason, or empty when the statement may run
     */
    public Optional<String> guard(String sql) {
        Optional<String> shape = classifier.blockReason(sql);
        if (shape.isPresent())
            return shape;
        return authorizer.check(sql);
    }

    public StatementClassifier classifier() {
        return classifier;
    }

    // =====================================================================
    // Execution
    // =====================================================================

    public <T> T execute(String sql, StatementWork<T> work) throws SQLException {
        ensureOpen();
        Optional<String> reason = guard(sql);
        if (reason.isPresent())
            throw new SandboxViolationException(reason.get());

        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            arm();
            try {
                return work.run(statement);
            } finally {
                disarm();
            }
        } catch (SQLException e) {
            if (timedOut) {
                timedOut = false;
                throw new QueryTimeoutException(timeout, e);
            }
            throw e;
        }
    }

    /** Executes a statement that takes no parameters and ignores its result. */
    public void execute(String sql) throws SQLException {
        execute(sql, PreparedStatement::execute);
    }

    public long lastInsertRowId() throws SQLException {
        ensureOpen();
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private void arm() {
        timedOut = false;
        deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    private void disarm() {
        deadlineNanos = 0;
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    public void begin() throws SQLException {
        ensureOpen();
        connection.setAutoCommit(false);
    }

    public void commit() throws SQLException {
        ensureOpen();
        connection.commit();
        connection.setAutoCommit(true);
    }

    public void rollback() throws SQLException {
        ensureOpen();
        if (!connection.getAutoCommit()) {
            connection.rollback();
            connection.setAutoCommit(true);
        }
    }

    // =====================================================================
    // File
    // =====================================================================

    public Path path() {
        return path;
    }

    /** Current size of the database file, 0 when it does not exist yet. */
    public long sizeBytes() {
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read size of " + path, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() throws SQLException {
        if (closed)
            throw new SQLException("Guarded session is closed");
    }

    /**
     * Releases the timeout state and the connection. Safe to call twice.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        deadlineNanos = 0;
        timedOut = false;
        try {
            ProgressHandler.clearHandler(connection);
        } catch (SQLException e) {
            LOG.debug("Failed to clear progress handler for {}", path, e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LOG.warn("Failed to close guarded session for {}", path, e);
        }
    }
}
