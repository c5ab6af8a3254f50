package de.bsommerfeld.scratchdb.db.exec;

import de.bsommerfeld.scratchdb.core.config.BatchConfig;
import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchExecutorTest {

    @TempDir
    Path tempDir;

    private BatchConfig config;
    private BatchExecutor executor;
    private GuardedSession session;

    @BeforeEach
    void setUp() throws SQLException {
        config = new BatchConfig();
        executor = new BatchExecutor(config);
        session = GuardedSession.open(tempDir.resolve("scratch.db"), new SessionConfig());
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private long count(String table) throws SQLException {
        return session.execute("SELECT count(*) FROM " + table, stmt -> {
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        });
    }

    // =====================================================================
    // Success paths
    // =====================================================================

    @Test
    void execute_shouldReturnRowsForTrailingSelect() {
        BatchResult result = executor.execute(session, List.of(
                "CREATE TABLE t(a INTEGER)",
                "INSERT INTO t(a) VALUES (1),(2)",
                "SELECT a FROM t ORDER BY a"), false);

        assertTrue(result.ok());
        assertEquals(3, result.results().size());
        assertEquals(2, result.results().get(1).changes());

        StatementResult select = result.results().get(2);
        assertEquals(List.of("a"), select.columns());
        assertEquals(2, select.rows().size());
        assertEquals(1, ((Number) select.rows().get(0).get("a")).intValue());
        assertEquals(2, ((Number) select.rows().get(1).get("a")).intValue());
        assertFalse(result.continuationAllowed());
    }

    @Test
    void execute_shouldAllowContinuationOnlyForPureWrites() {
        BatchResult writes = executor.execute(session, List.of(
                "CREATE TABLE t(a INTEGER)", "INSERT INTO t(a) VALUES (1)"), false);
        assertTrue(writes.continuationAllowed());
        assertEquals(1L, writes.results().get(1).lastInsertRowId());

        BatchResult moreWork = executor.execute(session, List.of("INSERT INTO t(a) VALUES (2)"), true);
        assertFalse(moreWork.continuationAllowed());
    }

    @Test
    void execute_shouldSplitMultiStatementStrings() {
        BatchResult result = executor.execute(session,
                List.of("CREATE TABLE t(a); INSERT INTO t VALUES (1); INSERT INTO t VALUES (2)"), true);

        assertTrue(result.ok());
        assertEquals(3, result.results().size());
        assertEquals(2, result.results().get(2).index());
    }

    @Test
    void execute_shouldSanitizeTypographicQuotes() throws SQLException {
        BatchResult result = executor.execute(session, List.of(
                "CREATE TABLE t(s TEXT)",
                "INSERT INTO t VALUES ('it’s')",
                "INSERT INTO t VALUES ('don\\'t')"), true);

        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(2, count("t"));
    }

    @Test
    void execute_shouldTruncateAtRowLimit() {
        config.setRowLimit(3);
        BatchResult result = executor.execute(session, List.of(
                "WITH RECURSIVE c(n) AS (SELECT 1 UNION ALL SELECT n + 1 FROM c WHERE n < 10) SELECT n FROM c"),
                true);

        StatementResult rows = result.results().get(0);
        assertEquals(3, rows.rows().size());
        assertTrue(rows.truncated());
    }

    // =====================================================================
    // Failure paths
    // =====================================================================

    @Test
    void execute_shouldStopAtFirstFailureAndKeepEarlierWork() throws SQLException {
        BatchResult result = executor.execute(session, List.of(
                "CREATE TABLE t(a INTEGER PRIMARY KEY)",
                "INSERT INTO t VALUES (1)",
                "INSERT INTO t VALUES (1)",
                "INSERT INTO t VALUES (2)"), false);

        assertFalse(result.ok());
        assertEquals(3, result.results().size());
        assertEquals(2, result.failedIndex());

        StatementError error = result.error().orElseThrow();
        assertEquals(ErrorCode.CONSTRAINT_VIOLATION, error.code());
        assertNotNull(error.hint());
        assertEquals(1, count("t"));
        assertFalse(result.continuationAllowed());
    }

    @Test
    void execute_shouldReportBlockedStatementsWithoutRunningThem() throws SQLException {
        BatchResult result = executor.execute(session, List.of(
                "CREATE TABLE t(a)", "VACUUM", "INSERT INTO t VALUES (1)"), false);

        assertEquals(2, result.results().size());
        assertEquals(ErrorCode.BLOCKED, result.error().orElseThrow().code());
        assertEquals(0, count("t"));
    }

    @Test
    void execute_shouldRejectTransactionControl() {
        BatchResult result = executor.execute(session, List.of("BEGIN", "CREATE TABLE t(a)"), false);

        assertEquals(1, result.results().size());
        assertEquals(ErrorCode.TRANSACTION_CONTROL_DISALLOWED, result.error().orElseThrow().code());
    }

    @Test
    void execute_shouldHintOnMissingTable() {
        BatchResult result = executor.execute(session, List.of("SELECT * FROM missing"), false);

        StatementError error = result.error().orElseThrow();
        assertEquals(ErrorCode.SQL_ERROR, error.code());
        assertTrue(error.hint().contains("CREATE TABLE"));
    }

    @Test
    void execute_shouldRejectEmptyInput() {
        BatchResult result = executor.execute(session, List.of("  ", "-- only a comment"), false);

        assertFalse(result.ok());
        assertEquals(ErrorCode.INVALID_INPUT, result.error().orElseThrow().code());
    }

    @Test
    void execute_shouldAutocorrectWithBeforeCreateTableAs() throws SQLException {
        BatchResult result = executor.execute(session, List.of(
                "WITH src AS (SELECT 1 AS n UNION ALL SELECT 2) CREATE TABLE copy AS SELECT n FROM src"), true);

        assertTrue(result.ok(), () -> String.valueOf(result.error()));
        assertEquals(List.of(SqlAutocorrect.MOVED_WITH_CLAUSE), result.results().get(0).appliedFixes());
        assertEquals(2, count("copy"));
    }

    // =====================================================================
    // Size and single query
    // =====================================================================

    @Test
    void execute_shouldWarnAboveSoftCeiling() {
        config.setSoftSizeLimitBytes(1);
        BatchResult result = executor.execute(session, List.of("CREATE TABLE t(a)"), false);

        assertEquals(BatchExecutor.SIZE_WARNING, result.sizeWarning());
        assertTrue(result.message().endsWith(BatchExecutor.SIZE_WARNING));
    }

    @Test
    void executeQuery_shouldSummarizeRowsAndChanges() {
        executor.execute(session, List.of("CREATE TABLE t(a)"), true);

        BatchResult insert = executor.executeQuery(session, "INSERT INTO t VALUES (1), (2)");
        assertTrue(insert.message().startsWith("2 rows affected. Database size: "));
        assertTrue(insert.continuationAllowed());

        BatchResult select = executor.executeQuery(session, "SELECT * FROM t");
        assertTrue(select.message().startsWith("Query returned 2 rows."));
        assertFalse(select.continuationAllowed());
        assertEquals(1, ((Number) select.results().get(0).rows().get(0).get("a")).intValue());
    }

    @Test
    void executeQuery_shouldReportBlockReason() {
        BatchResult result = executor.executeQuery(session, "ATTACH DATABASE 'x.db' AS x");

        assertFalse(result.ok());
        assertTrue(result.message().startsWith("Query blocked: Access denied: ATTACH"));
    }

    @Test
    void previewQuery_shouldCutLongQueries() {
        String longQuery = "SELECT " + "x".repeat(600);
        assertTrue(BatchExecutor.previewQuery(longQuery).endsWith("... [TRUNCATED, total 607 chars]"));
    }
}
