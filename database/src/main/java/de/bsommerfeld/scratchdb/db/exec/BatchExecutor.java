package de.bsommerfeld.scratchdb.db.exec;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.BatchConfig;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.guard.StatementClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Runs agent-supplied SQL against one {@link GuardedSession}.
 *
 * <p>
 * Statements run strictly in order and each one commits on its own, so the
 * work before a failure survives it. The first blocked, malformed or failing
 * statement stops the batch; its effect is rolled back and it is reported
 * with its zero-based index and, where the engine message matches a known
 * pattern, a hint. Nothing after it runs.
 *
 * <h3>Input</h3>
 * Each caller-supplied string is sanitized (typographic quotes, backslash
 * escaped apostrophes) and split into single statements; indexes refer to
 * that flattened list.
 *
 * <h3>Continuation</h3>
 * {@link BatchResult#continuationAllowed()} is set only when the caller said
 * no further work is needed, every statement succeeded, every statement is a
 * pure write and none returned rows.
 */
@Singleton
public class BatchExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(BatchExecutor.class);

    static final String SIZE_WARNING = "WARNING: DB SIZE EXCEEDS 50MB. YOU MUST EXECUTE MORE QUERIES TO SHRINK "
            + "THE SIZE, OR THE WHOLE DB WILL BE WIPED!!!";

    private static final Pattern TRANSACTION_CONTROL = Pattern.compile(
            "^\\s*(BEGIN|COMMIT|ROLLBACK|END|SAVEPOINT|RELEASE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERT_LIKE = Pattern.compile("^\\s*(INSERT|REPLACE)\\b", Pattern.CASE_INSENSITIVE);

    private static final int PREVIEW_STATEMENTS = 10;
    private static final int PREVIEW_CHARS = 160;
    private static final int QUERY_PREVIEW_CHARS = 500;

    private final BatchConfig config;

    @Inject
    public BatchExecutor(ScratchDbConfig config) {
        this(config.getBatch());
    }

    BatchExecutor(BatchConfig config) {
        this.config = config;
    }

    // =====================================================================
    // Entry points
    // =====================================================================

    /**
     * Executes a batch.
     *
     * @param moreWorkNeeded {@code false} when the caller signals that this
     *                       batch finishes its work for the cycle
     */
    public BatchResult execute(GuardedSession session, List<String> operations, boolean moreWorkNeeded) {
        StatementClassifier classifier = session.classifier();
        List<String> statements = new ArrayList<>();
        if (operations != null) {
            for (String operation : operations) {
                if (operation != null)
                    statements.addAll(classifier.split(sanitize(operation)));
            }
        }
        if (statements.isEmpty()) {
            StatementError error = new StatementError(ErrorCode.INVALID_INPUT,
                    "'operations' must contain at least one non-empty SQL statement.", 0, null, null);
            return finish(session, List.of(StatementResult.failure(error, 0)), false, moreWorkNeeded,
                    "Batch rejected: no SQL statements provided.");
        }

        LOG.info("Executing batch of {} statements, preview={}", statements.size(), preview(statements));
        List<StatementResult> results = run(session, statements);
        boolean ok = results.stream().allMatch(StatementResult::ok);
        boolean allWrites = statements.stream().allMatch(classifier::isWrite);

        String message = ok
                ? "Batch executed " + results.size() + " statements."
                : "Batch stopped at statement " + results.get(results.size() - 1).index() + " after "
                        + (results.size() - 1) + " successful statements.";
        return finish(session, results, ok && allWrites, moreWorkNeeded, message);
    }

    /**
     * Executes one SQL string. Same semantics as a batch of one entry; the
     * message reads like a query summary instead of a batch summary.
     */
    public BatchResult executeQuery(GuardedSession session, String query) {
        if (query == null || query.isBlank()) {
            StatementError error = new StatementError(ErrorCode.INVALID_INPUT,
                    "Missing required parameter: query", 0, null, null);
            return finish(session, List.of(StatementResult.failure(error, 0)), false, true,
                    "Missing required parameter: query");
        }
        LOG.info("Executing SQL query: {}", previewQuery(query));

        StatementClassifier classifier = session.classifier();
        List<String> statements = classifier.split(query);
        if (statements.isEmpty())
            statements = List.of(query.strip());
        List<StatementResult> results = run(session, statements);
        boolean ok = results.stream().allMatch(StatementResult::ok);
        boolean allWrites = statements.stream().allMatch(classifier::isWrite);

        StatementResult last = results.get(results.size() - 1);
        String sizeText = String.format(Locale.ROOT, " Database size: %.2f MB.", session.sizeBytes() / (1024.0 * 1024.0));
        String message;
        if (!ok) {
            StatementError error = last.error();
            message = error.code() == ErrorCode.BLOCKED
                    ? "Query blocked: " + error.message()
                    : "SQLite query failed: " + error.message();
        } else if (last.returnedRows()) {
            message = "Query returned " + last.rows().size() + " rows." + sizeText;
        } else {
            message = last.changes() + " rows affected." + sizeText;
        }
        return finish(session, results, ok && allWrites, false, message);
    }

    // =====================================================================
    // Execution
    // =====================================================================

    private List<StatementResult> run(GuardedSession session, List<String> statements) {
        List<StatementResult> results = new ArrayList<>();
        for (int index = 0; index < statements.size(); index++) {
            StatementResult result = runOne(session, statements.get(index), index);
            results.add(result);
            if (!result.ok()) {
                LOG.warn("Batch stopped at statement {}: {}", index, result.error().message());
                break;
            }
        }
        return results;
    }

    private StatementResult runOne(GuardedSession session, String sql, int index) {
        long started = System.nanoTime();
        if (TRANSACTION_CONTROL.matcher(sql).find()) {
            return StatementResult.failure(new StatementError(ErrorCode.TRANSACTION_CONTROL_DISALLOWED,
                    "Remove explicit BEGIN/COMMIT/ROLLBACK/SAVEPOINT. Every statement commits on its own.",
                    index, sql, null), 0);
        }
        Optional<String> blocked = session.guard(sql);
        if (blocked.isPresent()) {
            return StatementResult.failure(new StatementError(ErrorCode.BLOCKED, blocked.get(), index, sql, null),
                    0);
        }

        try {
            return runInTransaction(session, sql, index, started);
        } catch (SQLException e) {
            Optional<SqlAutocorrect.Rewrite> rewrite = SqlAutocorrect.suggest(sql, e.getMessage());
            if (rewrite.isPresent()) {
                try {
                    StatementResult corrected = runInTransaction(session, rewrite.get().sql(), index, started);
                    LOG.info("Statement {} succeeded after autocorrect: {}", index, rewrite.get().fix());
                    return corrected.withAppliedFixes(List.of(rewrite.get().fix()));
                } catch (SQLException retryFailure) {
                    LOG.debug("Autocorrect retry for statement {} failed", index, retryFailure);
                }
            }
            ErrorCode code = ErrorHints.classify(e);
            String hint = ErrorHints.hintFor(e.getMessage()).orElse(null);
            return StatementResult.failure(new StatementError(code, e.getMessage(), index, sql, hint),
                    elapsedMillis(started));
        }
    }

    private StatementResult runInTransaction(GuardedSession session, String sql, int index, long started)
            throws SQLException {
        session.begin();
        try {
            StatementResult result = session.execute(sql, stmt -> collect(session, stmt, sql, index, started));
            session.commit();
            return result;
        } catch (SQLException e) {
            try {
                session.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
                LOG.warn("Failed to roll back statement {}", index, rollbackFailure);
            }
            throw e;
        }
    }

    private StatementResult collect(GuardedSession session, PreparedStatement stmt, String sql, int index,
            long started) throws SQLException {
        if (stmt.execute()) {
            try (ResultSet rs = stmt.getResultSet()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++)
                    columns.add(meta.getColumnLabel(i));

                List<Map<String, Object>> rows = new ArrayList<>();
                boolean truncated = false;
                while (rs.next()) {
                    if (rows.size() >= config.getRowLimit()) {
                        truncated = true;
                        break;
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++)
                        row.put(columns.get(i - 1), rs.getObject(i));
                    rows.add(row);
                }
                return StatementResult.rows(index, columns, rows, elapsedMillis(started), truncated);
            }
        }
        int changes = Math.max(0, stmt.getUpdateCount());
        Long lastId = INSERT_LIKE.matcher(sql).find() ? session.lastInsertRowId() : null;
        return StatementResult.changes(index, changes, lastId, elapsedMillis(started));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private BatchResult finish(GuardedSession session, List<StatementResult> results, boolean eligible,
            boolean moreWorkNeeded, String message) {
        boolean ok = results.stream().allMatch(StatementResult::ok);
        long size = session.sizeBytes();
        String warning = size > config.getSoftSizeLimitBytes() ? SIZE_WARNING : null;
        if (warning != null)
            LOG.warn("Scratch database {} is {} bytes, above the soft ceiling", session.path(), size);

        boolean anyRows = results.stream().anyMatch(StatementResult::returnedRows);
        boolean continuationAllowed = ok && eligible && !moreWorkNeeded && !anyRows;
        Integer failedIndex = ok ? null : results.get(results.size() - 1).index();
        String fullMessage = warning == null ? message : message + " " + warning;
        return new BatchResult(ok, results, failedIndex, size, warning, continuationAllowed, fullMessage);
    }

    /**
     * Normalizes typographic quotes and backslash-escaped apostrophes into
     * plain SQL quoting.
     */
    static String sanitize(String sql) {
        return sql.replace('“', '"')
                .replace('”', '"')
                .replace("’", "''")
                .replace("\\'", "''");
    }

    private static List<String> preview(List<String> statements) {
        List<String> preview = new ArrayList<>();
        for (String sql : statements.subList(0, Math.min(PREVIEW_STATEMENTS, statements.size()))) {
            String trimmed = sql.strip();
            preview.add(trimmed.length() > PREVIEW_CHARS ? trimmed.substring(0, PREVIEW_CHARS) + "..." : trimmed);
        }
        return preview;
    }

    static String previewQuery(String query) {
        String trimmed = query.strip();
        if (trimmed.length() <= QUERY_PREVIEW_CHARS)
            return trimmed;
        return trimmed.substring(0, QUERY_PREVIEW_CHARS) + "... [TRUNCATED, total " + query.length() + " chars]";
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
