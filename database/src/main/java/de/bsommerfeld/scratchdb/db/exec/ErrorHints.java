package de.bsommerfeld.scratchdb.db.exec;

import de.bsommerfeld.scratchdb.db.guard.QueryTimeoutException;
import de.bsommerfeld.scratchdb.db.guard.SandboxViolationException;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps engine failures to an {@link ErrorCode} and a short hint the agent
 * can act on.
 */
final class ErrorHints {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;

    private static final String[] SYNTAX_FRAGMENTS = { "syntax error", "incomplete input", "unrecognized token" };

    private ErrorHints() {
    }

    static ErrorCode classify(SQLException e) {
        if (e instanceof SandboxViolationException)
            return ErrorCode.BLOCKED;
        if (e instanceof QueryTimeoutException)
            return ErrorCode.TIMEOUT;
        int primary = e.getErrorCode() & 0xff;
        if (primary == SQLITE_CONSTRAINT)
            return ErrorCode.CONSTRAINT_VIOLATION;
        if (isSyntaxError(e.getMessage()))
            return ErrorCode.SYNTAX_ERROR;
        String lowered = lower(e.getMessage());
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED || lowered.contains("locked")
                || lowered.contains("busy")) {
            return ErrorCode.BUSY;
        }
        return ErrorCode.SQL_ERROR;
    }

    static boolean isSyntaxError(String message) {
        String lowered = lower(message);
        for (String fragment : SYNTAX_FRAGMENTS) {
            if (lowered.contains(fragment))
                return true;
        }
        return false;
    }

    static Optional<String> hintFor(String message) {
        String lowered = lower(message);
        if (lowered.contains("do not have the same number of result columns"))
            return Optional.of("Every SELECT joined by UNION, INTERSECT or EXCEPT must return the same number of "
                    + "columns. Pad the shorter side with NULL AS name.");
        if (lowered.contains("no such column"))
            return Optional.of("Check the column names with PRAGMA table_info(table_name) before referencing them. "
                    + "String values need single quotes, double quotes mean identifiers.");
        if (lowered.contains("no such table"))
            return Optional.of("Create the table first (CREATE TABLE IF NOT EXISTS ...) or check its exact name in "
                    + "sqlite_master.");
        if (lowered.contains("unique constraint failed"))
            return Optional.of("A row with this key already exists. Use INSERT OR IGNORE, INSERT OR REPLACE or "
                    + "INSERT ... ON CONFLICT(column) DO UPDATE SET ... instead.");
        if (isSyntaxError(message))
            return Optional.of("Provide one complete SQLite statement per entry. Escape single quotes inside values "
                    + "by doubling them ('it''s'), never with a backslash.");
        return Optional.empty();
    }

    private static String lower(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
