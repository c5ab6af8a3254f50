package de.bsommerfeld.scratchdb.db.exec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement of a batch.
 *
 * <p>
 * A row-returning statement carries its column list and rows (ordered
 * column to value maps, capped at the configured row limit with
 * {@code truncated} set when rows were dropped). Any other statement
 * carries the affected row count and, for inserts, the last insert row id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatementResult(
        int index,
        boolean ok,
        List<String> columns,
        List<Map<String, Object>> rows,
        int changes,
        Long lastInsertRowId,
        long elapsedMillis,
        boolean truncated,
        List<String> appliedFixes,
        StatementError error) {

    public StatementResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : List.copyOf(rows);
        appliedFixes = appliedFixes == null ? List.of() : List.copyOf(appliedFixes);
    }

    static StatementResult rows(int index, List<String> columns, List<Map<String, Object>> rows,
            long elapsedMillis, boolean truncated) {
        return new StatementResult(index, true, columns, rows, 0, null, elapsedMillis, truncated, null, null);
    }

    static StatementResult changes(int index, int changes, Long lastInsertRowId, long elapsedMillis) {
        return new StatementResult(index, true, null, null, changes, lastInsertRowId, elapsedMillis, false,
                null, null);
    }

    static StatementResult failure(StatementError error, long elapsedMillis) {
        return new StatementResult(error.index(), false, null, null, 0, null, elapsedMillis, false, null, error);
    }

    StatementResult withAppliedFixes(List<String> fixes) {
        return new StatementResult(index, ok, columns, rows, changes, lastInsertRowId, elapsedMillis, truncated,
                fixes, error);
    }

    /** True when the statement produced a result set, even an empty one. */
    @JsonIgnore
    public boolean returnedRows() {
        return ok && !columns.isEmpty();
    }
}
