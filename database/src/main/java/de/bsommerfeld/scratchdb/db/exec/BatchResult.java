package de.bsommerfeld.scratchdb.db.exec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a batch. {@code results} holds every statement that ran, the
 * failing one last when {@code ok} is false.
 *
 * @param sizeBytes           database file size after the batch
 * @param sizeWarning         set once the file is above the soft ceiling
 * @param continuationAllowed the caller may end the cycle after this batch
 * @param message             one-line summary for the agent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResult(
        boolean ok,
        List<StatementResult> results,
        Integer failedIndex,
        long sizeBytes,
        String sizeWarning,
        boolean continuationAllowed,
        String message) {

    public BatchResult {
        results = List.copyOf(results);
    }

    /** Database size in MB, rounded to two decimals. */
    public double dbSizeMb() {
        return Math.round(sizeBytes / (1024.0 * 1024.0) * 100.0) / 100.0;
    }

    public String status() {
        return ok ? "ok" : "error";
    }

    @JsonIgnore
    public Optional<StatementError> error() {
        return results.stream()
                .filter(r -> !r.ok())
                .map(StatementResult::error)
                .findFirst();
    }
}
