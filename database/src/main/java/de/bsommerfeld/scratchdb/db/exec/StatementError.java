package de.bsommerfeld.scratchdb.db.exec;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Why the statement at {@code index} failed, with an optional actionable
 * hint derived from the engine's message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatementError(ErrorCode code, String message, int index, String sql, String hint) {
}
