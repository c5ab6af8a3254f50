package de.bsommerfeld.scratchdb.db.exec;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable reason a statement in a batch did not succeed.
 */
public enum ErrorCode {
    INVALID_INPUT("invalid_input"),
    BLOCKED("blocked"),
    TRANSACTION_CONTROL_DISALLOWED("transaction_control_disallowed"),
    TIMEOUT("timeout"),
    CONSTRAINT_VIOLATION("constraint_violation"),
    SYNTAX_ERROR("syntax_error"),
    BUSY("busy"),
    SQL_ERROR("sql_error");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
