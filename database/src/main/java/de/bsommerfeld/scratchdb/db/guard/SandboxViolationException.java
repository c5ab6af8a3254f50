package de.bsommerfeld.scratchdb.db.guard;

import java.sql.SQLException;

/**
 * Raised when a statement is denied before it reaches the engine. The
 * message is the block reason shown to the caller.
 */
public class SandboxViolationException extends SQLException {

    private final String reason;

    public SandboxViolationException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
