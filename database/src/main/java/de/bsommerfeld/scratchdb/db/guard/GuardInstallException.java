package de.bsommerfeld.scratchdb.db.guard;

import java.sql.SQLException;

/**
 * The sandbox could not be installed on a fresh connection. The connection
 * has already been closed when this is thrown.
 */
public class GuardInstallException extends SQLException {

    public GuardInstallException(String message, Throwable cause) {
        super(message, cause);
    }
}
