package de.bsommerfeld.scratchdb.db.guard;

import java.sql.SQLException;
import java.time.Duration;

/**
 * A statement ran past its deadline and was interrupted by the progress
 * handler of its {@link GuardedSession}.
 */
public class QueryTimeoutException extends SQLException {

    public QueryTimeoutException(Duration timeout, Throwable cause) {
        super("Query exceeded the time limit of " + timeout.toMillis() + " ms and was interrupted", cause);
    }
}
