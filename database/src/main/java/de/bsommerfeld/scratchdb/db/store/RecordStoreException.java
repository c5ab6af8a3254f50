package de.bsommerfeld.scratchdb.db.store;

/** Failure of the durable record store. */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
