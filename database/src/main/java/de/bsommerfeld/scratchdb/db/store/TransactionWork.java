package de.bsommerfeld.scratchdb.db.store;

/** Unit of work executed by {@link RecordStore#inTransaction}. */
@FunctionalInterface
public interface TransactionWork<T> {

    T run(RecordTransaction tx);
}
