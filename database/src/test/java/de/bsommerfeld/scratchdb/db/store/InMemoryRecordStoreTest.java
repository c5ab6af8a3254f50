package de.bsommerfeld.scratchdb.db.store;

class InMemoryRecordStoreTest extends RecordStoreContract {

    @Override
    RecordStore createStore() {
        return new InMemoryRecordStore();
    }
}
