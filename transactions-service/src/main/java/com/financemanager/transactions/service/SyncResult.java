package com.financemanager.transactions.service;

/**
 * Counts of one replication cycle of one catalog collection.
 */
public class SyncResult {

    private final int fetched;
    private final int inserted;
    private final int updated;
    private final int deleted;

    public SyncResult(int fetched, int inserted, int updated, int deleted) {
        this.fetched = fetched;
        this.inserted = inserted;
        this.updated = updated;
        this.deleted = deleted;
    }

    public int getFetched() { return fetched; }
    public int getInserted() { return inserted; }
    public int getUpdated() { return updated; }
    public int getDeleted() { return deleted; }

    public boolean hasChanges() {
        return inserted + updated + deleted > 0;
    }

    @Override
    public String toString() {
        return "fetched=" + fetched + ", inserted=" + inserted + ", updated=" + updated + ", deleted=" + deleted;
    }
}
