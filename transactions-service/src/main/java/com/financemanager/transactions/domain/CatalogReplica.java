package com.financemanager.transactions.domain;

import java.util.UUID;

/**
 * Local copy of a catalog record. The id is the catalog's id, never generated here.
 */
public interface CatalogReplica {

    UUID getId();

    /**
     * Called when the record no longer appears in the catalog collection.
     *
     * @return true if the replica changed and has to be saved
     */
    default boolean markMissing() {
        return false;
    }
}
