package com.financemanager.transactions.domain;

/**
 * Role of a replicated registry holder, as assigned by the catalog.
 */
public enum Role {
    USER,
    ADMIN
}
