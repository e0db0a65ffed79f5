package com.financemanager.common.domain;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * Entity that can be marked inactive instead of being removed.
 *
 * Soft delete is a flag filtered in queries; {@link #restore()} reverses it.
 * Both transitions report whether anything changed so that callers can skip
 * the save for a repeated call.
 */
@MappedSuperclass
public abstract class SoftDeletableEntity extends AuditedEntity {

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * @return false if the entity was already deleted
     */
    public boolean markDeleted() {
        if (deleted) {
            return false;
        }
        deleted = true;
        return true;
    }

    /**
     * @return false if the entity was not deleted
     */
    public boolean restore() {
        if (!deleted) {
            return false;
        }
        deleted = false;
        return true;
    }

    protected void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }
}
