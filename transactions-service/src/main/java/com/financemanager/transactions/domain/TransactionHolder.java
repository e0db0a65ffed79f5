package com.financemanager.transactions.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Replica of a catalog registry holder.
 */
@Entity
@Table(name = "transaction_holders")
public class TransactionHolder extends AuditedEntity implements CatalogReplica {

    @Id
    private UUID id;

    @Column(name = "telegram_id", nullable = false)
    private long telegramId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role;

    protected TransactionHolder() {
    }

    public TransactionHolder(UUID id, long telegramId, Role role) {
        this.id = Objects.requireNonNull(id, "id");
        this.telegramId = telegramId;
        this.role = role != null ? role : Role.USER;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public long getTelegramId() {
        return telegramId;
    }

    public Role getRole() {
        return role;
    }

    /**
     * @return true if any field changed
     */
    public boolean refresh(long telegramId, Role role) {
        Role newRole = role != null ? role : Role.USER;
        if (this.telegramId == telegramId && this.role == newRole) {
            return false;
        }
        this.telegramId = telegramId;
        this.role = newRole;
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransactionHolder that = (TransactionHolder) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TransactionHolder{id=" + id + ", telegramId=" + telegramId + ", role=" + role + '}';
    }
}
