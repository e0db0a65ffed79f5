package com.financemanager.catalog.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Owner of accounts and categories, identified externally by a Telegram user id.
 *
 * telegramId is positive and unique across holders.
 */
@Entity
@Table(
    name = "registry_holders",
    indexes = {
        @Index(name = "idx_registry_holders_telegram_id", columnList = "telegram_id", unique = true)
    }
)
public class RegistryHolder extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "telegram_id", nullable = false)
    private long telegramId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RegistryHolderRole role;

    protected RegistryHolder() {
    }

    public RegistryHolder(long telegramId, RegistryHolderRole role) {
        this.telegramId = telegramId;
        this.role = role != null ? role : RegistryHolderRole.USER;
    }

    public UUID getId() {
        return id;
    }

    public long getTelegramId() {
        return telegramId;
    }

    public RegistryHolderRole getRole() {
        return role;
    }

    public void changeTelegramId(long telegramId) {
        this.telegramId = telegramId;
    }

    public void changeRole(RegistryHolderRole role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RegistryHolder that = (RegistryHolder) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RegistryHolder{" +
                "id=" + id +
                ", telegramId=" + telegramId +
                ", role=" + role +
                '}';
    }
}
