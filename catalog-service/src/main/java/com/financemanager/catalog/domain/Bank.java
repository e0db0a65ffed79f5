package com.financemanager.catalog.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Bank operating in a country. The name is unique within its country only.
 */
@Entity
@Table(
    name = "banks",
    indexes = {
        @Index(name = "idx_banks_country_id", columnList = "country_id")
    }
)
public class Bank extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "country_id", nullable = false)
    private Country country;

    @Column(nullable = false, length = 200)
    private String name;

    protected Bank() {
    }

    public Bank(Country country, String name) {
        this.country = Objects.requireNonNull(country, "country");
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public Country getCountry() {
        return country;
    }

    public String getName() {
        return name;
    }

    public void moveTo(Country country) {
        this.country = Objects.requireNonNull(country, "country");
    }

    public void rename(String name) {
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Bank bank = (Bank) o;
        return id != null && Objects.equals(id, bank.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Bank{id=" + id + ", name='" + name + "'}";
    }
}
