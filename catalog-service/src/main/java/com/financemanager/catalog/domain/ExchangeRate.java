package com.financemanager.catalog.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Rate of a currency on a date. One rate per (currency, date).
 */
@Entity
@Table(
    name = "exchange_rates",
    indexes = {
        @Index(name = "idx_exchange_rates_currency_date", columnList = "currency_id, rate_date", unique = true)
    }
)
public class ExchangeRate extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "currency_id", nullable = false)
    private Currency currency;

    @Column(name = "rate_date", nullable = false)
    private LocalDate rateDate;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal rate;

    protected ExchangeRate() {
    }

    public ExchangeRate(Currency currency, LocalDate rateDate, BigDecimal rate) {
        this.currency = Objects.requireNonNull(currency, "currency");
        this.rateDate = rateDate;
        this.rate = rate;
    }

    public UUID getId() {
        return id;
    }

    public Currency getCurrency() {
        return currency;
    }

    public LocalDate getRateDate() {
        return rateDate;
    }

    public BigDecimal getRate() {
        return rate;
    }

    public void changeRateDate(LocalDate rateDate) {
        this.rateDate = rateDate;
    }

    public void changeRate(BigDecimal rate) {
        this.rate = rate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExchangeRate that = (ExchangeRate) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ExchangeRate{id=" + id + ", rateDate=" + rateDate + ", rate=" + rate + '}';
    }
}
