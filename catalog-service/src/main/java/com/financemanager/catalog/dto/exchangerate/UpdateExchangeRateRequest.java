package com.financemanager.catalog.dto.exchangerate;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
public class UpdateExchangeRateRequest {

    @NotNull(message = "Id is required")
    private UUID id;

    private LocalDate rateDate;
    private BigDecimal rate;

    public UpdateExchangeRateRequest() {
    }

    public UpdateExchangeRateRequest(UUID id, LocalDate rateDate, BigDecimal rate) {
        this.id = id;
        this.rateDate = rateDate;
        this.rate = rate;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public LocalDate getRateDate() {
        return rateDate;
    }

    public void setRateDate(LocalDate rateDate) {
        this.rateDate = rateDate;
    }

    public BigDecimal getRate() {
        return rate;
    }

    public void setRate(BigDecimal rate) {
        this.rate = rate;
    }
}
