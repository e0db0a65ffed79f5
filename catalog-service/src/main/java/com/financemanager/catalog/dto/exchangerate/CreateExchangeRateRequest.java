package com.financemanager.catalog.dto.exchangerate;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public class CreateExchangeRateRequest {

    private UUID currencyId;
    private LocalDate rateDate;
    private BigDecimal rate;

    public CreateExchangeRateRequest() {
    }

    public CreateExchangeRateRequest(UUID currencyId, LocalDate rateDate, BigDecimal rate) {
        this.currencyId = currencyId;
        this.rateDate = rateDate;
        this.rate = rate;
    }

    public UUID getCurrencyId() {
        return currencyId;
    }

    public void setCurrencyId(UUID currencyId) {
        this.currencyId = currencyId;
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
