package com.financemanager.catalog.dto.exchangerate;

import com.financemanager.common.dto.PageFilter;
import org.springframework.format.annotation.DateTimeFormat;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

public class ExchangeRateFilter extends PageFilter {

    private UUID currencyId;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate dateTo;

    private BigDecimal rateFrom;
    private BigDecimal rateTo;

    public ExchangeRateFilter() {
    }

    public ExchangeRateFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public UUID getCurrencyId() {
        return currencyId;
    }

    public void setCurrencyId(UUID currencyId) {
        this.currencyId = currencyId;
    }

    public LocalDate getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(LocalDate dateFrom) {
        this.dateFrom = dateFrom;
    }

    public LocalDate getDateTo() {
        return dateTo;
    }

    public void setDateTo(LocalDate dateTo) {
        this.dateTo = dateTo;
    }

    public BigDecimal getRateFrom() {
        return rateFrom;
    }

    public void setRateFrom(BigDecimal rateFrom) {
        this.rateFrom = rateFrom;
    }

    public BigDecimal getRateTo() {
        return rateTo;
    }

    public void setRateTo(BigDecimal rateTo) {
        this.rateTo = rateTo;
    }
}
