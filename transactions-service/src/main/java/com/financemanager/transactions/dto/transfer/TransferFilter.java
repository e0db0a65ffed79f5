package com.financemanager.transactions.dto.transfer;

import com.financemanager.common.dto.PageFilter;
import org.springframework.format.annotation.DateTimeFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public class TransferFilter extends PageFilter {

    private UUID fromAccountId;
    private UUID toAccountId;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private Instant dateFrom;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private Instant dateTo;

    private BigDecimal fromAmountFrom;
    private BigDecimal fromAmountTo;
    private BigDecimal toAmountFrom;
    private BigDecimal toAmountTo;
    private String descriptionContains;

    public TransferFilter() {
    }

    public TransferFilter(Integer page, Integer itemsPerPage) {
        super(page, itemsPerPage);
    }

    public UUID getFromAccountId() {
        return fromAccountId;
    }

    public void setFromAccountId(UUID fromAccountId) {
        this.fromAccountId = fromAccountId;
    }

    public UUID getToAccountId() {
        return toAccountId;
    }

    public void setToAccountId(UUID toAccountId) {
        this.toAccountId = toAccountId;
    }

    public Instant getDateFrom() {
        return dateFrom;
    }

    public void setDateFrom(Instant dateFrom) {
        this.dateFrom = dateFrom;
    }

    public Instant getDateTo() {
        return dateTo;
    }

    public void setDateTo(Instant dateTo) {
        this.dateTo = dateTo;
    }

    public BigDecimal getFromAmountFrom() {
        return fromAmountFrom;
    }

    public void setFromAmountFrom(BigDecimal fromAmountFrom) {
        this.fromAmountFrom = fromAmountFrom;
    }

    public BigDecimal getFromAmountTo() {
        return fromAmountTo;
    }

    public void setFromAmountTo(BigDecimal fromAmountTo) {
        this.fromAmountTo = fromAmountTo;
    }

    public BigDecimal getToAmountFrom() {
        return toAmountFrom;
    }

    public void setToAmountFrom(BigDecimal toAmountFrom) {
        this.toAmountFrom = toAmountFrom;
    }

    public BigDecimal getToAmountTo() {
        return toAmountTo;
    }

    public void setToAmountTo(BigDecimal toAmountTo) {
        this.toAmountTo = toAmountTo;
    }

    public String getDescriptionContains() {
        return descriptionContains;
    }

    public void setDescriptionContains(String descriptionContains) {
        this.descriptionContains = descriptionContains;
    }
}
