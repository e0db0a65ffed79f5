package com.financemanager.catalog.errors;

import com.financemanager.common.error.BusinessException;
import com.financemanager.common.error.ErrorsFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

public final class ExchangeRateErrors {

    private static final String ENTITY = "ExchangeRate";

    private ExchangeRateErrors() {
    }

    public static BusinessException notFound(UUID id) {
        return new BusinessException(ErrorsFactory.notFound("EXCHANGERATE_NOT_FOUND", ENTITY, id));
    }

    public static BusinessException noRates(UUID currencyId) {
        return new BusinessException(ErrorsFactory.customNotFound("EXCHANGERATE_NOT_FOUND",
                String.format("Currency '%s' has no exchange rates", currencyId)));
    }

    public static BusinessException alreadyExists(UUID currencyId, LocalDate rateDate) {
        String value = currencyId + ":" + rateDate.format(DateTimeFormatter.ISO_LOCAL_DATE);
        return new BusinessException(ErrorsFactory.alreadyExists("EXCHANGERATE_EXISTS", ENTITY, "CurrencyId:RateDate", value));
    }

    public static BusinessException currencyRequired() {
        return new BusinessException(ErrorsFactory.required("EXCHANGERATE_CURRENCY_REQUIRED", ENTITY, "currencyId"));
    }

    public static BusinessException currencyNotFound(UUID currencyId) {
        return new BusinessException(ErrorsFactory.notFound("EXCHANGERATE_CURRENCY_NOT_FOUND", "Currency", currencyId));
    }

    public static BusinessException rateDateRequired() {
        return new BusinessException(ErrorsFactory.required("EXCHANGERATE_RATEDATE_REQUIRED", ENTITY, "rateDate"));
    }

    public static BusinessException valueRequired() {
        return new BusinessException(ErrorsFactory.required("EXCHANGERATE_VALUE_REQUIRED", ENTITY, "rate"));
    }
}
