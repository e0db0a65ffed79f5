package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.ExchangeRate;
import com.financemanager.catalog.dto.CatalogResponses.ExchangeRateResponse;
import com.financemanager.catalog.dto.exchangerate.CreateExchangeRateRequest;
import com.financemanager.catalog.dto.exchangerate.ExchangeRateFilter;
import com.financemanager.catalog.dto.exchangerate.UpdateExchangeRateRequest;
import com.financemanager.catalog.errors.ExchangeRateErrors;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.ExchangeRateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Daily exchange rates. One rate per currency and date.
 */
@Service
@Transactional
public class ExchangeRateService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);

    private final ExchangeRateRepository exchangeRateRepository;
    private final CurrencyRepository currencyRepository;

    public ExchangeRateService(ExchangeRateRepository exchangeRateRepository,
                               CurrencyRepository currencyRepository) {
        this.exchangeRateRepository = exchangeRateRepository;
        this.currencyRepository = currencyRepository;
    }

    @Transactional(readOnly = true)
    public ExchangeRateResponse getById(UUID id) {
        return exchangeRateRepository.findById(id)
                .map(ExchangeRateResponse::new)
                .orElseThrow(() -> ExchangeRateErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<ExchangeRateResponse> getPaged(ExchangeRateFilter filter) {
        return exchangeRateRepository.getPaged(filter).stream()
                .map(ExchangeRateResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public boolean existsForCurrencyAndDate(UUID currencyId, LocalDate rateDate) {
        return exchangeRateRepository.existsByCurrencyIdAndRateDate(currencyId, rateDate);
    }

    /**
     * Most recent date with a rate for the currency.
     */
    @Transactional(readOnly = true)
    public LocalDate getLastRateDate(UUID currencyId) {
        return exchangeRateRepository.findLastRateDate(currencyId)
                .orElseThrow(() -> ExchangeRateErrors.noRates(currencyId));
    }

    public ExchangeRateResponse create(CreateExchangeRateRequest request) {
        Currency currency = validate(request);
        if (exchangeRateRepository.existsByCurrencyIdAndRateDate(currency.getId(), request.getRateDate())) {
            throw ExchangeRateErrors.alreadyExists(currency.getId(), request.getRateDate());
        }
        ExchangeRate rate = new ExchangeRate(currency, request.getRateDate(), request.getRate());
        ExchangeRate saved = exchangeRateRepository.save(rate);
        log.info("Exchange rate created - currency={}, date={}", currency.getId(), request.getRateDate());
        return new ExchangeRateResponse(saved);
    }

    /**
     * Bulk insert. Pairs already stored, or repeated within the batch, are skipped.
     *
     * @return the rates actually inserted
     */
    public List<ExchangeRateResponse> addRange(List<CreateExchangeRateRequest> requests) {
        List<ExchangeRate> toInsert = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CreateExchangeRateRequest request : requests) {
            Currency currency = validate(request);
            String key = currency.getId() + ":" + request.getRateDate();
            if (!seen.add(key)
                    || exchangeRateRepository.existsByCurrencyIdAndRateDate(currency.getId(), request.getRateDate())) {
                continue;
            }
            toInsert.add(new ExchangeRate(currency, request.getRateDate(), request.getRate()));
        }

        List<ExchangeRate> saved = exchangeRateRepository.saveAll(toInsert);
        log.info("Exchange rates inserted - requested={}, inserted={}", requests.size(), saved.size());
        return saved.stream()
                .map(ExchangeRateResponse::new)
                .collect(Collectors.toList());
    }

    public ExchangeRateResponse update(UpdateExchangeRateRequest request) {
        ExchangeRate exchangeRate = exchangeRateRepository.findById(request.getId())
                .orElseThrow(() -> ExchangeRateErrors.notFound(request.getId()));

        boolean changed = false;

        LocalDate rateDate = request.getRateDate();
        if (rateDate != null && !rateDate.equals(exchangeRate.getRateDate())) {
            UUID currencyId = exchangeRate.getCurrency().getId();
            if (exchangeRateRepository.existsByCurrencyIdAndRateDateAndIdNot(currencyId, rateDate, exchangeRate.getId())) {
                throw ExchangeRateErrors.alreadyExists(currencyId, rateDate);
            }
            exchangeRate.changeRateDate(rateDate);
            changed = true;
        }

        BigDecimal rate = request.getRate();
        if (rate != null && rate.compareTo(exchangeRate.getRate()) != 0) {
            if (rate.signum() == 0) {
                throw ExchangeRateErrors.valueRequired();
            }
            exchangeRate.changeRate(rate);
            changed = true;
        }

        if (changed) {
            exchangeRate = exchangeRateRepository.save(exchangeRate);
            log.info("Exchange rate updated - id={}", request.getId());
        }
        return new ExchangeRateResponse(exchangeRate);
    }

    public void delete(UUID id) {
        exchangeRateRepository.deleteById(id);
        log.info("Exchange rate deleted - id={}", id);
    }

    /**
     * Remove the currency's rates dated from {@code dateFrom} to {@code dateTo} inclusive.
     *
     * @return number of removed rates
     */
    public int deleteByPeriod(UUID currencyId, LocalDate dateFrom, LocalDate dateTo) {
        int removed = exchangeRateRepository.deleteByPeriod(currencyId, dateFrom, dateTo);
        log.info("Exchange rates removed - currency={}, from={}, to={}, count={}", currencyId, dateFrom, dateTo, removed);
        return removed;
    }

    private Currency validate(CreateExchangeRateRequest request) {
        if (request.getCurrencyId() == null) {
            throw ExchangeRateErrors.currencyRequired();
        }
        Currency currency = currencyRepository.findById(request.getCurrencyId())
                .orElseThrow(() -> ExchangeRateErrors.currencyNotFound(request.getCurrencyId()));
        if (request.getRateDate() == null) {
            throw ExchangeRateErrors.rateDateRequired();
        }
        if (request.getRate() == null || request.getRate().signum() == 0) {
            throw ExchangeRateErrors.valueRequired();
        }
        return currency;
    }
}
