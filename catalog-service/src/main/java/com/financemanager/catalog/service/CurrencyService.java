package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.dto.CatalogResponses.CurrencyResponse;
import com.financemanager.catalog.dto.currency.CreateCurrencyRequest;
import com.financemanager.catalog.dto.currency.CurrencyFilter;
import com.financemanager.catalog.dto.currency.UpdateCurrencyRequest;
import com.financemanager.catalog.errors.CurrencyErrors;
import com.financemanager.catalog.repository.CurrencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Currencies are identified by ISO char and numeric codes, both unique ignoring case.
 */
@Service
@Transactional
public class CurrencyService {

    private static final Logger log = LoggerFactory.getLogger(CurrencyService.class);

    /** Sort keys accepted by {@link #getAll(String, boolean, boolean)}. */
    public static final String ORDER_BY_NAME = "name";
    public static final String ORDER_BY_CHAR_CODE = "charCode";

    private final CurrencyRepository currencyRepository;

    public CurrencyService(CurrencyRepository currencyRepository) {
        this.currencyRepository = currencyRepository;
    }

    @Transactional(readOnly = true)
    public CurrencyResponse getById(UUID id) {
        return currencyRepository.findById(id)
                .map(CurrencyResponse::new)
                .orElseThrow(() -> CurrencyErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<CurrencyResponse> getPaged(CurrencyFilter filter) {
        return currencyRepository.getPaged(filter).stream()
                .map(CurrencyResponse::new)
                .collect(Collectors.toList());
    }

    /**
     * @param orderBy {@value #ORDER_BY_NAME} or {@value #ORDER_BY_CHAR_CODE}; anything else sorts by name
     */
    @Transactional(readOnly = true)
    public List<CurrencyResponse> getAll(String orderBy, boolean includeDeleted, boolean ascending) {
        String property = ORDER_BY_CHAR_CODE.equalsIgnoreCase(orderBy) ? ORDER_BY_CHAR_CODE : ORDER_BY_NAME;
        return currencyRepository.findAllOrdered(property, includeDeleted, ascending).stream()
                .map(CurrencyResponse::new)
                .collect(Collectors.toList());
    }

    public CurrencyResponse create(CreateCurrencyRequest request) {
        if (!StringUtils.hasText(request.getCharCode())) {
            throw CurrencyErrors.charCodeRequired();
        }
        if (!StringUtils.hasText(request.getNumCode())) {
            throw CurrencyErrors.numCodeRequired();
        }
        if (!StringUtils.hasText(request.getName())) {
            throw CurrencyErrors.nameRequired();
        }
        if (!currencyRepository.isCharCodeUnique(request.getCharCode(), null)) {
            throw CurrencyErrors.charCodeExists(request.getCharCode());
        }
        if (!currencyRepository.isNumCodeUnique(request.getNumCode(), null)) {
            throw CurrencyErrors.numCodeExists(request.getNumCode());
        }

        Currency currency = new Currency(request.getCharCode(), request.getNumCode(), request.getName(),
                request.getSign(), request.getEmoji());
        Currency saved = currencyRepository.save(currency);
        log.info("Currency created - charCode={}, numCode={}", request.getCharCode(), request.getNumCode());
        return new CurrencyResponse(saved);
    }

    public CurrencyResponse update(UpdateCurrencyRequest request) {
        Currency currency = currencyRepository.findById(request.getId())
                .orElseThrow(() -> CurrencyErrors.notFound(request.getId()));

        boolean changed = false;

        String name = request.getName();
        if (name != null && !name.equals(currency.getName())) {
            if (!StringUtils.hasText(name)) {
                throw CurrencyErrors.nameRequired();
            }
            currency.rename(name);
            changed = true;
        }

        String charCode = request.getCharCode();
        if (charCode != null && !charCode.equals(currency.getCharCode())) {
            if (!StringUtils.hasText(charCode)) {
                throw CurrencyErrors.charCodeRequired();
            }
            if (!currencyRepository.isCharCodeUnique(charCode, currency.getId())) {
                throw CurrencyErrors.charCodeExists(charCode);
            }
            currency.changeCharCode(charCode);
            changed = true;
        }

        String numCode = request.getNumCode();
        if (numCode != null && !numCode.equals(currency.getNumCode())) {
            if (!StringUtils.hasText(numCode)) {
                throw CurrencyErrors.numCodeRequired();
            }
            if (!currencyRepository.isNumCodeUnique(numCode, currency.getId())) {
                throw CurrencyErrors.numCodeExists(numCode);
            }
            currency.changeNumCode(numCode);
            changed = true;
        }

        if (request.getSign() != null && !Objects.equals(request.getSign(), currency.getSign())) {
            currency.changeSign(request.getSign());
            changed = true;
        }

        if (request.getEmoji() != null && !Objects.equals(request.getEmoji(), currency.getEmoji())) {
            currency.changeEmoji(request.getEmoji());
            changed = true;
        }

        if (changed) {
            currency = currencyRepository.save(currency);
            log.info("Currency updated - id={}", request.getId());
        }
        return new CurrencyResponse(currency);
    }

    public void softDelete(UUID id) {
        Currency currency = currencyRepository.findById(id)
                .orElseThrow(() -> CurrencyErrors.notFound(id));
        if (currency.markDeleted()) {
            currencyRepository.save(currency);
            log.info("Currency soft deleted - id={}", id);
        }
    }

    public void restore(UUID id) {
        Currency currency = currencyRepository.findById(id)
                .orElseThrow(() -> CurrencyErrors.notFound(id));
        if (currency.restore()) {
            currencyRepository.save(currency);
            log.info("Currency restored - id={}", id);
        }
    }

    public void delete(UUID id) {
        if (!currencyRepository.canBeDeleted(id)) {
            throw CurrencyErrors.inUse(id);
        }
        currencyRepository.deleteById(id);
        log.info("Currency deleted - id={}", id);
    }
}
