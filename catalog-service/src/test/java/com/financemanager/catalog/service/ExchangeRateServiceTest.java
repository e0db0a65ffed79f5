package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.ExchangeRate;
import com.financemanager.catalog.dto.CatalogResponses.ExchangeRateResponse;
import com.financemanager.catalog.dto.exchangerate.CreateExchangeRateRequest;
import com.financemanager.catalog.dto.exchangerate.UpdateExchangeRateRequest;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.ExchangeRateRepository;
import com.financemanager.common.error.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExchangeRateServiceTest {

    private static final LocalDate MAY_1 = LocalDate.of(2024, 5, 1);
    private static final LocalDate MAY_2 = LocalDate.of(2024, 5, 2);

    @Mock ExchangeRateRepository exchangeRateRepository;
    @Mock CurrencyRepository currencyRepository;

    @Captor ArgumentCaptor<List<ExchangeRate>> batchCaptor;

    @InjectMocks ExchangeRateService service;

    private Currency usd;
    private Currency eur;

    @BeforeEach
    void setUp() {
        usd = currency("USD", "840");
        eur = currency("EUR", "978");
    }

    private static Currency currency(String charCode, String numCode) {
        Currency currency = new Currency(charCode, numCode, charCode, null, null);
        ReflectionTestUtils.setField(currency, "id", UUID.randomUUID());
        return currency;
    }

    private static ExchangeRate rate(Currency currency, LocalDate date, String value) {
        ExchangeRate rate = new ExchangeRate(currency, date, new BigDecimal(value));
        ReflectionTestUtils.setField(rate, "id", UUID.randomUUID());
        return rate;
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test @DisplayName("rate for that currency and date already stored → EXCHANGERATE_EXISTS (409)")
        void duplicatePair() {
            when(currencyRepository.findById(usd.getId())).thenReturn(Optional.of(usd));
            when(exchangeRateRepository.existsByCurrencyIdAndRateDate(usd.getId(), MAY_1)).thenReturn(true);

            assertThatThrownBy(() -> service.create(new CreateExchangeRateRequest(usd.getId(), MAY_1, new BigDecimal("90.5"))))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("EXCHANGERATE_EXISTS");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                    });
            verify(exchangeRateRepository, never()).save(any(ExchangeRate.class));
        }

        @Test @DisplayName("zero rate → EXCHANGERATE_VALUE_REQUIRED (400)")
        void zeroRate() {
            when(currencyRepository.findById(usd.getId())).thenReturn(Optional.of(usd));

            assertThatThrownBy(() -> service.create(new CreateExchangeRateRequest(usd.getId(), MAY_1, new BigDecimal("0.00"))))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("EXCHANGERATE_VALUE_REQUIRED");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    });
            verify(exchangeRateRepository, never()).existsByCurrencyIdAndRateDate(any(), any());
        }

        @Test @DisplayName("unknown currency → EXCHANGERATE_CURRENCY_NOT_FOUND")
        void unknownCurrency() {
            UUID missing = UUID.randomUUID();
            when(currencyRepository.findById(missing)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.create(new CreateExchangeRateRequest(missing, MAY_1, BigDecimal.ONE)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getCode()).isEqualTo("EXCHANGERATE_CURRENCY_NOT_FOUND"));
        }
    }

    @Test @DisplayName("addRange skips pairs already stored and pairs repeated in the batch")
    void addRangeSkipsKnownPairs() {
        when(currencyRepository.findById(usd.getId())).thenReturn(Optional.of(usd));
        when(currencyRepository.findById(eur.getId())).thenReturn(Optional.of(eur));
        when(exchangeRateRepository.existsByCurrencyIdAndRateDate(usd.getId(), MAY_1)).thenReturn(false);
        when(exchangeRateRepository.existsByCurrencyIdAndRateDate(usd.getId(), MAY_2)).thenReturn(true);
        when(exchangeRateRepository.existsByCurrencyIdAndRateDate(eur.getId(), MAY_1)).thenReturn(false);
        when(exchangeRateRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));

        List<ExchangeRateResponse> inserted = service.addRange(List.of(
                new CreateExchangeRateRequest(usd.getId(), MAY_1, new BigDecimal("90")),
                new CreateExchangeRateRequest(usd.getId(), MAY_1, new BigDecimal("91")),
                new CreateExchangeRateRequest(usd.getId(), MAY_2, new BigDecimal("92")),
                new CreateExchangeRateRequest(eur.getId(), MAY_1, new BigDecimal("99"))));

        verify(exchangeRateRepository).saveAll(batchCaptor.capture());
        assertThat(batchCaptor.getValue())
                .extracting(r -> r.getCurrency().getCharCode(), ExchangeRate::getRateDate, ExchangeRate::getRate)
                .containsExactly(
                        tuple("USD", MAY_1, new BigDecimal("90")),
                        tuple("EUR", MAY_1, new BigDecimal("99")));
        assertThat(inserted).hasSize(2);
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test @DisplayName("moving to a date that already has a rate → EXCHANGERATE_EXISTS")
        void dateTaken() {
            ExchangeRate existing = rate(usd, MAY_1, "90");
            when(exchangeRateRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
            when(exchangeRateRepository.existsByCurrencyIdAndRateDateAndIdNot(usd.getId(), MAY_2, existing.getId()))
                    .thenReturn(true);

            assertThatThrownBy(() -> service.update(new UpdateExchangeRateRequest(existing.getId(), MAY_2, null)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getCode()).isEqualTo("EXCHANGERATE_EXISTS"));
            assertThat(existing.getRateDate()).isEqualTo(MAY_1);
        }

        @Test @DisplayName("new date excludes the rate itself from the duplicate check")
        void dateFree() {
            ExchangeRate existing = rate(usd, MAY_1, "90");
            when(exchangeRateRepository.findById(existing.getId())).thenReturn(Optional.of(existing));
            when(exchangeRateRepository.existsByCurrencyIdAndRateDateAndIdNot(usd.getId(), MAY_2, existing.getId()))
                    .thenReturn(false);
            when(exchangeRateRepository.save(existing)).thenReturn(existing);

            ExchangeRateResponse response = service.update(new UpdateExchangeRateRequest(existing.getId(), MAY_2, null));

            assertThat(response.getRateDate()).isEqualTo(MAY_2);
        }

        @Test @DisplayName("zero rate → EXCHANGERATE_VALUE_REQUIRED")
        void zeroRate() {
            ExchangeRate existing = rate(usd, MAY_1, "90");
            when(exchangeRateRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

            assertThatThrownBy(() -> service.update(new UpdateExchangeRateRequest(existing.getId(), null, BigDecimal.ZERO)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getCode()).isEqualTo("EXCHANGERATE_VALUE_REQUIRED"));
            verify(exchangeRateRepository, never()).save(any(ExchangeRate.class));
        }

        @Test @DisplayName("same rate with a different scale → nothing saved")
        void sameRateDifferentScale() {
            ExchangeRate existing = rate(usd, MAY_1, "90");
            when(exchangeRateRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

            service.update(new UpdateExchangeRateRequest(existing.getId(), MAY_1, new BigDecimal("90.0000")));

            verify(exchangeRateRepository, never()).save(any(ExchangeRate.class));
        }
    }

    @Test @DisplayName("last rate date of a currency without rates → EXCHANGERATE_NOT_FOUND (404)")
    void lastRateDateWithoutRates() {
        when(exchangeRateRepository.findLastRateDate(usd.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getLastRateDate(usd.getId()))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("EXCHANGERATE_NOT_FOUND");
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
                });
    }

    @Test @DisplayName("last rate date → most recent stored date")
    void lastRateDate() {
        when(exchangeRateRepository.findLastRateDate(usd.getId())).thenReturn(Optional.of(MAY_2));

        assertThat(service.getLastRateDate(usd.getId())).isEqualTo(MAY_2);
    }
}
