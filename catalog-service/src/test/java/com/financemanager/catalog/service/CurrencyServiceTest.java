package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.dto.currency.CreateCurrencyRequest;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.common.error.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CurrencyServiceTest {

    @Mock CurrencyRepository currencyRepository;

    @InjectMocks CurrencyService service;

    @Test @DisplayName("charCode checked before numCode and name")
    void requiredOrder() {
        var req = new CreateCurrencyRequest(null, null, null, null, null);

        assertThatThrownBy(() -> service.create(req))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CURRENCY_CHARCODE_REQUIRED"));
    }

    @Test @DisplayName("charCode taken in another casing → CURRENCY_CHARCODE_EXISTS")
    void duplicateCharCode() {
        when(currencyRepository.isCharCodeUnique("RUB", null)).thenReturn(false);
        var req = new CreateCurrencyRequest("RUB", "643", "Russian ruble", "₽", null);

        assertThatThrownBy(() -> service.create(req))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("CURRENCY_CHARCODE_EXISTS");
                    assertThat(e.getMessage()).isEqualTo("Currency with charCode 'RUB' already exists.");
                });
        verify(currencyRepository, never()).save(any());
    }

    @Test @DisplayName("numCode taken → CURRENCY_NUMCODE_EXISTS")
    void duplicateNumCode() {
        when(currencyRepository.isCharCodeUnique("XTS", null)).thenReturn(true);
        when(currencyRepository.isNumCodeUnique("643", null)).thenReturn(false);
        var req = new CreateCurrencyRequest("XTS", "643", "Test", null, null);

        assertThatThrownBy(() -> service.create(req))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CURRENCY_NUMCODE_EXISTS"));
    }

    @Test @DisplayName("valid currency → saved and returned")
    void createSaved() {
        when(currencyRepository.isCharCodeUnique("AMD", null)).thenReturn(true);
        when(currencyRepository.isNumCodeUnique("051", null)).thenReturn(true);
        when(currencyRepository.save(any(Currency.class))).thenAnswer(inv -> inv.getArgument(0));

        var response = service.create(new CreateCurrencyRequest("AMD", "051", "Armenian dram", "֏", null));

        assertThat(response.getCharCode()).isEqualTo("AMD");
        assertThat(response.getNumCode()).isEqualTo("051");
    }

    @Test @DisplayName("restore of a non-deleted currency is a no-op")
    void restoreNotDeleted() {
        Currency usd = new Currency("USD", "840", "US dollar", "$", null);
        ReflectionTestUtils.setField(usd, "id", UUID.randomUUID());
        when(currencyRepository.findById(usd.getId())).thenReturn(Optional.of(usd));

        service.restore(usd.getId());

        verify(currencyRepository, never()).save(any());
    }

    @Test @DisplayName("delete while referenced → CURRENCY_IN_USE")
    void deleteInUse() {
        UUID id = UUID.randomUUID();
        when(currencyRepository.canBeDeleted(id)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(id))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getCode()).isEqualTo("CURRENCY_IN_USE"));
    }
}
