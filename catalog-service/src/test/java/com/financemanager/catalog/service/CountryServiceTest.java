package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.dto.country.CreateCountryRequest;
import com.financemanager.catalog.dto.country.UpdateCountryRequest;
import com.financemanager.catalog.repository.CountryRepository;
import com.financemanager.common.error.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CountryServiceTest {

    @Mock CountryRepository countryRepository;

    @InjectMocks CountryService service;

    @Test @DisplayName("delete while banks reference it → COUNTRY_IN_USE (409)")
    void deleteInUse() {
        UUID id = UUID.randomUUID();
        when(countryRepository.canBeDeleted(id)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(id))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("COUNTRY_IN_USE");
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                });
        verify(countryRepository, never()).deleteById(any());
    }

    @Test @DisplayName("delete once the banks are gone → removed")
    void deleteAfterBanksGone() {
        UUID id = UUID.randomUUID();
        when(countryRepository.canBeDeleted(id)).thenReturn(true);

        service.delete(id);

        verify(countryRepository).deleteById(id);
    }

    @Test @DisplayName("blank name → COUNTRY_NAME_REQUIRED (400)")
    void blankName() {
        assertThatThrownBy(() -> service.create(new CreateCountryRequest(" ")))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("COUNTRY_NAME_REQUIRED");
                    assertThat(e.getMessage()).isEqualTo("Country name can't be empty.");
                });
    }

    @Test @DisplayName("duplicate name → COUNTRY_NAME_EXISTS")
    void duplicateName() {
        when(countryRepository.isNameUnique("russia", null)).thenReturn(false);

        assertThatThrownBy(() -> service.create(new CreateCountryRequest("russia")))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.getMessage()).isEqualTo("Country with name 'russia' already exists."));
    }

    @Test @DisplayName("rename to the same name → no save")
    void renameSame() {
        Country country = new Country("Georgia");
        ReflectionTestUtils.setField(country, "id", UUID.randomUUID());
        when(countryRepository.findById(country.getId())).thenReturn(Optional.of(country));

        var result = service.update(new UpdateCountryRequest(country.getId(), "Georgia"));

        assertThat(result.getName()).isEqualTo("Georgia");
        verify(countryRepository, never()).save(any());
    }
}
