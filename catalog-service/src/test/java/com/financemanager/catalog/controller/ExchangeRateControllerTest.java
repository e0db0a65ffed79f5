package com.financemanager.catalog.controller;

import com.financemanager.catalog.errors.ExchangeRateErrors;
import com.financemanager.catalog.service.ExchangeRateService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExchangeRateController.class)
class ExchangeRateControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean ExchangeRateService exchangeRateService;

    @Test @DisplayName("GET last-date → ISO date")
    void lastDate() throws Exception {
        UUID currencyId = UUID.randomUUID();
        when(exchangeRateService.getLastRateDate(currencyId)).thenReturn(LocalDate.of(2024, 5, 2));

        mockMvc.perform(get("/api/v1/ExchangeRate/last-date/{currencyId}", currencyId))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$").value("2024-05-02"));
    }

    @Test @DisplayName("GET last-date for a currency without rates → 404 problem with errorCode")
    void lastDateWithoutRates() throws Exception {
        UUID currencyId = UUID.randomUUID();
        when(exchangeRateService.getLastRateDate(currencyId)).thenThrow(ExchangeRateErrors.noRates(currencyId));

        mockMvc.perform(get("/api/v1/ExchangeRate/last-date/{currencyId}", currencyId))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.errorCode").value("EXCHANGERATE_NOT_FOUND"))
               .andExpect(jsonPath("$.status").value(404))
               .andExpect(jsonPath("$.instance").value("/api/v1/ExchangeRate/last-date/" + currencyId));
    }
}
