package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.CountResponse;
import com.financemanager.catalog.dto.CatalogResponses.ExchangeRateResponse;
import com.financemanager.catalog.dto.exchangerate.CreateExchangeRateRequest;
import com.financemanager.catalog.dto.exchangerate.ExchangeRateFilter;
import com.financemanager.catalog.dto.exchangerate.UpdateExchangeRateRequest;
import com.financemanager.catalog.service.ExchangeRateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Exchange rates. Dates are ISO {@code yyyy-MM-dd}.
 */
@RestController
@RequestMapping("/api/v1/ExchangeRate")
@Tag(name = "Exchange rates")
public class ExchangeRateController {

    private final ExchangeRateService exchangeRateService;

    public ExchangeRateController(ExchangeRateService exchangeRateService) {
        this.exchangeRateService = exchangeRateService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get exchange rate")
    public ResponseEntity<ExchangeRateResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(exchangeRateService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List exchange rates")
    public ResponseEntity<List<ExchangeRateResponse>> getPaged(@Valid @ModelAttribute ExchangeRateFilter filter) {
        return ResponseEntity.ok(exchangeRateService.getPaged(filter));
    }

    @GetMapping("/exists")
    @Operation(summary = "Check rate", description = "True when the currency has a rate on this date")
    public ResponseEntity<Boolean> exists(@RequestParam UUID currencyId,
                                          @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate rateDate) {
        return ResponseEntity.ok(exchangeRateService.existsForCurrencyAndDate(currencyId, rateDate));
    }

    @GetMapping("/last-date/{currencyId}")
    @Operation(summary = "Last rate date")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Most recent rate date"),
        @ApiResponse(responseCode = "404", description = "Currency has no rates")
    })
    public ResponseEntity<LocalDate> getLastRateDate(@PathVariable UUID currencyId) {
        return ResponseEntity.ok(exchangeRateService.getLastRateDate(currencyId));
    }

    @PostMapping
    @Operation(summary = "Create exchange rate")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Rate created"),
        @ApiResponse(responseCode = "400", description = "Currency, date or non-zero rate missing"),
        @ApiResponse(responseCode = "404", description = "Currency not found"),
        @ApiResponse(responseCode = "409", description = "Rate for this currency and date exists")
    })
    public ResponseEntity<ExchangeRateResponse> create(@Valid @RequestBody CreateExchangeRateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exchangeRateService.create(request));
    }

    @PostMapping("/range")
    @Operation(summary = "Bulk create", description = "Rates already stored for a currency and date are skipped")
    public ResponseEntity<List<ExchangeRateResponse>> addRange(@Valid @RequestBody List<CreateExchangeRateRequest> requests) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exchangeRateService.addRange(requests));
    }

    @PutMapping
    @Operation(summary = "Update exchange rate")
    public ResponseEntity<ExchangeRateResponse> update(@Valid @RequestBody UpdateExchangeRateRequest request) {
        return ResponseEntity.ok(exchangeRateService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete exchange rate")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        exchangeRateService.delete(id);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/period")
    @Operation(summary = "Delete rates of a period", description = "Both bounds inclusive")
    public ResponseEntity<CountResponse> deleteByPeriod(
            @RequestParam UUID currencyId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {
        return ResponseEntity.ok(new CountResponse(exchangeRateService.deleteByPeriod(currencyId, dateFrom, dateTo)));
    }
}
