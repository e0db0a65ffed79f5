package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.CurrencyResponse;
import com.financemanager.catalog.dto.currency.CreateCurrencyRequest;
import com.financemanager.catalog.dto.currency.CurrencyFilter;
import com.financemanager.catalog.dto.currency.UpdateCurrencyRequest;
import com.financemanager.catalog.service.CurrencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/Currency")
@Tag(name = "Currencies")
public class CurrencyController {

    private final CurrencyService currencyService;

    public CurrencyController(CurrencyService currencyService) {
        this.currencyService = currencyService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get currency")
    public ResponseEntity<CurrencyResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(currencyService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List currencies")
    public ResponseEntity<List<CurrencyResponse>> getPaged(@Valid @ModelAttribute CurrencyFilter filter) {
        return ResponseEntity.ok(currencyService.getPaged(filter));
    }

    @GetMapping("/all")
    @Operation(summary = "All currencies", description = "Unpaged, ordered by name or char code")
    public ResponseEntity<List<CurrencyResponse>> getAll(
            @Parameter(description = "name or charCode") @RequestParam(defaultValue = CurrencyService.ORDER_BY_NAME) String orderBy,
            @RequestParam(defaultValue = "false") boolean includeDeleted,
            @RequestParam(defaultValue = "true") boolean ascending) {
        return ResponseEntity.ok(currencyService.getAll(orderBy, includeDeleted, ascending));
    }

    @PostMapping
    @Operation(summary = "Create currency")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Currency created"),
        @ApiResponse(responseCode = "400", description = "Char code, numeric code or name missing"),
        @ApiResponse(responseCode = "409", description = "Char code or numeric code already exists")
    })
    public ResponseEntity<CurrencyResponse> create(@Valid @RequestBody CreateCurrencyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(currencyService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update currency")
    public ResponseEntity<CurrencyResponse> update(@Valid @RequestBody UpdateCurrencyRequest request) {
        return ResponseEntity.ok(currencyService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete currency")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Currency is used by accounts or exchange rates")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        currencyService.delete(id);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{id}/soft")
    @Operation(summary = "Soft delete currency")
    public ResponseEntity<Void> softDelete(@PathVariable UUID id) {
        currencyService.softDelete(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/restore")
    @Operation(summary = "Restore currency")
    public ResponseEntity<Void> restore(@PathVariable UUID id) {
        currencyService.restore(id);
        return ResponseEntity.ok().build();
    }
}
