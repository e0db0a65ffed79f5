package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.BankResponse;
import com.financemanager.catalog.dto.CatalogResponses.CountResponse;
import com.financemanager.catalog.dto.bank.BankFilter;
import com.financemanager.catalog.dto.bank.CreateBankRequest;
import com.financemanager.catalog.dto.bank.UpdateBankRequest;
import com.financemanager.catalog.service.BankService;
import io.swagger.v3.oas.annotations.Operation;
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
@RequestMapping("/api/v1/Bank")
@Tag(name = "Banks")
public class BankController {

    private final BankService bankService;

    public BankController(BankService bankService) {
        this.bankService = bankService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get bank")
    public ResponseEntity<BankResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(bankService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List banks")
    public ResponseEntity<List<BankResponse>> getPaged(@Valid @ModelAttribute BankFilter filter) {
        return ResponseEntity.ok(bankService.getPaged(filter));
    }

    @GetMapping("/all")
    @Operation(summary = "All banks", description = "Unpaged, ordered by name")
    public ResponseEntity<List<BankResponse>> getAll() {
        return ResponseEntity.ok(bankService.getAll());
    }

    @GetMapping("/{id}/accounts-count")
    @Operation(summary = "Count accounts in bank")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Number of accounts"),
        @ApiResponse(responseCode = "404", description = "Bank not found")
    })
    public ResponseEntity<CountResponse> getAccountsCount(@PathVariable UUID id,
                                                          @RequestParam(defaultValue = "false") boolean includeArchived,
                                                          @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return ResponseEntity.ok(new CountResponse(bankService.getAccountsCount(id, includeArchived, includeDeleted)));
    }

    @PostMapping
    @Operation(summary = "Create bank")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Bank created"),
        @ApiResponse(responseCode = "400", description = "Name missing"),
        @ApiResponse(responseCode = "404", description = "Country not found"),
        @ApiResponse(responseCode = "409", description = "Name already used in the country")
    })
    public ResponseEntity<BankResponse> create(@Valid @RequestBody CreateBankRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bankService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update bank")
    public ResponseEntity<BankResponse> update(@Valid @RequestBody UpdateBankRequest request) {
        return ResponseEntity.ok(bankService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete bank")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Bank has accounts")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        bankService.delete(id);
        return ResponseEntity.ok().build();
    }
}
