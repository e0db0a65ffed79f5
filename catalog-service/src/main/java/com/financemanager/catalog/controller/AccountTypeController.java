package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.AccountTypeResponse;
import com.financemanager.catalog.dto.accounttype.AccountTypeFilter;
import com.financemanager.catalog.dto.accounttype.CreateAccountTypeRequest;
import com.financemanager.catalog.dto.accounttype.UpdateAccountTypeRequest;
import com.financemanager.catalog.service.AccountTypeService;
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
@RequestMapping("/api/v1/AccountType")
@Tag(name = "Account types", description = "Kinds of accounts (cash, card, deposit...)")
public class AccountTypeController {

    private final AccountTypeService accountTypeService;

    public AccountTypeController(AccountTypeService accountTypeService) {
        this.accountTypeService = accountTypeService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get account type")
    public ResponseEntity<AccountTypeResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(accountTypeService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List account types")
    public ResponseEntity<List<AccountTypeResponse>> getPaged(@Valid @ModelAttribute AccountTypeFilter filter) {
        return ResponseEntity.ok(accountTypeService.getPaged(filter));
    }

    @GetMapping("/all")
    @Operation(summary = "All account types", description = "Unpaged, ordered by code")
    public ResponseEntity<List<AccountTypeResponse>> getAll() {
        return ResponseEntity.ok(accountTypeService.getAll());
    }

    @GetMapping("/exists")
    @Operation(summary = "Check code", description = "True when an account type with this exact code exists")
    public ResponseEntity<Boolean> existsByCode(@RequestParam String code,
                                                @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return ResponseEntity.ok(accountTypeService.existsByCode(code, includeDeleted));
    }

    @PostMapping
    @Operation(summary = "Create account type")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account type created"),
        @ApiResponse(responseCode = "400", description = "Code missing"),
        @ApiResponse(responseCode = "409", description = "Code already exists")
    })
    public ResponseEntity<AccountTypeResponse> create(@Valid @RequestBody CreateAccountTypeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountTypeService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update account type")
    public ResponseEntity<AccountTypeResponse> update(@Valid @RequestBody UpdateAccountTypeRequest request) {
        return ResponseEntity.ok(accountTypeService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete account type")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Account type is used by accounts")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        accountTypeService.delete(id);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{id}/soft")
    @Operation(summary = "Soft delete account type")
    public ResponseEntity<Void> softDelete(@PathVariable UUID id) {
        accountTypeService.softDelete(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/restore")
    @Operation(summary = "Restore account type")
    public ResponseEntity<Void> restore(@PathVariable UUID id) {
        accountTypeService.restore(id);
        return ResponseEntity.ok().build();
    }
}
