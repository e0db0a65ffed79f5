package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.AccountResponse;
import com.financemanager.catalog.dto.account.AccountFilter;
import com.financemanager.catalog.dto.account.CreateAccountRequest;
import com.financemanager.catalog.dto.account.UpdateAccountRequest;
import com.financemanager.catalog.service.AccountService;
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

/**
 * REST controller for accounts.
 *
 * RULES:
 * - No business logic: pure delegation to AccountService
 * - Business rule violations surface as problem details with an errorCode
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /api/v1/Account/{id}                         → 200 | 404
 * GET    /api/v1/Account?page=&itemsPerPage=&...      → 200 | 400
 * GET    /api/v1/Account/default/{registryHolderId}   → 200 | 404
 * POST   /api/v1/Account                              → 201 | 400 | 404 | 409
 * PUT    /api/v1/Account                              → 200 | 400 | 404 | 409
 * DELETE /api/v1/Account/{id}                         → 200 | 409
 * DELETE /api/v1/Account/{id}/soft                    → 200 | 404 | 409
 * POST   /api/v1/Account/{id}/restore                 → 200 | 404
 * POST   /api/v1/Account/{id}/archive                 → 200 | 404 | 409
 * POST   /api/v1/Account/{id}/unarchive               → 200 | 404
 * POST   /api/v1/Account/{id}/set-default             → 200 | 404 | 409
 * POST   /api/v1/Account/{id}/unset-default           → 200 | 404 | 409
 */
@RestController
@RequestMapping("/api/v1/Account")
@Tag(name = "Accounts", description = "Accounts of registry holders")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/{id}")
    @Operation(summary = "Get account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Account found"),
        @ApiResponse(responseCode = "404", description = "Account not found")
    })
    public ResponseEntity<AccountResponse> getById(@Parameter(description = "Account ID") @PathVariable UUID id) {
        return ResponseEntity.ok(accountService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List accounts", description = "One page of accounts matching the filter")
    public ResponseEntity<List<AccountResponse>> getPaged(@Valid @ModelAttribute AccountFilter filter) {
        return ResponseEntity.ok(accountService.getPaged(filter));
    }

    @GetMapping("/default/{registryHolderId}")
    @Operation(summary = "Get default account", description = "The registry holder's default account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Default account found"),
        @ApiResponse(responseCode = "404", description = "Holder has no default account")
    })
    public ResponseEntity<AccountResponse> getDefault(@PathVariable UUID registryHolderId) {
        return ResponseEntity.ok(accountService.getDefault(registryHolderId));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Create an account. With {@code isDefault = true} the holder's previous
     * default account loses its flag.
     */
    @PostMapping
    @Operation(summary = "Create account")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account created"),
        @ApiResponse(responseCode = "400", description = "Name missing or request invalid"),
        @ApiResponse(responseCode = "404", description = "Holder, account type, currency or bank not found"),
        @ApiResponse(responseCode = "409", description = "Account type or currency is soft deleted")
    })
    public ResponseEntity<AccountResponse> create(@Valid @RequestBody CreateAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update account", description = "Partial update; absent fields stay unchanged")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Current state of the account"),
        @ApiResponse(responseCode = "404", description = "Account or referenced entity not found"),
        @ApiResponse(responseCode = "409", description = "Default account cannot be archived")
    })
    public ResponseEntity<AccountResponse> update(@Valid @RequestBody UpdateAccountRequest request) {
        return ResponseEntity.ok(accountService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Default account cannot be deleted")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        accountService.delete(id);
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/{id}/soft")
    @Operation(summary = "Soft delete account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Marked deleted or already deleted"),
        @ApiResponse(responseCode = "404", description = "Account not found"),
        @ApiResponse(responseCode = "409", description = "Default account cannot be soft deleted")
    })
    public ResponseEntity<Void> softDelete(@PathVariable UUID id) {
        accountService.softDelete(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/restore")
    @Operation(summary = "Restore soft-deleted account")
    public ResponseEntity<Void> restore(@PathVariable UUID id) {
        accountService.restore(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/archive")
    @Operation(summary = "Archive account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Archived or already archived"),
        @ApiResponse(responseCode = "404", description = "Account not found"),
        @ApiResponse(responseCode = "409", description = "Default account cannot be archived")
    })
    public ResponseEntity<Void> archive(@PathVariable UUID id) {
        accountService.archive(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/unarchive")
    @Operation(summary = "Unarchive account")
    public ResponseEntity<Void> unarchive(@PathVariable UUID id) {
        accountService.unarchive(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/set-default")
    @Operation(summary = "Make default", description = "Previous default of the same holder is cleared")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Account is the default"),
        @ApiResponse(responseCode = "404", description = "Account not found"),
        @ApiResponse(responseCode = "409", description = "Archived or deleted account cannot be default")
    })
    public ResponseEntity<Void> setAsDefault(@PathVariable UUID id) {
        accountService.setAsDefault(id);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{id}/unset-default")
    @Operation(summary = "Move default flag", description = "Clears the flag and gives it to the replacement account")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Flag moved or account was not default"),
        @ApiResponse(responseCode = "404", description = "Account or replacement not found"),
        @ApiResponse(responseCode = "409", description = "Replacement unusable or owned by another holder")
    })
    public ResponseEntity<Void> unsetAsDefault(@PathVariable UUID id,
                                               @Parameter(description = "Account that becomes default")
                                               @RequestParam UUID replacementId) {
        accountService.unsetAsDefault(id, replacementId);
        return ResponseEntity.ok().build();
    }
}
