package com.financemanager.transactions.controller;

import com.financemanager.transactions.dto.TransactionsResponses.CountResponse;
import com.financemanager.transactions.dto.TransactionsResponses.TransactionResponse;
import com.financemanager.transactions.dto.transaction.CreateTransactionRequest;
import com.financemanager.transactions.dto.transaction.TransactionFilter;
import com.financemanager.transactions.dto.transaction.UpdateTransactionRequest;
import com.financemanager.transactions.service.TransactionService;
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
 * REST controller for transactions.
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /api/v1/Transaction/{id}                       → 200 | 404
 * GET    /api/v1/Transaction?page=&itemsPerPage=&...    → 200 | 400
 * GET    /api/v1/Transaction/count?...                  → 200 | 400
 * POST   /api/v1/Transaction                            → 201 | 400 | 404 | 409
 * PUT    /api/v1/Transaction                            → 200 | 400 | 404 | 409
 * DELETE /api/v1/Transaction/{id}                       → 200
 */
@RestController
@RequestMapping("/api/v1/Transaction")
@Tag(name = "Transactions", description = "Income and expenses on accounts")
public class TransactionController {

    private final TransactionService transactionService;

    public TransactionController(TransactionService transactionService) {
        this.transactionService = transactionService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/{id}")
    @Operation(summary = "Get transaction")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transaction found"),
        @ApiResponse(responseCode = "404", description = "Transaction not found")
    })
    public ResponseEntity<TransactionResponse> getById(@Parameter(description = "Transaction ID") @PathVariable UUID id) {
        return ResponseEntity.ok(transactionService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List transactions", description = "One page of transactions matching the filter")
    public ResponseEntity<List<TransactionResponse>> getPaged(@Valid @ModelAttribute TransactionFilter filter) {
        return ResponseEntity.ok(transactionService.getPaged(filter));
    }

    @GetMapping("/count")
    @Operation(summary = "Count transactions", description = "Number of transactions matching the filter; paging is ignored")
    public ResponseEntity<CountResponse> getCount(@Valid @ModelAttribute TransactionFilter filter) {
        return ResponseEntity.ok(new CountResponse(transactionService.getCount(filter)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // WRITE
    // ─────────────────────────────────────────────────────────────────────────

    @PostMapping
    @Operation(summary = "Create transaction")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Transaction created"),
        @ApiResponse(responseCode = "400", description = "Zero amount or invalid request"),
        @ApiResponse(responseCode = "404", description = "Account or category not found or deleted"),
        @ApiResponse(responseCode = "409", description = "Account is archived")
    })
    public ResponseEntity<TransactionResponse> create(@Valid @RequestBody CreateTransactionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(transactionService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update transaction", description = "Partial update; the description is always replaced")
    public ResponseEntity<TransactionResponse> update(@Valid @RequestBody UpdateTransactionRequest request) {
        return ResponseEntity.ok(transactionService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete transaction")
    @ApiResponse(responseCode = "200", description = "Deleted or already absent")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        transactionService.delete(id);
        return ResponseEntity.ok().build();
    }
}
