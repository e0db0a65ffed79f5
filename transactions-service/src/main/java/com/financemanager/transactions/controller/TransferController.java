package com.financemanager.transactions.controller;

import com.financemanager.transactions.dto.TransactionsResponses.CountResponse;
import com.financemanager.transactions.dto.TransactionsResponses.TransferResponse;
import com.financemanager.transactions.dto.transfer.CreateTransferRequest;
import com.financemanager.transactions.dto.transfer.TransferFilter;
import com.financemanager.transactions.dto.transfer.UpdateTransferRequest;
import com.financemanager.transactions.service.TransferService;
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
@RequestMapping("/api/v1/Transfer")
@Tag(name = "Transfers", description = "Money moved between accounts")
public class TransferController {

    private final TransferService transferService;

    public TransferController(TransferService transferService) {
        this.transferService = transferService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get transfer")
    public ResponseEntity<TransferResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(transferService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List transfers")
    public ResponseEntity<List<TransferResponse>> getPaged(@Valid @ModelAttribute TransferFilter filter) {
        return ResponseEntity.ok(transferService.getPaged(filter));
    }

    @GetMapping("/count")
    @Operation(summary = "Count transfers")
    public ResponseEntity<CountResponse> getCount(@Valid @ModelAttribute TransferFilter filter) {
        return ResponseEntity.ok(new CountResponse(transferService.getCount(filter)));
    }

    @PostMapping
    @Operation(summary = "Create transfer")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Transfer created"),
        @ApiResponse(responseCode = "400", description = "Zero amount or invalid request"),
        @ApiResponse(responseCode = "404", description = "Account not found or deleted"),
        @ApiResponse(responseCode = "409", description = "Account is archived")
    })
    public ResponseEntity<TransferResponse> create(@Valid @RequestBody CreateTransferRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(transferService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update transfer")
    public ResponseEntity<TransferResponse> update(@Valid @RequestBody UpdateTransferRequest request) {
        return ResponseEntity.ok(transferService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete transfer")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        transferService.delete(id);
        return ResponseEntity.ok().build();
    }
}
