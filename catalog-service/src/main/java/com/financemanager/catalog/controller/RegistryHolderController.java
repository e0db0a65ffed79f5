package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.RegistryHolderResponse;
import com.financemanager.catalog.dto.registryholder.CreateRegistryHolderRequest;
import com.financemanager.catalog.dto.registryholder.RegistryHolderFilter;
import com.financemanager.catalog.dto.registryholder.UpdateRegistryHolderRequest;
import com.financemanager.catalog.service.RegistryHolderService;
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
@RequestMapping("/api/v1/RegistryHolder")
@Tag(name = "Registry holders", description = "Owners of accounts and categories")
public class RegistryHolderController {

    private final RegistryHolderService registryHolderService;

    public RegistryHolderController(RegistryHolderService registryHolderService) {
        this.registryHolderService = registryHolderService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get registry holder")
    public ResponseEntity<RegistryHolderResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(registryHolderService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List registry holders")
    public ResponseEntity<List<RegistryHolderResponse>> getPaged(@Valid @ModelAttribute RegistryHolderFilter filter) {
        return ResponseEntity.ok(registryHolderService.getPaged(filter));
    }

    @PostMapping
    @Operation(summary = "Create registry holder")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Holder created"),
        @ApiResponse(responseCode = "400", description = "telegramId missing or not positive"),
        @ApiResponse(responseCode = "409", description = "telegramId already registered")
    })
    public ResponseEntity<RegistryHolderResponse> create(@Valid @RequestBody CreateRegistryHolderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registryHolderService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update registry holder")
    public ResponseEntity<RegistryHolderResponse> update(@Valid @RequestBody UpdateRegistryHolderRequest request) {
        return ResponseEntity.ok(registryHolderService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete registry holder")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Holder still owns accounts or categories")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        registryHolderService.delete(id);
        return ResponseEntity.ok().build();
    }
}
