package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.CountryResponse;
import com.financemanager.catalog.dto.country.CountryFilter;
import com.financemanager.catalog.dto.country.CreateCountryRequest;
import com.financemanager.catalog.dto.country.UpdateCountryRequest;
import com.financemanager.catalog.service.CountryService;
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
@RequestMapping("/api/v1/Country")
@Tag(name = "Countries")
public class CountryController {

    private final CountryService countryService;

    public CountryController(CountryService countryService) {
        this.countryService = countryService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get country")
    public ResponseEntity<CountryResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(countryService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List countries")
    public ResponseEntity<List<CountryResponse>> getPaged(@Valid @ModelAttribute CountryFilter filter) {
        return ResponseEntity.ok(countryService.getPaged(filter));
    }

    @GetMapping("/all")
    @Operation(summary = "All countries", description = "Unpaged, ordered by name")
    public ResponseEntity<List<CountryResponse>> getAll() {
        return ResponseEntity.ok(countryService.getAll());
    }

    @PostMapping
    @Operation(summary = "Create country")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Country created"),
        @ApiResponse(responseCode = "400", description = "Name missing"),
        @ApiResponse(responseCode = "409", description = "Name already exists")
    })
    public ResponseEntity<CountryResponse> create(@Valid @RequestBody CreateCountryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(countryService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update country")
    public ResponseEntity<CountryResponse> update(@Valid @RequestBody UpdateCountryRequest request) {
        return ResponseEntity.ok(countryService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete country")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Country has banks")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        countryService.delete(id);
        return ResponseEntity.ok().build();
    }
}
