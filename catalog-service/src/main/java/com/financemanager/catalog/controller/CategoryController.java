package com.financemanager.catalog.controller;

import com.financemanager.catalog.dto.CatalogResponses.CategoryResponse;
import com.financemanager.catalog.dto.category.CategoryFilter;
import com.financemanager.catalog.dto.category.CreateCategoryRequest;
import com.financemanager.catalog.dto.category.UpdateCategoryRequest;
import com.financemanager.catalog.service.CategoryService;
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
@RequestMapping("/api/v1/Category")
@Tag(name = "Categories", description = "Income and expense categories, organised as a tree per holder")
public class CategoryController {

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get category")
    public ResponseEntity<CategoryResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(categoryService.getById(id));
    }

    @GetMapping
    @Operation(summary = "List categories")
    public ResponseEntity<List<CategoryResponse>> getPaged(@Valid @ModelAttribute CategoryFilter filter) {
        return ResponseEntity.ok(categoryService.getPaged(filter));
    }

    @GetMapping("/registry-holder/{registryHolderId}")
    @Operation(summary = "Categories of a holder", description = "Unpaged, ordered by name")
    public ResponseEntity<List<CategoryResponse>> getByRegistryHolderId(@PathVariable UUID registryHolderId) {
        return ResponseEntity.ok(categoryService.getByRegistryHolderId(registryHolderId));
    }

    @PostMapping
    @Operation(summary = "Create category")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Category created"),
        @ApiResponse(responseCode = "400", description = "Name missing"),
        @ApiResponse(responseCode = "404", description = "Holder or parent not found"),
        @ApiResponse(responseCode = "409", description = "Name taken among siblings, or recursive parent")
    })
    public ResponseEntity<CategoryResponse> create(@Valid @RequestBody CreateCategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(categoryService.create(request));
    }

    @PutMapping
    @Operation(summary = "Update category")
    public ResponseEntity<CategoryResponse> update(@Valid @RequestBody UpdateCategoryRequest request) {
        return ResponseEntity.ok(categoryService.update(request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete category")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Deleted or already absent"),
        @ApiResponse(responseCode = "409", description = "Category has child categories")
    })
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        categoryService.delete(id);
        return ResponseEntity.ok().build();
    }
}
