package com.financemanager.common.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Base of every list filter: 1-indexed page number and page size, bound from the
 * {@code Page} and {@code ItemsPerPage} query parameters.
 *
 * skip = (page - 1) * itemsPerPage. No total count is computed with the page.
 */
public abstract class PageFilter {

    public static final int MAX_ITEMS_PER_PAGE = 1000;

    private static final Sort DEFAULT_SORT = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));

    @NotNull(message = "Page is required")
    @Min(value = 1, message = "Page must be at least 1")
    private Integer page = 1;

    @NotNull(message = "ItemsPerPage is required")
    @Min(value = 1, message = "ItemsPerPage must be at least 1")
    @Max(value = MAX_ITEMS_PER_PAGE, message = "ItemsPerPage must be at most " + MAX_ITEMS_PER_PAGE)
    private Integer itemsPerPage = 10;

    protected PageFilter() {
    }

    protected PageFilter(Integer page, Integer itemsPerPage) {
        this.page = page;
        this.itemsPerPage = itemsPerPage;
    }

    public Pageable toPageable() {
        return toPageable(DEFAULT_SORT);
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(page - 1, itemsPerPage, sort);
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getItemsPerPage() {
        return itemsPerPage;
    }

    public void setItemsPerPage(Integer itemsPerPage) {
        this.itemsPerPage = itemsPerPage;
    }
}
