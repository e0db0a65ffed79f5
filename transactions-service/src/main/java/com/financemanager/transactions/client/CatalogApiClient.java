package com.financemanager.transactions.client;

import com.financemanager.transactions.client.dto.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only client of the catalog HTTP API.
 *
 * Collections are read page by page ({@code Page}, {@code ItemsPerPage}) until a page
 * comes back shorter than the page size. Every remote failure surfaces as
 * {@link ExternalApiException}; a by-id lookup answers empty on 404.
 */
@Component
public class CatalogApiClient {

    private static final Logger log = LoggerFactory.getLogger(CatalogApiClient.class);

    private final RestTemplate restTemplate;
    private final int pageSize;

    public CatalogApiClient(@Qualifier("catalogRestTemplate") RestTemplate restTemplate,
                            @Value("${catalog.sync.page-size:1000}") int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("catalog.sync.page-size must be positive");
        }
        this.restTemplate = restTemplate;
        this.pageSize = pageSize;
    }

    public List<CatalogRegistryHolder> getAllRegistryHolders() {
        return fetchAll(CatalogResource.REGISTRY_HOLDERS, new ParameterizedTypeReference<List<CatalogRegistryHolder>>() {});
    }

    public List<CatalogAccountType> getAllAccountTypes() {
        return fetchAll(CatalogResource.ACCOUNT_TYPES, new ParameterizedTypeReference<List<CatalogAccountType>>() {});
    }

    public List<CatalogCurrency> getAllCurrencies() {
        return fetchAll(CatalogResource.CURRENCIES, new ParameterizedTypeReference<List<CatalogCurrency>>() {});
    }

    public List<CatalogAccount> getAllAccounts() {
        return fetchAll(CatalogResource.ACCOUNTS, new ParameterizedTypeReference<List<CatalogAccount>>() {});
    }

    public List<CatalogCategory> getAllCategories() {
        return fetchAll(CatalogResource.CATEGORIES, new ParameterizedTypeReference<List<CatalogCategory>>() {});
    }

    public Optional<CatalogRegistryHolder> getRegistryHolderById(UUID id) {
        String path = CatalogResource.REGISTRY_HOLDERS.getPath() + "/{id}";
        try {
            return Optional.ofNullable(restTemplate.getForObject(path, CatalogRegistryHolder.class, id));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Registry holder {} not found in catalog", id);
            return Optional.empty();
        } catch (RestClientException e) {
            log.error("Catalog request failed: GET {} ({})", path, e.getMessage());
            throw new ExternalApiException(String.format("Failed to load registry holder '%s' from catalog", id), e);
        }
    }

    private <T> List<T> fetchAll(CatalogResource resource, ParameterizedTypeReference<List<T>> type) {
        String url = resource.getPath() + "?Page={page}&ItemsPerPage={size}";
        List<T> result = new ArrayList<>();
        int page = 1;
        while (true) {
            List<T> items;
            try {
                items = restTemplate.exchange(url, HttpMethod.GET, null, type, page, pageSize).getBody();
            } catch (RestClientException e) {
                log.error("Catalog request failed: GET {} page {} ({})", resource.getPath(), page, e.getMessage());
                throw new ExternalApiException(
                        String.format("Failed to load %s from catalog", resource.getPath()), e);
            }
            if (items == null) {
                items = List.of();
            }
            result.addAll(items);
            if (items.size() < pageSize) {
                break;
            }
            page++;
        }
        log.debug("Fetched {} record(s) from {} in {} page(s)", result.size(), resource.getPath(), page);
        return result;
    }
}
