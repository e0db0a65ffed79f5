package com.financemanager.transactions.client;

/**
 * Catalog collections replicated into the transactions service, in dependency order.
 */
public enum CatalogResource {

    REGISTRY_HOLDERS("RegistryHolder"),
    ACCOUNT_TYPES("AccountType"),
    CURRENCIES("Currency"),
    ACCOUNTS("Account"),
    CATEGORIES("Category");

    private final String path;

    CatalogResource(String path) {
        this.path = path;
    }

    /**
     * Collection path relative to the catalog base URL.
     */
    public String getPath() {
        return "/api/v1/" + path;
    }
}
