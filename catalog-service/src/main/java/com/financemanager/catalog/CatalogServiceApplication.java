package com.financemanager.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Catalog service: reference data of the finance manager (registry holders, accounts,
 * banks, countries, currencies, categories, account types and exchange rates).
 *
 * Component scanning starts at {@code com.financemanager} so that the shared web,
 * logging and error-handling beans of finance-common are picked up.
 */
@SpringBootApplication(scanBasePackages = "com.financemanager")
@EnableTransactionManagement
public class CatalogServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogServiceApplication.class, args);
    }
}
