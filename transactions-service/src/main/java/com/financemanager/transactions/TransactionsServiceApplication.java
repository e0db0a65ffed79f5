package com.financemanager.transactions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Transactions service: transactions and transfers, plus local replicas of the catalog
 * data they reference, refreshed by {@code CatalogSyncJob}.
 */
@SpringBootApplication(scanBasePackages = "com.financemanager")
@EnableTransactionManagement
public class TransactionsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionsServiceApplication.class, args);
    }
}
