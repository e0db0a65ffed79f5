package com.financemanager.catalog.config;

import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.repository.AccountRepository;
import com.financemanager.catalog.repository.AccountTypeRepository;
import com.financemanager.catalog.repository.BankRepository;
import com.financemanager.catalog.repository.CategoryRepository;
import com.financemanager.catalog.repository.CountryRepository;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Seeding against its own in-memory database so the shared test schema stays empty.
 */
@SpringBootTest(properties = {
        "catalog.seed.enabled=true",
        "spring.datasource.url=jdbc:h2:mem:catalog-seed;DB_CLOSE_DELAY=-1;MODE=PostgreSQL"
})
@ActiveProfiles("test")
class CatalogDataSeederTest {

    @Autowired CatalogDataSeeder seeder;
    @Autowired CountryRepository countryRepository;
    @Autowired BankRepository bankRepository;
    @Autowired CurrencyRepository currencyRepository;
    @Autowired AccountTypeRepository accountTypeRepository;
    @Autowired RegistryHolderRepository registryHolderRepository;
    @Autowired CategoryRepository categoryRepository;
    @Autowired AccountRepository accountRepository;

    @Test @DisplayName("start-up loads every seed file with references resolved")
    void seedsOnStartup() {
        assertThat(countryRepository.count()).isEqualTo(4);
        assertThat(bankRepository.count()).isEqualTo(6);
        assertThat(currencyRepository.count()).isEqualTo(6);
        assertThat(accountTypeRepository.count()).isEqualTo(5);
        assertThat(registryHolderRepository.count()).isEqualTo(1);
        assertThat(categoryRepository.count()).isEqualTo(6);
        assertThat(accountRepository.count()).isEqualTo(3);
        assertThat(accountRepository.findAll())
                .filteredOn(Account::isDefaultAccount)
                .hasSize(1);
    }

    @Test @DisplayName("running again over populated tables inserts nothing")
    void rerunIsNoOp() {
        seeder.run(new DefaultApplicationArguments());

        assertThat(countryRepository.count()).isEqualTo(4);
        assertThat(bankRepository.count()).isEqualTo(6);
        assertThat(currencyRepository.count()).isEqualTo(6);
        assertThat(categoryRepository.count()).isEqualTo(6);
        assertThat(accountRepository.count()).isEqualTo(3);
    }
}
