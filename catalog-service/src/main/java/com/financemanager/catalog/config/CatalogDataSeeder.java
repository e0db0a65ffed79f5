package com.financemanager.catalog.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.domain.Bank;
import com.financemanager.catalog.domain.Category;
import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.catalog.repository.AccountRepository;
import com.financemanager.catalog.repository.AccountTypeRepository;
import com.financemanager.catalog.repository.BankRepository;
import com.financemanager.catalog.repository.CategoryRepository;
import com.financemanager.catalog.repository.CountryRepository;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import com.financemanager.common.repository.BaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads reference data from {@code classpath:seed/*.json} at start-up.
 *
 * Kinds are seeded in dependency order and each one only when its table is empty,
 * so restarting against a populated database changes nothing. References between
 * seed files use natural keys (country name, currency char code, account type code,
 * holder telegramId, parent category name) because ids are generated on insert.
 *
 * Enabled by {@code catalog.seed.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "catalog.seed.enabled", havingValue = "true")
public class CatalogDataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CatalogDataSeeder.class);

    private static final String SEED_DIR = "seed/";

    private final ObjectMapper objectMapper;
    private final CountryRepository countryRepository;
    private final BankRepository bankRepository;
    private final CurrencyRepository currencyRepository;
    private final AccountTypeRepository accountTypeRepository;
    private final RegistryHolderRepository registryHolderRepository;
    private final CategoryRepository categoryRepository;
    private final AccountRepository accountRepository;

    public CatalogDataSeeder(ObjectMapper objectMapper,
                             CountryRepository countryRepository,
                             BankRepository bankRepository,
                             CurrencyRepository currencyRepository,
                             AccountTypeRepository accountTypeRepository,
                             RegistryHolderRepository registryHolderRepository,
                             CategoryRepository categoryRepository,
                             AccountRepository accountRepository) {
        this.objectMapper = objectMapper;
        this.countryRepository = countryRepository;
        this.bankRepository = bankRepository;
        this.currencyRepository = currencyRepository;
        this.accountTypeRepository = accountTypeRepository;
        this.registryHolderRepository = registryHolderRepository;
        this.categoryRepository = categoryRepository;
        this.accountRepository = accountRepository;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Catalog seeding started");
        seed("countries.json", countryRepository, node -> new Country(text(node, "name")));

        Map<String, Country> countries = byKey(countryRepository.findAll(), Country::getName);
        seed("banks.json", bankRepository, node -> new Bank(lookup(countries, node, "country"), text(node, "name")));

        seed("currencies.json", currencyRepository, node -> new Currency(
                text(node, "charCode"), text(node, "numCode"), text(node, "name"),
                text(node, "sign"), text(node, "emoji")));

        seed("account-types.json", accountTypeRepository,
                node -> new AccountType(text(node, "code"), text(node, "description")));

        seed("registry-holders.json", registryHolderRepository, node -> new RegistryHolder(
                node.path("telegramId").asLong(),
                RegistryHolderRole.valueOf(node.path("role").asText(RegistryHolderRole.USER.name()))));

        Map<String, RegistryHolder> holders = byKey(registryHolderRepository.findAll(),
                h -> String.valueOf(h.getTelegramId()));
        seedCategories(holders);

        Map<String, AccountType> accountTypes = byKey(accountTypeRepository.findAll(), AccountType::getCode);
        Map<String, Currency> currencies = byKey(currencyRepository.findAll(), Currency::getCharCode);
        Map<String, Bank> banks = byKey(bankRepository.findAll(), Bank::getName);
        seed("accounts.json", accountRepository, node -> new Account(
                lookup(holders, node, "registryHolderTelegramId"),
                lookup(accountTypes, node, "accountTypeCode"),
                lookup(currencies, node, "currencyCharCode"),
                node.hasNonNull("bank") ? lookup(banks, node, "bank") : null,
                text(node, "name"),
                node.path("isIncludeInBalance").asBoolean(true),
                node.path("isDefault").asBoolean(false),
                node.hasNonNull("creditLimit") ? node.get("creditLimit").decimalValue() : null));
        log.info("Catalog seeding finished");
    }

    /**
     * Parents are listed before their children in the file, so one pass resolves them.
     */
    private void seedCategories(Map<String, RegistryHolder> holders) {
        if (!categoryRepository.isEmpty()) {
            log.info("Category data already present, seeding skipped");
            return;
        }
        Map<String, Category> saved = new HashMap<>();
        for (JsonNode node : read("categories.json")) {
            RegistryHolder holder = lookup(holders, node, "registryHolderTelegramId");
            Category parent = node.hasNonNull("parent")
                    ? saved.get(holder.getTelegramId() + "/" + text(node, "parent"))
                    : null;
            Category category = categoryRepository.save(new Category(holder, text(node, "name"),
                    node.path("income").asBoolean(), node.path("expense").asBoolean(),
                    text(node, "emoji"), text(node, "icon"), parent));
            saved.put(holder.getTelegramId() + "/" + category.getName(), category);
        }
        log.info("Seeded {} categories", saved.size());
    }

    private <E> void seed(String file, BaseRepository<E, ?> repository, Function<JsonNode, E> mapper) {
        if (!repository.isEmpty()) {
            log.info("Data for {} already present, seeding skipped", file);
            return;
        }
        List<E> entities = new ArrayList<>();
        for (JsonNode node : read(file)) {
            entities.add(mapper.apply(node));
        }
        if (entities.isEmpty()) {
            log.warn("Seed file {} contains no data", file);
            return;
        }
        repository.saveAll(entities);
        log.info("Seeded {} rows from {}", entities.size(), file);
    }

    private JsonNode read(String file) {
        ClassPathResource resource = new ClassPathResource(SEED_DIR + file);
        if (!resource.exists()) {
            log.warn("Seed file not found: {}", resource.getPath());
            return objectMapper.createArrayNode();
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            log.error("Invalid seed file {}", resource.getPath(), e);
            throw new UncheckedIOException("Cannot read seed file " + resource.getPath(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static <T> T lookup(Map<String, T> index, JsonNode node, String field) {
        String key = text(node, field);
        T value = index.get(key);
        if (value == null) {
            throw new IllegalStateException("Seed reference '" + field + "' = '" + key + "' not found");
        }
        return value;
    }

    private static <T> Map<String, T> byKey(List<T> entities, Function<T, String> key) {
        return entities.stream().collect(Collectors.toMap(key, Function.identity(), (a, b) -> a));
    }
}
