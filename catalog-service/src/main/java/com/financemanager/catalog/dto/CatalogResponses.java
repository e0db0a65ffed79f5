package com.financemanager.catalog.dto;

import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.domain.Bank;
import com.financemanager.catalog.domain.Category;
import com.financemanager.catalog.domain.Country;
import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.ExchangeRate;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Response DTOs of the catalog API. Built inside the service transaction, so lazy
 * references are resolved before the entity leaves the persistence context.
 */
public class CatalogResponses {

    public static class RegistryHolderResponse {
        private UUID id;
        private long telegramId;
        private RegistryHolderRole role;

        public RegistryHolderResponse(RegistryHolder holder) {
            this.id = holder.getId();
            this.telegramId = holder.getTelegramId();
            this.role = holder.getRole();
        }

        public UUID getId() { return id; }
        public long getTelegramId() { return telegramId; }
        public RegistryHolderRole getRole() { return role; }
    }

    public static class AccountTypeResponse {
        private UUID id;
        private String code;
        private String description;
        private boolean isDeleted;

        public AccountTypeResponse(AccountType accountType) {
            this.id = accountType.getId();
            this.code = accountType.getCode();
            this.description = accountType.getDescription();
            this.isDeleted = accountType.isDeleted();
        }

        public UUID getId() { return id; }
        public String getCode() { return code; }
        public String getDescription() { return description; }
        public boolean getIsDeleted() { return isDeleted; }
    }

    public static class CountryResponse {
        private UUID id;
        private String name;

        public CountryResponse(Country country) {
            this.id = country.getId();
            this.name = country.getName();
        }

        public UUID getId() { return id; }
        public String getName() { return name; }
    }

    public static class BankResponse {
        private UUID id;
        private CountryResponse country;
        private String name;

        public BankResponse(Bank bank) {
            this.id = bank.getId();
            this.country = new CountryResponse(bank.getCountry());
            this.name = bank.getName();
        }

        public UUID getId() { return id; }
        public CountryResponse getCountry() { return country; }
        public String getName() { return name; }
    }

    public static class CurrencyResponse {
        private UUID id;
        private String charCode;
        private String numCode;
        private String name;
        private String sign;
        private String emoji;
        private boolean isDeleted;

        public CurrencyResponse(Currency currency) {
            this.id = currency.getId();
            this.charCode = currency.getCharCode();
            this.numCode = currency.getNumCode();
            this.name = currency.getName();
            this.sign = currency.getSign();
            this.emoji = currency.getEmoji();
            this.isDeleted = currency.isDeleted();
        }

        public UUID getId() { return id; }
        public String getCharCode() { return charCode; }
        public String getNumCode() { return numCode; }
        public String getName() { return name; }
        public String getSign() { return sign; }
        public String getEmoji() { return emoji; }
        public boolean getIsDeleted() { return isDeleted; }
    }

    /**
     * Account with its references expanded. bank is null for accounts without one.
     */
    public static class AccountResponse {
        private UUID id;
        private RegistryHolderResponse registryHolder;
        private AccountTypeResponse accountType;
        private CurrencyResponse currency;
        private BankResponse bank;
        private String name;
        private boolean isIncludeInBalance;
        private boolean isDefault;
        private boolean isArchived;
        private boolean isDeleted;
        private BigDecimal creditLimit;

        public AccountResponse(Account account) {
            this.id = account.getId();
            this.registryHolder = new RegistryHolderResponse(account.getRegistryHolder());
            this.accountType = new AccountTypeResponse(account.getAccountType());
            this.currency = new CurrencyResponse(account.getCurrency());
            this.bank = account.getBank() != null ? new BankResponse(account.getBank()) : null;
            this.name = account.getName();
            this.isIncludeInBalance = account.isIncludeInBalance();
            this.isDefault = account.isDefaultAccount();
            this.isArchived = account.isArchived();
            this.isDeleted = account.isDeleted();
            this.creditLimit = account.getCreditLimit();
        }

        public UUID getId() { return id; }
        public RegistryHolderResponse getRegistryHolder() { return registryHolder; }
        public AccountTypeResponse getAccountType() { return accountType; }
        public CurrencyResponse getCurrency() { return currency; }
        public BankResponse getBank() { return bank; }
        public String getName() { return name; }
        public boolean getIsIncludeInBalance() { return isIncludeInBalance; }
        public boolean getIsDefault() { return isDefault; }
        public boolean getIsArchived() { return isArchived; }
        public boolean getIsDeleted() { return isDeleted; }
        public BigDecimal getCreditLimit() { return creditLimit; }
    }

    public static class CategoryResponse {
        private UUID id;
        private RegistryHolderResponse registryHolder;
        private String name;
        private boolean income;
        private boolean expense;
        private String emoji;
        private String icon;
        private UUID parentId;

        public CategoryResponse(Category category) {
            this.id = category.getId();
            this.registryHolder = new RegistryHolderResponse(category.getRegistryHolder());
            this.name = category.getName();
            this.income = category.isIncome();
            this.expense = category.isExpense();
            this.emoji = category.getEmoji();
            this.icon = category.getIcon();
            this.parentId = category.getParentId();
        }

        public UUID getId() { return id; }
        public RegistryHolderResponse getRegistryHolder() { return registryHolder; }
        public String getName() { return name; }
        public boolean getIncome() { return income; }
        public boolean getExpense() { return expense; }
        public String getEmoji() { return emoji; }
        public String getIcon() { return icon; }
        public UUID getParentId() { return parentId; }
    }

    public static class ExchangeRateResponse {
        private UUID id;
        private CurrencyResponse currency;
        private LocalDate rateDate;
        private BigDecimal rate;

        public ExchangeRateResponse(ExchangeRate exchangeRate) {
            this.id = exchangeRate.getId();
            this.currency = new CurrencyResponse(exchangeRate.getCurrency());
            this.rateDate = exchangeRate.getRateDate();
            this.rate = exchangeRate.getRate();
        }

        public UUID getId() { return id; }
        public CurrencyResponse getCurrency() { return currency; }
        public LocalDate getRateDate() { return rateDate; }
        public BigDecimal getRate() { return rate; }
    }

    public static class CountResponse {
        private long count;

        public CountResponse(long count) {
            this.count = count;
        }

        public long getCount() { return count; }
    }
}
