package com.financemanager.transactions.service;

import com.financemanager.transactions.domain.Transaction;
import com.financemanager.transactions.domain.TransactionsAccount;
import com.financemanager.transactions.domain.TransactionsCategory;
import com.financemanager.transactions.dto.TransactionsResponses.TransactionResponse;
import com.financemanager.transactions.dto.transaction.CreateTransactionRequest;
import com.financemanager.transactions.dto.transaction.TransactionFilter;
import com.financemanager.transactions.dto.transaction.UpdateTransactionRequest;
import com.financemanager.transactions.errors.TransactionErrors;
import com.financemanager.transactions.repository.TransactionRepository;
import com.financemanager.transactions.repository.TransactionsAccountRepository;
import com.financemanager.transactions.repository.TransactionsCategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Income and expense records.
 *
 * BUSINESS RULES:
 * - amount is never zero
 * - the account exists, is not deleted and is not archived
 * - the category exists and is not deleted
 *
 * Accounts and categories are catalog replicas; this service only reads them.
 */
@Service
@Transactional
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final TransactionsAccountRepository accountRepository;
    private final TransactionsCategoryRepository categoryRepository;

    public TransactionService(TransactionRepository transactionRepository,
                              TransactionsAccountRepository accountRepository,
                              TransactionsCategoryRepository categoryRepository) {
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.categoryRepository = categoryRepository;
    }

    @Transactional(readOnly = true)
    public TransactionResponse getById(UUID id) {
        return transactionRepository.findById(id)
                .map(TransactionResponse::new)
                .orElseThrow(() -> TransactionErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<TransactionResponse> getPaged(TransactionFilter filter) {
        return transactionRepository.getPaged(filter).stream()
                .map(TransactionResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long getCount(TransactionFilter filter) {
        return transactionRepository.countMatching(filter);
    }

    public TransactionResponse create(CreateTransactionRequest request) {
        if (isZero(request.getAmount())) {
            throw TransactionErrors.invalidAmount();
        }
        TransactionsAccount account = usableAccount(request.getAccountId());
        TransactionsCategory category = usableCategory(request.getCategoryId());

        Transaction transaction = transactionRepository.save(new Transaction(
                account, category, request.getAmount(), request.getDate(), request.getDescription()));
        log.info("Transaction created - id={}, account={}, amount={}",
                transaction.getId(), account.getId(), transaction.getAmount());
        return new TransactionResponse(transaction);
    }

    /**
     * Apply every present field that differs from the stored value. Saves only on change.
     */
    public TransactionResponse update(UpdateTransactionRequest request) {
        Transaction transaction = transactionRepository.findById(request.getId())
                .orElseThrow(() -> TransactionErrors.notFound(request.getId()));

        boolean changed = false;

        if (request.getDate() != null && !request.getDate().equals(transaction.getDate())) {
            transaction.changeDate(request.getDate());
            changed = true;
        }

        if (request.getAccountId() != null && !request.getAccountId().equals(transaction.getAccount().getId())) {
            transaction.changeAccount(usableAccount(request.getAccountId()));
            changed = true;
        }

        if (request.getCategoryId() != null && !request.getCategoryId().equals(transaction.getCategory().getId())) {
            transaction.changeCategory(usableCategory(request.getCategoryId()));
            changed = true;
        }

        if (request.getAmount() != null && request.getAmount().compareTo(transaction.getAmount()) != 0) {
            if (isZero(request.getAmount())) {
                throw TransactionErrors.invalidAmount();
            }
            transaction.changeAmount(request.getAmount());
            changed = true;
        }

        if (!Objects.equals(request.getDescription(), transaction.getDescription())) {
            transaction.changeDescription(request.getDescription());
            changed = true;
        }

        if (changed) {
            transaction = transactionRepository.save(transaction);
            log.info("Transaction updated - id={}", transaction.getId());
        } else {
            log.debug("No changes for transaction {}", transaction.getId());
        }
        return new TransactionResponse(transaction);
    }

    /**
     * A missing transaction is not an error.
     */
    public void delete(UUID id) {
        transactionRepository.deleteById(id);
    }

    private TransactionsAccount usableAccount(UUID accountId) {
        TransactionsAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> TransactionErrors.accountNotFound(accountId));
        if (account.isDeleted()) {
            throw TransactionErrors.accountSoftDeleted(accountId);
        }
        if (account.isArchived()) {
            throw TransactionErrors.accountArchived(accountId);
        }
        return account;
    }

    private TransactionsCategory usableCategory(UUID categoryId) {
        TransactionsCategory category = categoryRepository.findById(categoryId)
                .orElseThrow(() -> TransactionErrors.categoryNotFound(categoryId));
        if (category.isDeleted()) {
            throw TransactionErrors.categorySoftDeleted(categoryId);
        }
        return category;
    }

    private static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }
}
