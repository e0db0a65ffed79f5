package com.financemanager.transactions.service;

import com.financemanager.transactions.domain.Transfer;
import com.financemanager.transactions.domain.TransactionsAccount;
import com.financemanager.transactions.dto.TransactionsResponses.TransferResponse;
import com.financemanager.transactions.dto.transfer.CreateTransferRequest;
import com.financemanager.transactions.dto.transfer.TransferFilter;
import com.financemanager.transactions.dto.transfer.UpdateTransferRequest;
import com.financemanager.transactions.errors.TransferErrors;
import com.financemanager.transactions.repository.TransactionsAccountRepository;
import com.financemanager.transactions.repository.TransferRepository;
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
 * Transfers between two accounts. Both amounts are non-zero; both accounts must exist
 * and be neither deleted nor archived.
 */
@Service
@Transactional
public class TransferService {

    private static final Logger log = LoggerFactory.getLogger(TransferService.class);

    private final TransferRepository transferRepository;
    private final TransactionsAccountRepository accountRepository;

    public TransferService(TransferRepository transferRepository,
                           TransactionsAccountRepository accountRepository) {
        this.transferRepository = transferRepository;
        this.accountRepository = accountRepository;
    }

    @Transactional(readOnly = true)
    public TransferResponse getById(UUID id) {
        return transferRepository.findById(id)
                .map(TransferResponse::new)
                .orElseThrow(() -> TransferErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<TransferResponse> getPaged(TransferFilter filter) {
        return transferRepository.getPaged(filter).stream()
                .map(TransferResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long getCount(TransferFilter filter) {
        return transferRepository.countMatching(filter);
    }

    public TransferResponse create(CreateTransferRequest request) {
        if (isZero(request.getFromAmount()) || isZero(request.getToAmount())) {
            throw TransferErrors.invalidAmount();
        }
        TransactionsAccount from = usableAccount(request.getFromAccountId());
        TransactionsAccount to = usableAccount(request.getToAccountId());

        Transfer transfer = transferRepository.save(new Transfer(from, to,
                request.getFromAmount(), request.getToAmount(), request.getDate(), request.getDescription()));
        log.info("Transfer created - id={}, from={}, to={}", transfer.getId(), from.getId(), to.getId());
        return new TransferResponse(transfer);
    }

    public TransferResponse update(UpdateTransferRequest request) {
        Transfer transfer = transferRepository.findById(request.getId())
                .orElseThrow(() -> TransferErrors.notFound(request.getId()));

        boolean changed = false;

        if (request.getDate() != null && !request.getDate().equals(transfer.getDate())) {
            transfer.changeDate(request.getDate());
            changed = true;
        }

        if (request.getFromAccountId() != null
                && !request.getFromAccountId().equals(transfer.getFromAccount().getId())) {
            transfer.changeFromAccount(usableAccount(request.getFromAccountId()));
            changed = true;
        }

        if (request.getToAccountId() != null
                && !request.getToAccountId().equals(transfer.getToAccount().getId())) {
            transfer.changeToAccount(usableAccount(request.getToAccountId()));
            changed = true;
        }

        if (request.getFromAmount() != null && request.getFromAmount().compareTo(transfer.getFromAmount()) != 0) {
            if (isZero(request.getFromAmount())) {
                throw TransferErrors.invalidAmount();
            }
            transfer.changeFromAmount(request.getFromAmount());
            changed = true;
        }

        if (request.getToAmount() != null && request.getToAmount().compareTo(transfer.getToAmount()) != 0) {
            if (isZero(request.getToAmount())) {
                throw TransferErrors.invalidAmount();
            }
            transfer.changeToAmount(request.getToAmount());
            changed = true;
        }

        if (!Objects.equals(request.getDescription(), transfer.getDescription())) {
            transfer.changeDescription(request.getDescription());
            changed = true;
        }

        if (changed) {
            transfer = transferRepository.save(transfer);
            log.info("Transfer updated - id={}", transfer.getId());
        }
        return new TransferResponse(transfer);
    }

    /**
     * A missing transfer is not an error.
     */
    public void delete(UUID id) {
        transferRepository.deleteById(id);
    }

    private TransactionsAccount usableAccount(UUID accountId) {
        TransactionsAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> TransferErrors.accountNotFound(accountId));
        if (account.isDeleted()) {
            throw TransferErrors.accountSoftDeleted(accountId);
        }
        if (account.isArchived()) {
            throw TransferErrors.accountArchived(accountId);
        }
        return account;
    }

    private static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }
}
