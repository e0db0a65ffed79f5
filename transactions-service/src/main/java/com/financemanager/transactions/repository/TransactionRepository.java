package com.financemanager.transactions.repository;

import com.financemanager.common.repository.BaseRepository;
import com.financemanager.transactions.domain.Transaction;
import com.financemanager.transactions.dto.transaction.TransactionFilter;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;

import static com.financemanager.common.repository.FilterSpecifications.*;

@Repository
public interface TransactionRepository extends BaseRepository<Transaction, TransactionFilter> {

    @Override
    default Specification<Transaction> toSpecification(TransactionFilter filter) {
        return allOf(
                equalTo("account.id", filter.getAccountId()),
                equalTo("category.id", filter.getCategoryId()),
                atLeast("date", filter.getDateFrom()),
                atMost("date", filter.getDateTo()),
                atLeast("amount", filter.getAmountFrom()),
                atMost("amount", filter.getAmountTo()),
                contains("description", filter.getDescriptionContains())
        );
    }
}
