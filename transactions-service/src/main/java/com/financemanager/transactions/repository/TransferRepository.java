package com.financemanager.transactions.repository;

import com.financemanager.common.repository.BaseRepository;
import com.financemanager.transactions.domain.Transfer;
import com.financemanager.transactions.dto.transfer.TransferFilter;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Repository;

import static com.financemanager.common.repository.FilterSpecifications.*;

@Repository
public interface TransferRepository extends BaseRepository<Transfer, TransferFilter> {

    @Override
    default Specification<Transfer> toSpecification(TransferFilter filter) {
        return allOf(
                equalTo("fromAccount.id", filter.getFromAccountId()),
                equalTo("toAccount.id", filter.getToAccountId()),
                atLeast("date", filter.getDateFrom()),
                atMost("date", filter.getDateTo()),
                atLeast("fromAmount", filter.getFromAmountFrom()),
                atMost("fromAmount", filter.getFromAmountTo()),
                atLeast("toAmount", filter.getToAmountFrom()),
                atMost("toAmount", filter.getToAmountTo()),
                contains("description", filter.getDescriptionContains())
        );
    }
}
