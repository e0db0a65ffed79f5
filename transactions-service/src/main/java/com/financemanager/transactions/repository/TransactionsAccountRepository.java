package com.financemanager.transactions.repository;

import com.financemanager.transactions.domain.TransactionsAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Catalog account replicas, written only by the replication job.
 */
@Repository
public interface TransactionsAccountRepository extends JpaRepository<TransactionsAccount, UUID> {
}
