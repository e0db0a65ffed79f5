package com.financemanager.transactions.repository;

import com.financemanager.transactions.domain.TransactionsAccountType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TransactionsAccountTypeRepository extends JpaRepository<TransactionsAccountType, UUID> {
}
