package com.financemanager.transactions.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.financemanager.transactions.domain.Role;
import com.financemanager.transactions.domain.TransactionHolder;
import com.financemanager.transactions.domain.TransactionsAccount;
import com.financemanager.transactions.domain.TransactionsAccountType;
import com.financemanager.transactions.domain.TransactionsCategory;
import com.financemanager.transactions.domain.TransactionsCurrency;
import com.financemanager.transactions.dto.transaction.CreateTransactionRequest;
import com.financemanager.transactions.dto.transaction.UpdateTransactionRequest;
import com.financemanager.transactions.dto.transfer.CreateTransferRequest;
import com.financemanager.transactions.repository.*;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Transactions and transfers over HTTP against H2, with replicas written straight
 * into the replica tables. Catalog polling is disabled in the test profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class TransactionsIntegrationTest {

    private static final Instant MARCH_1 = Instant.parse("2024-03-01T09:00:00Z");

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    @Autowired private TransactionHolderRepository holderRepository;
    @Autowired private TransactionsAccountTypeRepository accountTypeRepository;
    @Autowired private TransactionsCurrencyRepository currencyRepository;
    @Autowired private TransactionsAccountRepository accountRepository;
    @Autowired private TransactionsCategoryRepository categoryRepository;

    private static final UUID HOLDER = UUID.randomUUID();
    private static final UUID CARD_TYPE = UUID.randomUUID();
    private static final UUID RUB = UUID.randomUUID();
    private static final UUID WALLET = UUID.randomUUID();
    private static final UUID SAVINGS = UUID.randomUUID();
    private static final UUID OLD_CARD = UUID.randomUUID();
    private static final UUID FOOD = UUID.randomUUID();
    private static final UUID GIFTS = UUID.randomUUID();

    private static UUID transactionId;

    // ── 1. Replicas ───────────────────────────────────────────────────────────

    @Test
    @Order(1)
    @DisplayName("replicas seeded")
    void seedReplicas() {
        holderRepository.save(new TransactionHolder(HOLDER, 111L, Role.USER));
        accountTypeRepository.save(new TransactionsAccountType(CARD_TYPE, "CARD", "Debit card", false));
        currencyRepository.save(new TransactionsCurrency(RUB, "RUB", "643", "Russian ruble", "₽", false));
        accountRepository.saveAll(List.of(
                new TransactionsAccount(WALLET, HOLDER, CARD_TYPE, RUB, "Wallet", null, false, false),
                new TransactionsAccount(SAVINGS, HOLDER, CARD_TYPE, RUB, "Savings", null, false, false),
                new TransactionsAccount(OLD_CARD, HOLDER, CARD_TYPE, RUB, "Old card", null, true, false)));
        TransactionsCategory gifts = new TransactionsCategory(GIFTS, HOLDER, "Gifts", false, true, null);
        gifts.markMissing();
        categoryRepository.saveAll(List.of(
                new TransactionsCategory(FOOD, HOLDER, "Food", false, true, null), gifts));
    }

    // ── 2. Transactions ───────────────────────────────────────────────────────

    @Test
    @Order(2)
    @DisplayName("POST transaction → 201")
    void createTransaction() throws Exception {
        String body = postJson("/api/v1/Transaction",
                new CreateTransactionRequest(MARCH_1, WALLET, FOOD, new BigDecimal("-300"), "Groceries"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.accountId").value(WALLET.toString()))
                .andExpect(jsonPath("$.date").value("2024-03-01T09:00:00Z"))
                .andReturn().getResponse().getContentAsString();
        transactionId = UUID.fromString(objectMapper.readTree(body).get("id").asText());
    }

    @Test
    @Order(3)
    @DisplayName("POST on archived account → 409, on deleted category → 404")
    void unusableReferences() throws Exception {
        postJson("/api/v1/Transaction", new CreateTransactionRequest(MARCH_1, OLD_CARD, FOOD, BigDecimal.TEN, null))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("TRANSACTION_ACCOUNT_ARCHIVED"));

        postJson("/api/v1/Transaction", new CreateTransactionRequest(MARCH_1, WALLET, GIFTS, BigDecimal.TEN, null))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("TRANSACTION_CATEGORY_SOFT_DELETED"));

        postJson("/api/v1/Transaction", new CreateTransactionRequest(MARCH_1, WALLET, FOOD, BigDecimal.ZERO, null))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("TRANSACTION_INVALID_AMOUNT"));
    }

    @Test
    @Order(4)
    @DisplayName("GET list and count filtered by account and date")
    void listAndCount() throws Exception {
        mockMvc.perform(get("/api/v1/Transaction")
                        .param("accountId", WALLET.toString())
                        .param("dateFrom", "2024-03-01T00:00:00Z"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.length()").value(1))
               .andExpect(jsonPath("$[0].id").value(transactionId.toString()));

        mockMvc.perform(get("/api/v1/Transaction/count").param("dateFrom", "2024-03-02T00:00:00Z"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    @Order(5)
    @DisplayName("PUT replaces the description")
    void updateTransaction() throws Exception {
        mockMvc.perform(put("/api/v1/Transaction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new UpdateTransactionRequest(
                                transactionId, null, null, null, null, "Market"))))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.description").value("Market"))
               .andExpect(jsonPath("$.categoryId").value(FOOD.toString()));
    }

    // ── 3. Transfers ──────────────────────────────────────────────────────────

    @Test
    @Order(6)
    @DisplayName("POST transfer → 201, counted by source account")
    void transfer() throws Exception {
        postJson("/api/v1/Transfer", new CreateTransferRequest(MARCH_1, WALLET, SAVINGS,
                new BigDecimal("1000"), new BigDecimal("1000"), null))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.toAccountId").value(SAVINGS.toString()));

        postJson("/api/v1/Transfer", new CreateTransferRequest(MARCH_1, WALLET, OLD_CARD,
                BigDecimal.ONE, BigDecimal.ONE, null))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("TRANSFER_ACCOUNT_ARCHIVED"));

        mockMvc.perform(get("/api/v1/Transfer/count").param("fromAccountId", WALLET.toString()))
               .andExpect(jsonPath("$.count").value(1));
    }

    // ── 4. Delete ─────────────────────────────────────────────────────────────

    @Test
    @Order(7)
    @DisplayName("DELETE transaction → 200, then 404 on read, repeat delete → 200")
    void deleteTransaction() throws Exception {
        mockMvc.perform(delete("/api/v1/Transaction/{id}", transactionId)).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/Transaction/{id}", transactionId))
               .andExpect(status().isNotFound())
               .andExpect(jsonPath("$.errorCode").value("TRANSACTION_NOT_FOUND"));
        mockMvc.perform(delete("/api/v1/Transaction/{id}", transactionId)).andExpect(status().isOk());
    }

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }
}
