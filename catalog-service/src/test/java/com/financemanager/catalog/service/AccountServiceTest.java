package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Account;
import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.domain.Currency;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.catalog.dto.CatalogResponses.AccountResponse;
import com.financemanager.catalog.dto.account.CreateAccountRequest;
import com.financemanager.catalog.dto.account.UpdateAccountRequest;
import com.financemanager.catalog.repository.AccountRepository;
import com.financemanager.catalog.repository.AccountTypeRepository;
import com.financemanager.catalog.repository.BankRepository;
import com.financemanager.catalog.repository.CurrencyRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import com.financemanager.common.error.BusinessException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountService.
 * Default-account exclusivity and the archive/delete rules are exercised here.
 */
@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock AccountRepository        accountRepository;
    @Mock RegistryHolderRepository registryHolderRepository;
    @Mock AccountTypeRepository    accountTypeRepository;
    @Mock CurrencyRepository       currencyRepository;
    @Mock BankRepository           bankRepository;

    @InjectMocks AccountService service;

    private RegistryHolder holder;
    private RegistryHolder otherHolder;
    private AccountType    cash;
    private Currency       rub;

    @BeforeEach
    void setUp() {
        holder      = withId(new RegistryHolder(111L, RegistryHolderRole.USER));
        otherHolder = withId(new RegistryHolder(222L, RegistryHolderRole.USER));
        cash        = withId(new AccountType("CASH", "Cash"));
        rub         = withId(new Currency("RUB", "643", "Russian ruble", "₽", null));
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static <T> T withId(T entity) {
        ReflectionTestUtils.setField(entity, "id", UUID.randomUUID());
        return entity;
    }

    private Account account(RegistryHolder owner, String name, boolean isDefault) {
        return withId(new Account(owner, cash, rub, null, name, true, isDefault, null));
    }

    private static void assertError(ThrowingCallable call, String code) {
        assertThatThrownBy(call)
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getCode()).isEqualTo(code));
    }

    private void saveReturnsArgument() {
        when(accountRepository.save(any(Account.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  CREATE
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("create()")
    class CreateTests {

        @Test @DisplayName("blank name → ACCOUNT_NAME_REQUIRED, nothing saved")
        void blankName() {
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "  ",
                    true, false, null);

            assertError(() -> service.create(req), "ACCOUNT_NAME_REQUIRED");
            verifyNoInteractions(accountRepository);
        }

        @Test @DisplayName("unknown holder → ACCOUNT_REGISTRYHOLDER_NOT_FOUND")
        void unknownHolder() {
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.empty());
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    true, false, null);

            assertError(() -> service.create(req), "ACCOUNT_REGISTRYHOLDER_NOT_FOUND");
        }

        @Test @DisplayName("soft-deleted account type → ACCOUNT_ACCOUNTTYPE_SOFT_DELETED")
        void softDeletedAccountType() {
            cash.markDeleted();
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    true, false, null);

            assertError(() -> service.create(req), "ACCOUNT_ACCOUNTTYPE_SOFT_DELETED");
            verify(accountRepository, never()).save(any());
        }

        @Test @DisplayName("soft-deleted currency → ACCOUNT_CURRENCY_SOFT_DELETED")
        void softDeletedCurrency() {
            rub.markDeleted();
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));
            when(currencyRepository.findById(rub.getId())).thenReturn(Optional.of(rub));
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    true, false, null);

            assertError(() -> service.create(req), "ACCOUNT_CURRENCY_SOFT_DELETED");
        }

        @Test @DisplayName("unknown bank → ACCOUNT_BANK_NOT_FOUND")
        void unknownBank() {
            UUID bankId = UUID.randomUUID();
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));
            when(currencyRepository.findById(rub.getId())).thenReturn(Optional.of(rub));
            when(bankRepository.findById(bankId)).thenReturn(Optional.empty());
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), bankId, "Card",
                    true, false, null);

            assertError(() -> service.create(req), "ACCOUNT_BANK_NOT_FOUND");
        }

        @Test @DisplayName("default account clears the holder's previous default")
        void defaultClearsPrevious() {
            Account previous = account(holder, "Old wallet", true);
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));
            when(currencyRepository.findById(rub.getId())).thenReturn(Optional.of(rub));
            when(accountRepository.findAllByRegistryHolderIdAndDefaultAccountTrue(holder.getId()))
                    .thenReturn(List.of(previous));
            saveReturnsArgument();
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    true, true, null);

            AccountResponse created = service.create(req);

            assertThat(created.getIsDefault()).isTrue();
            assertThat(previous.isDefaultAccount()).isFalse();
            verify(accountRepository).saveAll(List.of(previous));
        }

        @Test @DisplayName("non-default account leaves other accounts alone")
        void nonDefaultDoesNotTouchOthers() {
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));
            when(currencyRepository.findById(rub.getId())).thenReturn(Optional.of(rub));
            saveReturnsArgument();
            var req = new CreateAccountRequest(holder.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    null, null, null);

            AccountResponse created = service.create(req);

            assertThat(created.getIsDefault()).isFalse();
            assertThat(created.getIsIncludeInBalance()).isFalse();
            verify(accountRepository, never()).findAllByRegistryHolderIdAndDefaultAccountTrue(any());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  UPDATE
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("update()")
    class UpdateTests {

        @Test @DisplayName("nothing changed → current state returned, no save")
        void noChange() {
            Account a = account(holder, "Wallet", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            var req = new UpdateAccountRequest(a.getId(), cash.getId(), rub.getId(), null, "Wallet",
                    true, false, false, null);

            AccountResponse result = service.update(req);

            assertThat(result.getName()).isEqualTo("Wallet");
            verify(accountRepository, never()).save(any());
            verify(accountRepository, never()).saveAll(anyList());
        }

        @Test @DisplayName("isDefault=true moves the flag from B to A")
        void setDefaultMovesFlag() {
            Account a = account(holder, "A", false);
            Account b = account(holder, "B", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            when(accountRepository.findAllByRegistryHolderIdAndDefaultAccountTrue(holder.getId()))
                    .thenReturn(List.of(b));
            saveReturnsArgument();
            var req = new UpdateAccountRequest(a.getId(), null, null, null, null, null, true, null, null);

            AccountResponse result = service.update(req);

            assertThat(result.getIsDefault()).isTrue();
            assertThat(b.isDefaultAccount()).isFalse();
        }

        @Test @DisplayName("archiving the default account → ACCOUNT_CANNOT_ARCHIVE_DEFAULT")
        void archiveDefault() {
            Account a = account(holder, "A", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            var req = new UpdateAccountRequest(a.getId(), null, null, null, null, null, null, true, null);

            assertError(() -> service.update(req), "ACCOUNT_CANNOT_ARCHIVE_DEFAULT");
            assertThat(a.isArchived()).isFalse();
        }

        @Test @DisplayName("blank name is ignored")
        void blankNameIgnored() {
            Account a = account(holder, "Wallet", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            var req = new UpdateAccountRequest(a.getId(), null, null, null, " ", null, null, null, null);

            assertThat(service.update(req).getName()).isEqualTo("Wallet");
            verify(accountRepository, never()).save(any());
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  SOFT DELETE / DELETE
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("softDelete() / delete()")
    class DeleteTests {

        @Test @DisplayName("soft delete of the default account → ACCOUNT_CANNOT_SOFT_DELETE_DEFAULT")
        void softDeleteDefault() {
            Account a = account(holder, "A", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            assertError(() -> service.softDelete(a.getId()), "ACCOUNT_CANNOT_SOFT_DELETE_DEFAULT");
            assertThat(a.isDeleted()).isFalse();
        }

        @Test @DisplayName("soft delete is idempotent")
        void softDeleteIdempotent() {
            Account a = account(holder, "A", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            service.softDelete(a.getId());
            service.softDelete(a.getId());

            assertThat(a.isDeleted()).isTrue();
            verify(accountRepository, times(1)).save(a);
        }

        @Test @DisplayName("soft delete of missing account → ACCOUNT_NOT_FOUND")
        void softDeleteMissing() {
            UUID id = UUID.randomUUID();
            when(accountRepository.findById(id)).thenReturn(Optional.empty());

            assertError(() -> service.softDelete(id), "ACCOUNT_NOT_FOUND");
        }

        @Test @DisplayName("hard delete of missing account is a no-op")
        void deleteMissing() {
            UUID id = UUID.randomUUID();
            when(accountRepository.findById(id)).thenReturn(Optional.empty());

            assertThatCode(() -> service.delete(id)).doesNotThrowAnyException();
            verify(accountRepository, never()).delete(any(Account.class));
        }

        @Test @DisplayName("hard delete of the default account → ACCOUNT_CANNOT_DELETE_DEFAULT")
        void deleteDefault() {
            Account a = account(holder, "A", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            assertError(() -> service.delete(a.getId()), "ACCOUNT_CANNOT_DELETE_DEFAULT");
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    //  DEFAULT FLAG
    // ══════════════════════════════════════════════════════════════════════════
    @Nested @DisplayName("setAsDefault() / unsetAsDefault()")
    class DefaultFlagTests {

        @Test @DisplayName("already default → no-op")
        void alreadyDefault() {
            Account a = account(holder, "A", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            service.setAsDefault(a.getId());

            verify(accountRepository, never()).save(any());
        }

        @Test @DisplayName("archived account → ACCOUNT_CANNOT_BE_DEFAULT_IF_ARCHIVED_OR_DELETED")
        void archivedCannotBeDefault() {
            Account a = account(holder, "A", false);
            a.archive();
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            assertError(() -> service.setAsDefault(a.getId()), "ACCOUNT_CANNOT_BE_DEFAULT_IF_ARCHIVED_OR_DELETED");
        }

        @Test @DisplayName("setting A default while B was default → A true, B false")
        void setDefaultClearsOther() {
            Account a = account(holder, "A", false);
            Account b = account(holder, "B", true);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            when(accountRepository.findAllByRegistryHolderIdAndDefaultAccountTrue(holder.getId()))
                    .thenReturn(List.of(b));

            service.setAsDefault(a.getId());

            assertThat(a.isDefaultAccount()).isTrue();
            assertThat(b.isDefaultAccount()).isFalse();
            verify(accountRepository).save(a);
        }

        @Test @DisplayName("replacement of another holder → ACCOUNT_REGISTRYHOLDER_DIFFERS")
        void replacementOfOtherHolder() {
            Account a = account(holder, "A", true);
            Account foreign = account(otherHolder, "F", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            when(accountRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

            assertError(() -> service.unsetAsDefault(a.getId(), foreign.getId()), "ACCOUNT_REGISTRYHOLDER_DIFFERS");
            assertThat(a.isDefaultAccount()).isTrue();
        }

        @Test @DisplayName("deleted replacement → ACCOUNT_REPLACEMENT_CANNOT_BE_DEFAULT")
        void deletedReplacement() {
            Account a = account(holder, "A", true);
            Account b = account(holder, "B", false);
            b.markDeleted();
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            when(accountRepository.findById(b.getId())).thenReturn(Optional.of(b));

            assertError(() -> service.unsetAsDefault(a.getId(), b.getId()), "ACCOUNT_REPLACEMENT_CANNOT_BE_DEFAULT");
        }

        @Test @DisplayName("unset moves the flag to the replacement")
        void unsetMovesFlag() {
            Account a = account(holder, "A", true);
            Account b = account(holder, "B", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));
            when(accountRepository.findById(b.getId())).thenReturn(Optional.of(b));

            service.unsetAsDefault(a.getId(), b.getId());

            assertThat(a.isDefaultAccount()).isFalse();
            assertThat(b.isDefaultAccount()).isTrue();
        }

        @Test @DisplayName("unset on a non-default account is a no-op")
        void unsetNonDefault() {
            Account a = account(holder, "A", false);
            when(accountRepository.findById(a.getId())).thenReturn(Optional.of(a));

            service.unsetAsDefault(a.getId(), UUID.randomUUID());

            verify(accountRepository, never()).saveAll(anyList());
        }
    }
}
