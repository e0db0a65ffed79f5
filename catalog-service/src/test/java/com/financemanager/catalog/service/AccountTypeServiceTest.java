package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.AccountType;
import com.financemanager.catalog.dto.CatalogResponses.AccountTypeResponse;
import com.financemanager.catalog.dto.accounttype.CreateAccountTypeRequest;
import com.financemanager.catalog.dto.accounttype.UpdateAccountTypeRequest;
import com.financemanager.catalog.repository.AccountTypeRepository;
import com.financemanager.common.error.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountTypeServiceTest {

    @Mock AccountTypeRepository accountTypeRepository;

    @InjectMocks AccountTypeService service;

    private static AccountType accountType(String code) {
        AccountType accountType = new AccountType(code, code + " account");
        ReflectionTestUtils.setField(accountType, "id", UUID.randomUUID());
        return accountType;
    }

    @Nested
    @DisplayName("code uniqueness")
    class CodeUniqueness {

        @Test @DisplayName("create with a taken code → ACCOUNTTYPE_CODE_EXISTS (409)")
        void createTaken() {
            when(accountTypeRepository.isCodeUnique("CASH", null)).thenReturn(false);

            assertThatThrownBy(() -> service.create(new CreateAccountTypeRequest("CASH", "Cash")))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("ACCOUNTTYPE_CODE_EXISTS");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                    });
            verify(accountTypeRepository, never()).save(any(AccountType.class));
        }

        @Test @DisplayName("update to a code used by another type → ACCOUNTTYPE_CODE_EXISTS")
        void updateTaken() {
            AccountType debit = accountType("DEBIT_CARD");
            when(accountTypeRepository.findById(debit.getId())).thenReturn(Optional.of(debit));
            when(accountTypeRepository.isCodeUnique("CASH", debit.getId())).thenReturn(false);

            assertThatThrownBy(() -> service.update(new UpdateAccountTypeRequest(debit.getId(), "CASH", null)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getCode()).isEqualTo("ACCOUNTTYPE_CODE_EXISTS"));
            assertThat(debit.getCode()).isEqualTo("DEBIT_CARD");
        }

        @Test @DisplayName("update keeping its own code → no uniqueness check")
        void ownCode() {
            AccountType debit = accountType("DEBIT_CARD");
            when(accountTypeRepository.findById(debit.getId())).thenReturn(Optional.of(debit));
            when(accountTypeRepository.save(debit)).thenReturn(debit);

            AccountTypeResponse response = service.update(
                    new UpdateAccountTypeRequest(debit.getId(), "DEBIT_CARD", "Debit card"));

            assertThat(response.getDescription()).isEqualTo("Debit card");
            verify(accountTypeRepository, never()).isCodeUnique(any(), any());
        }

        @Test @DisplayName("blank code → ACCOUNTTYPE_CODE_REQUIRED (400)")
        void blankCode() {
            assertThatThrownBy(() -> service.create(new CreateAccountTypeRequest("", "Cash")))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("ACCOUNTTYPE_CODE_REQUIRED");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    });
        }
    }

    @Test @DisplayName("delete while accounts use it → ACCOUNTTYPE_IN_USE (409)")
    void deleteInUse() {
        UUID id = UUID.randomUUID();
        when(accountTypeRepository.canBeDeleted(id)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(id))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("ACCOUNTTYPE_IN_USE");
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                });
        verify(accountTypeRepository, never()).deleteById(any());
    }

    @Test @DisplayName("soft delete twice → saved once")
    void softDeleteIdempotent() {
        AccountType cash = accountType("CASH");
        when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));

        service.softDelete(cash.getId());
        service.softDelete(cash.getId());

        assertThat(cash.isDeleted()).isTrue();
        verify(accountTypeRepository, times(1)).save(cash);
    }

    @Test @DisplayName("restore a live type → nothing saved")
    void restoreLive() {
        AccountType cash = accountType("CASH");
        when(accountTypeRepository.findById(cash.getId())).thenReturn(Optional.of(cash));

        service.restore(cash.getId());

        verify(accountTypeRepository, never()).save(any(AccountType.class));
    }
}
