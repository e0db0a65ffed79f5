package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.catalog.dto.CatalogResponses.RegistryHolderResponse;
import com.financemanager.catalog.dto.registryholder.CreateRegistryHolderRequest;
import com.financemanager.catalog.dto.registryholder.UpdateRegistryHolderRequest;
import com.financemanager.catalog.repository.RegistryHolderRepository;
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
class RegistryHolderServiceTest {

    @Mock RegistryHolderRepository registryHolderRepository;

    @InjectMocks RegistryHolderService service;

    private static RegistryHolder holder(long telegramId) {
        RegistryHolder holder = new RegistryHolder(telegramId, RegistryHolderRole.USER);
        ReflectionTestUtils.setField(holder, "id", UUID.randomUUID());
        return holder;
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test @DisplayName("no role given → USER")
        void defaultRole() {
            when(registryHolderRepository.isTelegramIdUnique(42L, null)).thenReturn(true);
            when(registryHolderRepository.save(any(RegistryHolder.class))).thenAnswer(inv -> inv.getArgument(0));

            RegistryHolderResponse response = service.create(new CreateRegistryHolderRequest(42L, null));

            assertThat(response.getTelegramId()).isEqualTo(42L);
            assertThat(response.getRole()).isEqualTo(RegistryHolderRole.USER);
        }

        @Test @DisplayName("telegramId already registered → REGISTRYHOLDER_TELEGRAMID_EXISTS (409)")
        void duplicateTelegramId() {
            when(registryHolderRepository.isTelegramIdUnique(42L, null)).thenReturn(false);

            assertThatThrownBy(() -> service.create(new CreateRegistryHolderRequest(42L, RegistryHolderRole.ADMIN)))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("REGISTRYHOLDER_TELEGRAMID_EXISTS");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                    });
            verify(registryHolderRepository, never()).save(any(RegistryHolder.class));
        }

        @Test @DisplayName("zero telegramId → REGISTRYHOLDER_TELEGRAMID_REQUIRED (400)")
        void zeroTelegramId() {
            assertThatThrownBy(() -> service.create(new CreateRegistryHolderRequest(0L, null)))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getCode()).isEqualTo("REGISTRYHOLDER_TELEGRAMID_REQUIRED");
                        assertThat(e.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                    });
            verifyNoInteractions(registryHolderRepository);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test @DisplayName("telegramId taken by another holder → REGISTRYHOLDER_TELEGRAMID_EXISTS")
        void telegramIdTaken() {
            RegistryHolder holder = holder(42L);
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(registryHolderRepository.isTelegramIdUnique(77L, holder.getId())).thenReturn(false);

            assertThatThrownBy(() -> service.update(new UpdateRegistryHolderRequest(holder.getId(), 77L, null)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.getCode()).isEqualTo("REGISTRYHOLDER_TELEGRAMID_EXISTS"));
            assertThat(holder.getTelegramId()).isEqualTo(42L);
        }

        @Test @DisplayName("own telegramId and same role → nothing saved")
        void unchanged() {
            RegistryHolder holder = holder(42L);
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));

            service.update(new UpdateRegistryHolderRequest(holder.getId(), 42L, RegistryHolderRole.USER));

            verify(registryHolderRepository, never()).isTelegramIdUnique(anyLong(), any());
            verify(registryHolderRepository, never()).save(any(RegistryHolder.class));
        }

        @Test @DisplayName("role change → saved")
        void roleChange() {
            RegistryHolder holder = holder(42L);
            when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
            when(registryHolderRepository.save(holder)).thenReturn(holder);

            RegistryHolderResponse response = service.update(
                    new UpdateRegistryHolderRequest(holder.getId(), null, RegistryHolderRole.ADMIN));

            assertThat(response.getRole()).isEqualTo(RegistryHolderRole.ADMIN);
        }
    }

    @Test @DisplayName("delete while owning accounts or categories → REGISTRYHOLDER_IN_USE (409)")
    void deleteInUse() {
        UUID id = UUID.randomUUID();
        when(registryHolderRepository.canBeDeleted(id)).thenReturn(false);

        assertThatThrownBy(() -> service.delete(id))
                .isInstanceOfSatisfying(BusinessException.class, e -> {
                    assertThat(e.getCode()).isEqualTo("REGISTRYHOLDER_IN_USE");
                    assertThat(e.getStatus()).isEqualTo(HttpStatus.CONFLICT);
                });
        verify(registryHolderRepository, never()).deleteById(any());
    }

    @Test @DisplayName("delete a holder that owns nothing → removed")
    void deleteUnused() {
        UUID id = UUID.randomUUID();
        when(registryHolderRepository.canBeDeleted(id)).thenReturn(true);

        service.delete(id);

        verify(registryHolderRepository).deleteById(id);
    }
}
