package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.catalog.dto.CatalogResponses.RegistryHolderResponse;
import com.financemanager.catalog.dto.registryholder.CreateRegistryHolderRequest;
import com.financemanager.catalog.dto.registryholder.RegistryHolderFilter;
import com.financemanager.catalog.dto.registryholder.UpdateRegistryHolderRequest;
import com.financemanager.catalog.errors.RegistryHolderErrors;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Registry holders are the owners of accounts and categories.
 */
@Service
@Transactional
public class RegistryHolderService {

    private static final Logger log = LoggerFactory.getLogger(RegistryHolderService.class);

    private final RegistryHolderRepository registryHolderRepository;

    public RegistryHolderService(RegistryHolderRepository registryHolderRepository) {
        this.registryHolderRepository = registryHolderRepository;
    }

    @Transactional(readOnly = true)
    public RegistryHolderResponse getById(UUID id) {
        return registryHolderRepository.findById(id)
                .map(RegistryHolderResponse::new)
                .orElseThrow(() -> RegistryHolderErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<RegistryHolderResponse> getPaged(RegistryHolderFilter filter) {
        return registryHolderRepository.getPaged(filter).stream()
                .map(RegistryHolderResponse::new)
                .collect(Collectors.toList());
    }

    /**
     * Register a holder. The role defaults to {@link RegistryHolderRole#USER}.
     */
    public RegistryHolderResponse create(CreateRegistryHolderRequest request) {
        Long telegramId = request.getTelegramId();
        if (telegramId == null || telegramId <= 0) {
            throw RegistryHolderErrors.telegramIdRequired();
        }
        if (!registryHolderRepository.isTelegramIdUnique(telegramId, null)) {
            throw RegistryHolderErrors.telegramIdExists(telegramId);
        }

        RegistryHolderRole role = request.getRole() != null ? request.getRole() : RegistryHolderRole.USER;
        RegistryHolder holder = registryHolderRepository.save(new RegistryHolder(telegramId, role));
        log.info("Registry holder created - id={}, telegramId={}", holder.getId(), telegramId);
        return new RegistryHolderResponse(holder);
    }

    public RegistryHolderResponse update(UpdateRegistryHolderRequest request) {
        RegistryHolder holder = registryHolderRepository.findById(request.getId())
                .orElseThrow(() -> RegistryHolderErrors.notFound(request.getId()));

        boolean changed = false;

        Long telegramId = request.getTelegramId();
        if (telegramId != null && telegramId != holder.getTelegramId()) {
            if (telegramId <= 0) {
                throw RegistryHolderErrors.telegramIdRequired();
            }
            if (!registryHolderRepository.isTelegramIdUnique(telegramId, holder.getId())) {
                throw RegistryHolderErrors.telegramIdExists(telegramId);
            }
            holder.changeTelegramId(telegramId);
            changed = true;
        }

        if (request.getRole() != null && request.getRole() != holder.getRole()) {
            holder.changeRole(request.getRole());
            changed = true;
        }

        if (changed) {
            holder = registryHolderRepository.save(holder);
            log.info("Registry holder updated - id={}", request.getId());
        }
        return new RegistryHolderResponse(holder);
    }

    /**
     * Delete a holder that owns nothing. A missing holder is not an error.
     */
    public void delete(UUID id) {
        if (!registryHolderRepository.canBeDeleted(id)) {
            throw RegistryHolderErrors.inUse(id);
        }
        registryHolderRepository.deleteById(id);
        log.info("Registry holder deleted - id={}", id);
    }
}
