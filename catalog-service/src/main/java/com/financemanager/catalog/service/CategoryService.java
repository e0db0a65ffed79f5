package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Category;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.dto.CatalogResponses.CategoryResponse;
import com.financemanager.catalog.dto.category.CategoryFilter;
import com.financemanager.catalog.dto.category.CreateCategoryRequest;
import com.financemanager.catalog.dto.category.UpdateCategoryRequest;
import com.financemanager.catalog.errors.CategoryErrors;
import com.financemanager.catalog.repository.CategoryRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for the per-holder category tree.
 *
 * Names are unique among siblings (same holder and parent), ignoring case.
 * A parent assignment is rejected when the proposed parent's ancestor chain
 * reaches the category itself.
 */
@Service
@Transactional
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final CategoryRepository categoryRepository;
    private final RegistryHolderRepository registryHolderRepository;

    public CategoryService(CategoryRepository categoryRepository,
                           RegistryHolderRepository registryHolderRepository) {
        this.categoryRepository = categoryRepository;
        this.registryHolderRepository = registryHolderRepository;
    }

    @Transactional(readOnly = true)
    public CategoryResponse getById(UUID id) {
        return categoryRepository.findById(id)
                .map(CategoryResponse::new)
                .orElseThrow(() -> CategoryErrors.notFound(id));
    }

    @Transactional(readOnly = true)
    public List<CategoryResponse> getPaged(CategoryFilter filter) {
        return categoryRepository.getPaged(filter).stream()
                .map(CategoryResponse::new)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<CategoryResponse> getByRegistryHolderId(UUID registryHolderId) {
        return categoryRepository.findAllByRegistryHolderId(registryHolderId, Sort.by("name")).stream()
                .map(CategoryResponse::new)
                .collect(Collectors.toList());
    }

    public CategoryResponse create(CreateCategoryRequest request) {
        if (!StringUtils.hasText(request.getName())) {
            throw CategoryErrors.nameRequired();
        }

        RegistryHolder holder = registryHolderRepository.findById(request.getRegistryHolderId())
                .orElseThrow(() -> CategoryErrors.registryHolderNotFound(request.getRegistryHolderId()));

        Category parent = null;
        if (request.getParentId() != null) {
            parent = findParent(request.getParentId(), holder.getId());
            ensureNoCycle(null, parent.getId());
        }

        if (!categoryRepository.isNameUniqueInScope(holder.getId(), request.getParentId(), request.getName(), null)) {
            throw CategoryErrors.nameAlreadyExists(request.getName());
        }

        Category category = new Category(holder, request.getName(),
                Boolean.TRUE.equals(request.getIncome()), Boolean.TRUE.equals(request.getExpense()),
                request.getEmoji(), request.getIcon(), parent);
        return new CategoryResponse(categoryRepository.save(category));
    }

    public CategoryResponse update(UpdateCategoryRequest request) {
        Category category = categoryRepository.findById(request.getId())
                .orElseThrow(() -> CategoryErrors.notFound(request.getId()));
        UUID holderId = category.getRegistryHolder().getId();

        String name = category.getName();
        boolean nameChanged = false;
        if (request.getName() != null && !request.getName().equals(category.getName())) {
            if (!StringUtils.hasText(request.getName())) {
                throw CategoryErrors.nameRequired();
            }
            name = request.getName();
            nameChanged = true;
        }

        Category parent = null;
        boolean parentChanged = false;
        if (request.getParentId() != null && !request.getParentId().equals(category.getParentId())) {
            parent = findParent(request.getParentId(), holderId);
            ensureNoCycle(category.getId(), parent.getId());
            parentChanged = true;
        } else if (request.getParentId() == null && Boolean.TRUE.equals(request.getDetachFromParent())
                && category.getParentId() != null) {
            parentChanged = true;
        }

        if (nameChanged || parentChanged) {
            UUID scopeParentId = parentChanged ? (parent != null ? parent.getId() : null) : category.getParentId();
            if (!categoryRepository.isNameUniqueInScope(holderId, scopeParentId, name, category.getId())) {
                throw CategoryErrors.nameAlreadyExists(name);
            }
        }

        // all checks passed, apply
        boolean changed = nameChanged || parentChanged;
        if (nameChanged) {
            category.rename(name);
        }
        if (parentChanged) {
            category.moveUnder(parent);
        }
        if (request.getIncome() != null && request.getIncome() != category.isIncome()) {
            category.changeIncome(request.getIncome());
            changed = true;
        }
        if (request.getExpense() != null && request.getExpense() != category.isExpense()) {
            category.changeExpense(request.getExpense());
            changed = true;
        }
        if (request.getEmoji() != null && !Objects.equals(request.getEmoji(), category.getEmoji())) {
            category.changeEmoji(request.getEmoji());
            changed = true;
        }
        if (request.getIcon() != null && !Objects.equals(request.getIcon(), category.getIcon())) {
            category.changeIcon(request.getIcon());
            changed = true;
        }

        if (changed) {
            category = categoryRepository.save(category);
        }
        return new CategoryResponse(category);
    }

    /**
     * Delete a leaf category. Categories with children are in use.
     */
    public void delete(UUID id) {
        if (categoryRepository.existsByParent_Id(id)) {
            throw CategoryErrors.inUse(id);
        }
        categoryRepository.deleteById(id);
    }

    private Category findParent(UUID parentId, UUID holderId) {
        Category parent = categoryRepository.findById(parentId)
                .orElseThrow(() -> CategoryErrors.parentNotFound(parentId));
        if (!parent.getRegistryHolder().getId().equals(holderId)) {
            // another holder's category is not visible from this scope
            throw CategoryErrors.parentNotFound(parentId);
        }
        return parent;
    }

    /**
     * Walk up from {@code parentId}. Meeting {@code categoryId}, or any node twice, is a cycle.
     *
     * @param categoryId the category being placed, null when it does not exist yet
     */
    private void ensureNoCycle(UUID categoryId, UUID parentId) {
        Set<UUID> visited = new HashSet<>();
        UUID current = parentId;
        while (current != null) {
            if (current.equals(categoryId) || !visited.add(current)) {
                log.warn("Recursive parent rejected - category={}, parent={}", categoryId, parentId);
                throw CategoryErrors.recursiveParent(categoryId, parentId);
            }
            current = categoryRepository.findParentId(current).orElse(null);
        }
    }
}
