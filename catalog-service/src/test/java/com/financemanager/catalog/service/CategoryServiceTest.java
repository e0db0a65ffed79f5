package com.financemanager.catalog.service;

import com.financemanager.catalog.domain.Category;
import com.financemanager.catalog.domain.RegistryHolder;
import com.financemanager.catalog.domain.RegistryHolderRole;
import com.financemanager.catalog.dto.category.CreateCategoryRequest;
import com.financemanager.catalog.dto.category.UpdateCategoryRequest;
import com.financemanager.catalog.repository.CategoryRepository;
import com.financemanager.catalog.repository.RegistryHolderRepository;
import com.financemanager.common.error.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CategoryServiceTest {

    @Mock CategoryRepository       categoryRepository;
    @Mock RegistryHolderRepository registryHolderRepository;

    @InjectMocks CategoryService service;

    private RegistryHolder holder;
    private Category food;
    private Category groceries;
    private Category vegetables;

    @BeforeEach
    void setUp() {
        holder     = withId(new RegistryHolder(111L, RegistryHolderRole.USER));
        food       = withId(new Category(holder, "Food", false, true, null, null, null));
        groceries  = withId(new Category(holder, "Groceries", false, true, null, null, food));
        vegetables = withId(new Category(holder, "Vegetables", false, true, null, null, groceries));
    }

    private static <T> T withId(T entity) {
        ReflectionTestUtils.setField(entity, "id", UUID.randomUUID());
        return entity;
    }

    private static UpdateCategoryRequest moveUnder(Category category, Category parent) {
        return new UpdateCategoryRequest(category.getId(), null, null, null, null, null, parent.getId());
    }

    private static UpdateCategoryRequest detach(Category category) {
        var request = new UpdateCategoryRequest(category.getId(), null, null, null, null, null, null);
        request.setDetachFromParent(true);
        return request;
    }

    private static String codeOf(Throwable t) {
        return ((BusinessException) t).getCode();
    }

    @Test @DisplayName("parent = itself → CATEGORY_RECURSIVE_PARENT, nothing saved")
    void parentIsItself() {
        when(categoryRepository.findById(food.getId())).thenReturn(Optional.of(food));

        Throwable thrown = catchThrowable(() -> service.update(moveUnder(food, food)));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_RECURSIVE_PARENT");
        verify(categoryRepository, never()).save(any());
    }

    @Test @DisplayName("parent = own grandchild → CATEGORY_RECURSIVE_PARENT, tree unchanged")
    void parentIsDescendant() {
        when(categoryRepository.findById(food.getId())).thenReturn(Optional.of(food));
        when(categoryRepository.findById(vegetables.getId())).thenReturn(Optional.of(vegetables));
        when(categoryRepository.findParentId(vegetables.getId())).thenReturn(Optional.of(groceries.getId()));
        when(categoryRepository.findParentId(groceries.getId())).thenReturn(Optional.of(food.getId()));

        Throwable thrown = catchThrowable(() -> service.update(moveUnder(food, vegetables)));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_RECURSIVE_PARENT");
        assertThat(food.getParent()).isNull();
        verify(categoryRepository, never()).save(any());
    }

    @Test @DisplayName("existing cycle above the proposed parent is detected, walk terminates")
    void corruptCycleTerminates() {
        Category a = withId(new Category(holder, "A", false, true, null, null, null));
        Category b = withId(new Category(holder, "B", false, true, null, null, null));
        when(categoryRepository.findById(food.getId())).thenReturn(Optional.of(food));
        when(categoryRepository.findById(a.getId())).thenReturn(Optional.of(a));
        when(categoryRepository.findParentId(a.getId())).thenReturn(Optional.of(b.getId()));
        when(categoryRepository.findParentId(b.getId())).thenReturn(Optional.of(a.getId()));

        Throwable thrown = catchThrowable(() -> service.update(moveUnder(food, a)));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_RECURSIVE_PARENT");
    }

    @Test @DisplayName("valid move re-parents and saves")
    void validMove() {
        Category transport = withId(new Category(holder, "Transport", false, true, null, null, null));
        when(categoryRepository.findById(groceries.getId())).thenReturn(Optional.of(groceries));
        when(categoryRepository.findById(transport.getId())).thenReturn(Optional.of(transport));
        when(categoryRepository.isNameUniqueInScope(holder.getId(), transport.getId(), "Groceries", groceries.getId()))
                .thenReturn(true);
        when(categoryRepository.save(groceries)).thenReturn(groceries);

        var result = service.update(moveUnder(groceries, transport));

        assertThat(result.getParentId()).isEqualTo(transport.getId());
    }

    @Test @DisplayName("detachFromParent moves the category to the top level")
    void detachToTopLevel() {
        when(categoryRepository.findById(groceries.getId())).thenReturn(Optional.of(groceries));
        when(categoryRepository.isNameUniqueInScope(holder.getId(), null, "Groceries", groceries.getId()))
                .thenReturn(true);
        when(categoryRepository.save(groceries)).thenReturn(groceries);

        var result = service.update(detach(groceries));

        assertThat(result.getParentId()).isNull();
        assertThat(groceries.getParent()).isNull();
    }

    @Test @DisplayName("detach onto a taken top-level name → CATEGORY_NAME_ALREADY_EXISTS")
    void detachNameTaken() {
        when(categoryRepository.findById(groceries.getId())).thenReturn(Optional.of(groceries));
        when(categoryRepository.isNameUniqueInScope(holder.getId(), null, "Groceries", groceries.getId()))
                .thenReturn(false);

        Throwable thrown = catchThrowable(() -> service.update(detach(groceries)));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_NAME_ALREADY_EXISTS");
        assertThat(groceries.getParent()).isEqualTo(food);
    }

    @Test @DisplayName("null parentId without detach keeps the parent")
    void nullParentKeepsParent() {
        when(categoryRepository.findById(groceries.getId())).thenReturn(Optional.of(groceries));

        var result = service.update(new UpdateCategoryRequest(groceries.getId(), null, null, null, null, null, null));

        assertThat(result.getParentId()).isEqualTo(food.getId());
        verify(categoryRepository, never()).save(any());
    }

    @Test @DisplayName("parent of another holder → CATEGORY_PARENT_NOT_FOUND")
    void foreignParent() {
        RegistryHolder other = withId(new RegistryHolder(222L, RegistryHolderRole.USER));
        Category foreign = withId(new Category(other, "Foreign", false, true, null, null, null));
        when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
        when(categoryRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));
        var req = new CreateCategoryRequest(holder.getId(), "Snacks", false, true, null, null, foreign.getId());

        Throwable thrown = catchThrowable(() -> service.create(req));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_PARENT_NOT_FOUND");
    }

    @Test @DisplayName("sibling with same name → CATEGORY_NAME_ALREADY_EXISTS")
    void duplicateSiblingName() {
        when(registryHolderRepository.findById(holder.getId())).thenReturn(Optional.of(holder));
        when(categoryRepository.isNameUniqueInScope(holder.getId(), null, "food", null)).thenReturn(false);
        var req = new CreateCategoryRequest(holder.getId(), "food", false, true, null, null, null);

        Throwable thrown = catchThrowable(() -> service.create(req));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_NAME_ALREADY_EXISTS");
    }

    @Test @DisplayName("category with children → CATEGORY_IN_USE")
    void deleteWithChildren() {
        when(categoryRepository.existsByParent_Id(food.getId())).thenReturn(true);

        Throwable thrown = catchThrowable(() -> service.delete(food.getId()));

        assertThat(codeOf(thrown)).isEqualTo("CATEGORY_IN_USE");
        verify(categoryRepository, never()).deleteById(any());
    }
}
