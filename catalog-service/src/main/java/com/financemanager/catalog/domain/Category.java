package com.financemanager.catalog.domain;

import com.financemanager.common.domain.AuditedEntity;
import jakarta.persistence.*;

import java.util.Objects;
import java.util.UUID;

/**
 * Income/expense category of a registry holder, optionally nested under a parent.
 *
 * The name is unique within (holder, parent). Parent chains never form a cycle;
 * CategoryService checks this before every parent assignment.
 */
@Entity
@Table(
    name = "categories",
    indexes = {
        @Index(name = "idx_categories_registry_holder_id", columnList = "registry_holder_id"),
        @Index(name = "idx_categories_parent_id", columnList = "parent_id")
    }
)
public class Category extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "registry_holder_id", nullable = false)
    private RegistryHolder registryHolder;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false)
    private boolean income;

    @Column(nullable = false)
    private boolean expense;

    @Column(length = 20)
    private String emoji;

    @Column(length = 100)
    private String icon;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private Category parent;

    protected Category() {
    }

    public Category(RegistryHolder registryHolder, String name, boolean income, boolean expense,
                    String emoji, String icon, Category parent) {
        this.registryHolder = Objects.requireNonNull(registryHolder, "registryHolder");
        this.name = name;
        this.income = income;
        this.expense = expense;
        this.emoji = emoji;
        this.icon = icon;
        this.parent = parent;
    }

    public UUID getId() {
        return id;
    }

    public RegistryHolder getRegistryHolder() {
        return registryHolder;
    }

    public String getName() {
        return name;
    }

    public boolean isIncome() {
        return income;
    }

    public boolean isExpense() {
        return expense;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getIcon() {
        return icon;
    }

    public Category getParent() {
        return parent;
    }

    public UUID getParentId() {
        return parent != null ? parent.getId() : null;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeIncome(boolean income) {
        this.income = income;
    }

    public void changeExpense(boolean expense) {
        this.expense = expense;
    }

    public void changeEmoji(String emoji) {
        this.emoji = emoji;
    }

    public void changeIcon(String icon) {
        this.icon = icon;
    }

    public void moveUnder(Category parent) {
        this.parent = parent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Category category = (Category) o;
        return id != null && Objects.equals(id, category.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Category{id=" + id + ", name='" + name + "', parentId=" + getParentId() + '}';
    }
}
