package com.financemanager.catalog.domain;

public enum RegistryHolderRole {
    USER,
    ADMIN
}
