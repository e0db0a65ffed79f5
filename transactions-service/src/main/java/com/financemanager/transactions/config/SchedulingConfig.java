package com.financemanager.transactions.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduling is switched off together with catalog replication, so that tests and
 * catalog-less local runs start no background work.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "catalog.sync.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
