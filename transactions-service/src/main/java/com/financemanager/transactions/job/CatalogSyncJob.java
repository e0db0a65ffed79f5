package com.financemanager.transactions.job;

import com.financemanager.common.config.MdcKeys;
import com.financemanager.transactions.client.CatalogResource;
import com.financemanager.transactions.client.ExternalApiException;
import com.financemanager.transactions.service.CatalogDataLoaderService;
import com.financemanager.transactions.service.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls the catalog and refreshes the local replicas.
 *
 * Runs once when the application is ready and then on {@code catalog.sync.cron}
 * (top of every hour by default). Collections load in dependency order. Each collection
 * has its own lock: a run that finds it held skips that collection. A failing collection
 * is logged and does not stop the ones after it.
 */
@Component
@ConditionalOnProperty(name = "catalog.sync.enabled", havingValue = "true", matchIfMissing = true)
public class CatalogSyncJob {

    private static final Logger log = LoggerFactory.getLogger(CatalogSyncJob.class);

    private final CatalogDataLoaderService loaderService;
    private final Map<CatalogResource, ReentrantLock> locks = new EnumMap<>(CatalogResource.class);

    public CatalogSyncJob(CatalogDataLoaderService loaderService) {
        this.loaderService = loaderService;
        for (CatalogResource resource : CatalogResource.values()) {
            locks.put(resource, new ReentrantLock());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("Initial catalog replication");
        synchronize();
    }

    @Scheduled(cron = "${catalog.sync.cron:0 0 * * * *}")
    public void synchronize() {
        String runId = "sync-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MdcKeys.REQUEST_ID, runId);
        try {
            long startTime = System.currentTimeMillis();
            int failed = 0;
            for (CatalogResource resource : CatalogResource.values()) {
                if (!synchronize(resource)) {
                    failed++;
                }
            }
            log.info("Catalog replication finished in {} ms, {} collection(s) failed or skipped",
                    System.currentTimeMillis() - startTime, failed);
        } finally {
            MDC.remove(MdcKeys.REQUEST_ID);
        }
    }

    /**
     * @return true if the collection was replicated
     */
    boolean synchronize(CatalogResource resource) {
        ReentrantLock lock = locks.get(resource);
        if (!lock.tryLock()) {
            log.info("Catalog {} replication already running, skipped", resource);
            return false;
        }
        try {
            SyncResult result = loaderService.load(resource);
            log.debug("Catalog {} done - {}", resource, result);
            return true;
        } catch (ExternalApiException e) {
            log.error("Catalog {} replication aborted: {}", resource, e.getMessage(), e);
            return false;
        } catch (RuntimeException e) {
            // storage failures roll back this collection only
            log.error("Catalog {} replication failed", resource, e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockOf(CatalogResource resource) {
        return locks.get(resource);
    }
}
