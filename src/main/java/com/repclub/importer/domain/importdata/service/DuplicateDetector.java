package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.importdata.model.DuplicateCheckResult;
import com.repclub.importer.domain.importdata.model.DuplicateRecord;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import com.repclub.importer.domain.importdata.model.LookupFailure;
import com.repclub.importer.domain.importdata.model.LookupOutcome;
import com.repclub.importer.domain.importdata.repository.RecordStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Looks up every validated row in the record store by the module's duplicate
 * keys, scoped to the tenant.
 *
 * <p>Lookups run one at a time unless {@code repclub.import.duplicate-check.parallelism}
 * is above 1, in which case a bounded pool runs them and results are collected
 * back in row order. A failed lookup never aborts the run: the row is treated as
 * new and reported in {@link DuplicateCheckResult#lookupFailures()}.
 */
@Slf4j
@Service
public class DuplicateDetector {

    private final RecordStore recordStore;
    private final String tenantColumn;
    private final int parallelism;
    private ExecutorService executor;

    public DuplicateDetector(RecordStore recordStore,
                             @Value("${repclub.import.tenant-column:organization_id}") String tenantColumn,
                             @Value("${repclub.import.duplicate-check.parallelism:1}") int parallelism) {
        this.recordStore = recordStore;
        this.tenantColumn = tenantColumn;
        this.parallelism = Math.max(1, parallelism);
    }

    @PostConstruct
    public void init() {
        if (parallelism > 1) {
            AtomicInteger counter = new AtomicInteger();
            executor = Executors.newFixedThreadPool(parallelism, r -> {
                Thread t = new Thread(r, "duplicate-check-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            log.info("DuplicateDetector initialized with {} lookup threads", parallelism);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public DuplicateCheckResult detectDuplicates(List<ImportRecord> validRecords,
                                                 ImportModuleConfig config,
                                                 String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");

        List<LookupOutcome> outcomes = executor == null
                ? lookupSequentially(validRecords, config, tenantId)
                : lookupConcurrently(validRecords, config, tenantId);

        List<DuplicateRecord> duplicates = new ArrayList<>();
        List<LookupFailure> failures = new ArrayList<>();
        for (int i = 0; i < validRecords.size(); i++) {
            ImportRecord record = validRecords.get(i);
            LookupOutcome outcome = outcomes.get(i);
            switch (outcome.status()) {
                case FOUND -> duplicates.add(new DuplicateRecord(
                        record.rowIndex(), record.values(), outcome.existingRecord(), config.getDuplicateKeys()));
                case LOOKUP_FAILED -> failures.add(new LookupFailure(
                        record.rowIndex(), record.values(), outcome.error()));
                default -> { }
            }
        }

        log.info("Duplicate check on {} for tenant {}: {} rows, {} duplicates, {} failed lookups",
                config.getTableName(), tenantId, validRecords.size(), duplicates.size(), failures.size());
        return new DuplicateCheckResult(duplicates, failures);
    }

    /**
     * Tagged outcome of the lookup for one row. Rows with an empty duplicate key are skipped.
     */
    public LookupOutcome lookup(ImportRecord record, ImportModuleConfig config, String tenantId) {
        Map<String, Object> keys = new LinkedHashMap<>();
        for (String key : config.getDuplicateKeys()) {
            Object value = record.get(key);
            if (isEmptyKey(value)) {
                return LookupOutcome.skipped();
            }
            keys.put(key, value);
        }

        try {
            return recordStore.findOne(config.getTableName(), tenantColumn, tenantId, keys)
                    .map(LookupOutcome::found)
                    .orElseGet(LookupOutcome::notFound);
        } catch (RuntimeException e) {
            log.warn("Duplicate lookup failed for row {} of {}: {}",
                    record.rowIndex(), config.getTableName(), e.getMessage());
            return LookupOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private List<LookupOutcome> lookupSequentially(List<ImportRecord> records, ImportModuleConfig config, String tenantId) {
        List<LookupOutcome> outcomes = new ArrayList<>(records.size());
        for (ImportRecord record : records) {
            outcomes.add(lookup(record, config, tenantId));
        }
        return outcomes;
    }

    private List<LookupOutcome> lookupConcurrently(List<ImportRecord> records, ImportModuleConfig config, String tenantId) {
        List<CompletableFuture<LookupOutcome>> futures = new ArrayList<>(records.size());
        for (ImportRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(() -> lookup(record, config, tenantId), executor));
        }

        List<LookupOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<LookupOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                log.error("Duplicate lookup task failed", e);
                outcomes.add(LookupOutcome.failed("Lookup task failed: " + e.getCause()));
            }
        }
        return outcomes;
    }

    private static boolean isEmptyKey(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
