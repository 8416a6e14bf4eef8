package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.DuplicateResolution;
import com.repclub.importer.domain.importdata.model.DuplicateRecord;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import com.repclub.importer.domain.importdata.model.ImportResult;
import com.repclub.importer.domain.importdata.model.ImportValidationResult;
import com.repclub.importer.domain.importdata.repository.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a reviewed import to the record store: new rows are inserted,
 * duplicates are merged, re-created or skipped as the reviewer decided.
 * A failing row is counted and the rest still go through.
 */
@Slf4j
@Service
public class ImportExecutionService {

    private static final DuplicateResolution DEFAULT_RESOLUTION = DuplicateResolution.MERGE;

    private final RecordStore recordStore;
    private final MergeResolver mergeResolver;
    private final String tenantColumn;

    public ImportExecutionService(RecordStore recordStore,
                                  MergeResolver mergeResolver,
                                  @Value("${repclub.import.tenant-column:organization_id}") String tenantColumn) {
        this.recordStore = recordStore;
        this.mergeResolver = mergeResolver;
        this.tenantColumn = tenantColumn;
    }

    /**
     * @param resolutions decisions keyed by source row index; duplicates without one are merged
     */
    public ImportResult execute(ImportModuleConfig config,
                                ImportValidationResult validation,
                                Map<Integer, DuplicateResolution> resolutions,
                                String tenantId) {
        Map<Integer, DuplicateRecord> duplicatesByRow = new HashMap<>();
        for (DuplicateRecord duplicate : validation.duplicates()) {
            duplicatesByRow.put(duplicate.importRowIndex(), duplicate);
        }

        ImportResult result = new ImportResult();
        List<ImportRecord> rows = validation.validRows();

        for (ImportRecord row : rows) {
            DuplicateRecord duplicate = duplicatesByRow.get(row.rowIndex());
            try {
                if (duplicate == null) {
                    insert(config, row, tenantId);
                    result.recordImported();
                    continue;
                }
                switch (resolutions.getOrDefault(row.rowIndex(), DEFAULT_RESOLUTION)) {
                    case SKIP -> result.recordSkipped();
                    case CREATE -> {
                        insert(config, row, tenantId);
                        result.recordImported();
                    }
                    case MERGE -> {
                        Map<String, Object> existing = duplicate.existingRecord();
                        Map<String, Object> merged = mergeResolver.merge(existing, row.values(), config);
                        recordStore.update(config.getTableName(), existing.get("id"), merged);
                        result.recordMerged();
                    }
                }
            } catch (RuntimeException e) {
                log.error("Failed to import row {} into {}: {}", row.rowIndex(), config.getTableName(), e.getMessage());
                result.recordFailure(row.rowIndex(), e.getMessage() != null ? e.getMessage() : "Unknown error");
            }
        }

        result.setSuccess(result.getFailed() == 0 || result.getFailed() < rows.size());
        log.info("Import into {} for tenant {} finished: {} imported, {} merged, {} skipped, {} failed",
                config.getTableName(), tenantId, result.getImported(), result.getMerged(),
                result.getSkipped(), result.getFailed());
        return result;
    }

    private void insert(ImportModuleConfig config, ImportRecord row, String tenantId) {
        Map<String, Object> values = new LinkedHashMap<>();
        row.values().forEach((key, value) -> {
            if (value != null) {
                values.put(key, value);
            }
        });
        values.put(tenantColumn, tenantId);
        recordStore.insert(config.getTableName(), values);
    }
}
