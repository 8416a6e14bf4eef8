package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.importdata.model.DuplicateCheckResult;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import com.repclub.importer.domain.importdata.model.ImportValidationResult;
import com.repclub.importer.domain.importdata.model.InvalidRow;
import com.repclub.importer.domain.importdata.model.ParsedCsvData;
import com.repclub.importer.domain.importdata.model.RowValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One import run: transform and validate every row, then duplicate-check the
 * rows that passed. Nothing is written; the caller acts on the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportOrchestrator {

    private final RowTransformer rowTransformer;
    private final RowValidator rowValidator;
    private final DuplicateDetector duplicateDetector;

    public ImportValidationResult runImport(ParsedCsvData parsed,
                                            Map<String, String> mapping,
                                            ImportModuleConfig config,
                                            String tenantId) {
        return runImport(parsed.rows(), mapping, config, tenantId);
    }

    public ImportValidationResult runImport(List<Map<String, String>> rows,
                                            Map<String, String> mapping,
                                            ImportModuleConfig config,
                                            String tenantId) {
        List<ImportRecord> validRows = new ArrayList<>();
        List<InvalidRow> invalidRows = new ArrayList<>();

        for (int i = 0; i < rows.size(); i++) {
            ImportRecord record = rowTransformer.transformRow(i, rows.get(i), mapping, config);
            RowValidation validation = rowValidator.validateRow(record, config);
            if (validation.isValid()) {
                validRows.add(record);
            } else {
                invalidRows.add(new InvalidRow(i, record.values(), validation.errors()));
            }
        }

        DuplicateCheckResult duplicateCheck = duplicateDetector.detectDuplicates(validRows, config, tenantId);

        log.info("Import run on {} for tenant {}: {} valid, {} invalid, {} duplicates",
                config.getTableName(), tenantId, validRows.size(), invalidRows.size(),
                duplicateCheck.duplicates().size());

        return new ImportValidationResult(validRows, invalidRows,
                duplicateCheck.duplicates(), duplicateCheck.lookupFailures());
    }
}
