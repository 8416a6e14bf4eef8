package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.DuplicateResolution;
import com.repclub.importer.domain.importdata.csv.CsvParser;
import com.repclub.importer.domain.importdata.csv.CsvWriter;
import com.repclub.importer.domain.importdata.csv.ParseOptions;
import com.repclub.importer.domain.importdata.mapping.ColumnAutoMapper;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportPreview;
import com.repclub.importer.domain.importdata.model.ImportResult;
import com.repclub.importer.domain.importdata.model.ImportValidationResult;
import com.repclub.importer.domain.importdata.model.ParsedCsvData;
import com.repclub.importer.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Import Service
 * Entry point for the import wizard: preview (parse + suggested mapping),
 * validate (full run without writing) and execute (validate, then write).
 */
@Slf4j
@Service
public class ImportService {

    private final ImportModuleRegistry moduleRegistry;
    private final CsvParser csvParser;
    private final CsvWriter csvWriter;
    private final ColumnAutoMapper columnAutoMapper;
    private final ImportOrchestrator importOrchestrator;
    private final ImportExecutionService importExecutionService;
    private final int previewSampleSize;

    public ImportService(ImportModuleRegistry moduleRegistry,
                         CsvParser csvParser,
                         CsvWriter csvWriter,
                         ColumnAutoMapper columnAutoMapper,
                         ImportOrchestrator importOrchestrator,
                         ImportExecutionService importExecutionService,
                         @Value("${repclub.import.preview-sample-size:5}") int previewSampleSize) {
        this.moduleRegistry = moduleRegistry;
        this.csvParser = csvParser;
        this.csvWriter = csvWriter;
        this.columnAutoMapper = columnAutoMapper;
        this.importOrchestrator = importOrchestrator;
        this.importExecutionService = importExecutionService;
        this.previewSampleSize = previewSampleSize;
    }

    public List<ImportModuleConfig> listModules() {
        return moduleRegistry.getModules();
    }

    public String generateTemplate(String module, boolean includeExamples) {
        return csvWriter.generateTemplate(moduleRegistry.getModule(module), includeExamples);
    }

    public ImportPreview preview(String module, String content, ParseOptions options) {
        ImportModuleConfig config = moduleRegistry.getModule(module);
        ParsedCsvData parsed = parse(content, options);

        Map<String, String> mapping = columnAutoMapper.autoMap(parsed.headers(), config);
        List<Map<String, String>> sample = parsed.rows().subList(0, Math.min(previewSampleSize, parsed.totalRows()));

        log.info("Preview of {} import: {} columns, {} rows, {} parse errors",
                module, parsed.headers().size(), parsed.totalRows(), parsed.errors().size());
        return new ImportPreview(module, parsed.headers(), mapping, sample, parsed.errors(), parsed.totalRows());
    }

    /**
     * Runs the import without writing. A missing mapping falls back to the auto-mapper.
     */
    public ImportValidationResult validate(String module,
                                           String content,
                                           ParseOptions options,
                                           Map<String, String> mapping,
                                           String tenantId) {
        ImportModuleConfig config = moduleRegistry.getModule(module);
        ParsedCsvData parsed = parse(content, options);
        Map<String, String> effectiveMapping = mapping == null || mapping.isEmpty()
                ? columnAutoMapper.autoMap(parsed.headers(), config)
                : mapping;
        return importOrchestrator.runImport(parsed, effectiveMapping, config, tenantId);
    }

    public ImportResult execute(String module,
                                String content,
                                ParseOptions options,
                                Map<String, String> mapping,
                                Map<Integer, DuplicateResolution> resolutions,
                                String tenantId) {
        ImportModuleConfig config = moduleRegistry.getModule(module);
        ImportValidationResult validation = validate(module, content, options, mapping, tenantId);
        if (!validation.isValid()) {
            log.info("Executing {} import with {} invalid rows left out", module, validation.invalidRows().size());
        }
        return importExecutionService.execute(config, validation,
                resolutions != null ? resolutions : Map.of(), tenantId);
    }

    private ParsedCsvData parse(String content, ParseOptions options) {
        if (content == null || content.isBlank()) {
            throw new BusinessException("Empty file or invalid CSV format");
        }
        ParsedCsvData parsed = csvParser.parse(content, options != null ? options : ParseOptions.defaults());
        if (parsed.headers().isEmpty()) {
            throw new BusinessException("Empty file or invalid CSV format");
        }
        return parsed;
    }
}
