package com.repclub.importer.web.admin;

import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportPreview;
import com.repclub.importer.domain.importdata.model.ImportResult;
import com.repclub.importer.domain.importdata.model.ImportValidationResult;
import com.repclub.importer.domain.importdata.service.ImportService;
import com.repclub.importer.exception.BusinessException;
import com.repclub.importer.multitenancy.TenantContext;
import com.repclub.importer.multitenancy.TenantFilter;
import com.repclub.importer.web.dto.ImportRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Import Admin Controller
 * Backs the CSV import wizard: module list, template download, preview,
 * validation and execution of an import.
 */
@Slf4j
@RestController
@RequestMapping("/app/imports")
@RequiredArgsConstructor
public class ImportAdminController {

    private final ImportService importService;

    @GetMapping("/modules")
    public ResponseEntity<Map<String, Object>> modules() {
        List<ImportModuleConfig> modules = importService.listModules();
        return ResponseEntity.ok(Map.of("modules", modules));
    }

    /**
     * Download a CSV template for a module
     */
    @GetMapping("/modules/{module}/template")
    public ResponseEntity<byte[]> template(@PathVariable String module,
                                           @RequestParam(required = false, defaultValue = "true") boolean examples) {
        String csv = importService.generateTemplate(module, examples);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, "text/csv; charset=utf-8")
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + module + "_import_template.csv\"")
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parse the file and suggest a column mapping
     */
    @PostMapping("/modules/{module}/preview")
    public ResponseEntity<ImportPreview> preview(@PathVariable String module,
                                                 @Valid @RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.preview(module, request.content(), request.toParseOptions()));
    }

    /**
     * Validate and duplicate-check the file with the reviewed mapping. Nothing is written.
     */
    @PostMapping("/modules/{module}/validate")
    public ResponseEntity<ImportValidationResult> validate(@PathVariable String module,
                                                           @Valid @RequestBody ImportRequest request) {
        String tenantId = requireTenant();
        ImportValidationResult result = importService.validate(
                module, request.content(), request.toParseOptions(), request.mapping(), tenantId);
        return ResponseEntity.ok(result);
    }

    /**
     * Validate, then write valid rows applying the duplicate resolutions
     */
    @PostMapping("/modules/{module}/execute")
    public ResponseEntity<ImportResult> execute(@PathVariable String module,
                                                @Valid @RequestBody ImportRequest request) {
        String tenantId = requireTenant();
        log.info("Executing {} import for organization {}", module, tenantId);
        ImportResult result = importService.execute(module, request.content(), request.toParseOptions(),
                request.mapping(), request.resolutions(), tenantId);
        return ResponseEntity.ok(result);
    }

    private String requireTenant() {
        if (!TenantContext.hasTenant()) {
            throw new BusinessException(TenantFilter.TENANT_HEADER + " header is required");
        }
        return TenantContext.getCurrentTenant();
    }
}
