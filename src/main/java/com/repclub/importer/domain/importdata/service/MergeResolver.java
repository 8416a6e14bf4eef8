package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.util.DateTimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Combines an existing record with imported values. A blank import cell never
 * erases stored data, and identity columns are never overwritten.
 */
@Slf4j
@Component
public class MergeResolver {

    static final String UPDATED_AT = "updated_at";

    private final Set<String> protectedColumns;
    private final Clock clock;

    public MergeResolver(@Value("${repclub.import.tenant-column:organization_id}") String tenantColumn,
                         Clock clock) {
        this.protectedColumns = Set.of("id", tenantColumn, "created_at");
        this.clock = clock;
    }

    public Map<String, Object> merge(Map<String, Object> existing,
                                     Map<String, Object> incoming,
                                     ImportModuleConfig config) {
        Map<String, Object> merged = new LinkedHashMap<>(existing);

        for (Map.Entry<String, Object> entry : incoming.entrySet()) {
            Object value = entry.getValue();
            if (value == null || "".equals(value) || protectedColumns.contains(entry.getKey())) {
                continue;
            }
            merged.put(entry.getKey(), value);
        }
        merged.put(UPDATED_AT, DateTimeUtils.nowIso(clock));

        log.debug("Merged import data into {} record {}", config.getTableName(), existing.get("id"));
        return merged;
    }
}
