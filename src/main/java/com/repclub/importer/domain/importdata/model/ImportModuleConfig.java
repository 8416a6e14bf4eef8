package com.repclub.importer.domain.importdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.repclub.importer.domain.common.enums.FieldType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes one importable target: the store table, its ordered fields and
 * the fields whose combined value identifies the same real-world record.
 */
@Getter
public class ImportModuleConfig {

    private final String module;
    private final String displayName;
    private final String tableName;
    private final List<ImportFieldConfig> fields;
    private final List<String> duplicateKeys;
    private final String duplicateDisplayField;

    @JsonIgnore
    private final Map<String, ImportFieldConfig> fieldsByName;

    @Builder
    public ImportModuleConfig(String module,
                              String displayName,
                              String tableName,
                              @Singular List<ImportFieldConfig> fields,
                              @Singular List<String> duplicateKeys,
                              String duplicateDisplayField) {
        if (tableName == null || tableName.isBlank()) {
            throw new IllegalArgumentException("tableName is required");
        }
        Map<String, ImportFieldConfig> byName = new LinkedHashMap<>();
        for (ImportFieldConfig field : fields) {
            if (field.getName() == null || field.getName().isBlank()) {
                throw new IllegalArgumentException("Field name is required in " + tableName);
            }
            if (byName.putIfAbsent(field.getName(), field) != null) {
                throw new IllegalArgumentException("Duplicate field '" + field.getName() + "' in " + tableName);
            }
            if (field.getType() == FieldType.ENUM && field.getEnumValues().isEmpty()) {
                throw new IllegalArgumentException("Enum field '" + field.getName() + "' declares no values");
            }
        }
        if (duplicateKeys.isEmpty()) {
            throw new IllegalArgumentException("At least one duplicate key is required for " + tableName);
        }
        for (String key : duplicateKeys) {
            if (!byName.containsKey(key)) {
                throw new IllegalArgumentException("Duplicate key '" + key + "' is not a field of " + tableName);
            }
        }

        this.module = module != null ? module : tableName;
        this.displayName = displayName != null ? displayName : this.module;
        this.tableName = tableName;
        this.fields = List.copyOf(fields);
        this.duplicateKeys = List.copyOf(duplicateKeys);
        this.duplicateDisplayField = duplicateDisplayField != null ? duplicateDisplayField : duplicateKeys.get(0);
        this.fieldsByName = Collections.unmodifiableMap(byName);
    }

    public Optional<ImportFieldConfig> findField(String name) {
        return Optional.ofNullable(fieldsByName.get(name));
    }

    public List<String> getFieldNames() {
        return List.copyOf(fieldsByName.keySet());
    }
}
