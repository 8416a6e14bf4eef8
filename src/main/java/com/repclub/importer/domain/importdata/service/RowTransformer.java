package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies an approved column mapping and the field type registry to one raw row.
 * Never throws: values that cannot be coerced become null and are reported by
 * {@link RowValidator}, which still sees the raw string.
 */
@Component
@RequiredArgsConstructor
public class RowTransformer {

    private final FieldTypeRegistry fieldTypeRegistry;

    public ImportRecord transformRow(int rowIndex,
                                     Map<String, String> rawRow,
                                     Map<String, String> mapping,
                                     ImportModuleConfig config) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> sourceValues = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String targetField = entry.getValue();
            if (targetField == null || targetField.isBlank()) {
                continue;
            }
            String raw = rawRow.get(entry.getKey());
            if (raw != null) {
                sourceValues.put(targetField, raw);
            }

            Optional<ImportFieldConfig> field = config.findField(targetField);
            if (field.isPresent()) {
                values.put(targetField, fieldTypeRegistry.transform(raw, field.get()));
            } else {
                values.put(targetField, FieldTypeRegistry.isEmpty(raw) ? null : raw.trim());
            }
        }

        for (ImportFieldConfig field : config.getFields()) {
            if (field.hasDefaultValue() && values.get(field.getName()) == null) {
                values.put(field.getName(), field.getDefaultValue());
            }
        }

        return new ImportRecord(rowIndex, values, sourceValues);
    }
}
