package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import com.repclub.importer.domain.importdata.model.RowValidation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a transformed row against required-ness, field type, enum membership
 * and the optional custom rule of every field. All errors are collected.
 */
@Component
@RequiredArgsConstructor
public class RowValidator {

    private final FieldTypeRegistry fieldTypeRegistry;

    public RowValidation validateRow(ImportRecord record, ImportModuleConfig config) {
        List<String> errors = new ArrayList<>();
        for (ImportFieldConfig field : config.getFields()) {
            validateField(checkedValue(record, field.getName()), field).ifPresent(errors::add);
        }
        return new RowValidation(errors);
    }

    public RowValidation validateRow(Map<String, Object> values, ImportModuleConfig config) {
        return validateRow(ImportRecord.of(0, values), config);
    }

    /**
     * @return the error message, or empty when the value is acceptable
     */
    public Optional<String> validateField(String value, ImportFieldConfig field) {
        boolean empty = FieldTypeRegistry.isEmpty(value);
        if (field.isRequired() && empty) {
            return Optional.of(field.getLabel() + " is required");
        }
        if (empty) {
            return Optional.empty();
        }

        if (!fieldTypeRegistry.isValid(value, field)) {
            if (field.getType() == FieldType.ENUM) {
                return Optional.of(field.getLabel() + " must be one of: " + String.join(", ", field.getEnumValues()));
            }
            return Optional.of(field.getLabel() + " has invalid format");
        }

        if (field.hasValidator()) {
            String message = field.getValidator().validate(value.trim());
            if (message != null) {
                return Optional.of(message.isBlank() ? field.getLabel() + " validation failed" : message);
            }
        }
        return Optional.empty();
    }

    /**
     * The raw file value when the field came from the file, so a value the
     * transformer could not coerce is still reported; otherwise the string
     * form of the typed or default value.
     */
    private static String checkedValue(ImportRecord record, String fieldName) {
        String raw = record.sourceValues().get(fieldName);
        if (!FieldTypeRegistry.isEmpty(raw)) {
            return raw;
        }
        Object value = record.values().get(fieldName);
        return value != null ? value.toString() : "";
    }
}
