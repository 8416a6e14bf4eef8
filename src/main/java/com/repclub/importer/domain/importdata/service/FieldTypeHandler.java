package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.importdata.model.ImportFieldConfig;

/**
 * Validator/transformer pair for one field type. Both receive a trimmed,
 * non-empty value; empty input is handled by {@link FieldTypeRegistry}.
 */
public interface FieldTypeHandler {

    boolean isValid(String value, ImportFieldConfig field);

    /**
     * @return the typed value, or null when the input cannot be coerced
     */
    Object transform(String value, ImportFieldConfig field);
}
