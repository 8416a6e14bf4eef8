package com.repclub.importer.domain.importdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A source row after mapping and type coercion.
 *
 * @param rowIndex      0-based index of the row in the parsed file
 * @param values        typed values keyed by target field name (may hold nulls)
 * @param sourceValues  the raw strings each mapped field was read from
 */
public record ImportRecord(
        int rowIndex,
        Map<String, Object> values,
        @JsonIgnore Map<String, String> sourceValues
) {

    public ImportRecord {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        sourceValues = Collections.unmodifiableMap(new LinkedHashMap<>(sourceValues));
    }

    public static ImportRecord of(int rowIndex, Map<String, Object> values) {
        return new ImportRecord(rowIndex, values, Map.of());
    }

    public Object get(String field) {
        return values.get(field);
    }
}
