package com.repclub.importer.domain.importdata.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Output of the CSV parser for one uploaded file.
 */
public record ParsedCsvData(
        List<String> headers,
        List<Map<String, String>> rows,
        List<CsvParseError> errors,
        int totalRows
) {

    public ParsedCsvData {
        headers = List.copyOf(headers);
        rows = rows.stream().map(Collections::unmodifiableMap).toList();
        errors = List.copyOf(errors);
        if (totalRows != rows.size()) {
            throw new IllegalArgumentException("totalRows must equal the number of rows");
        }
    }

    public static ParsedCsvData of(List<String> headers, List<Map<String, String>> rows, List<CsvParseError> errors) {
        return new ParsedCsvData(headers, rows, errors, rows.size());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
