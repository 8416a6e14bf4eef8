package com.repclub.importer.domain.importdata.model;

import java.util.List;
import java.util.Map;

/**
 * What the mapping review screen needs: the file's columns, the proposed
 * mapping and a few sample rows.
 */
public record ImportPreview(
        String module,
        List<String> headers,
        Map<String, String> suggestedMapping,
        List<Map<String, String>> sampleRows,
        List<CsvParseError> parseErrors,
        int totalRows
) {
}
