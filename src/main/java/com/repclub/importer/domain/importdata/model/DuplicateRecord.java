package com.repclub.importer.domain.importdata.model;

import java.util.List;
import java.util.Map;

/**
 * A valid import row that matched an existing record of the same tenant.
 *
 * @param importRowIndex 0-based index of the row in the parsed file
 */
public record DuplicateRecord(
        int importRowIndex,
        Map<String, Object> importData,
        Map<String, Object> existingRecord,
        List<String> matchedFields
) {
}
