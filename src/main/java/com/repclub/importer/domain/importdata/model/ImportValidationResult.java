package com.repclub.importer.domain.importdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terminal artifact of one import run. Not persisted: the caller decides
 * create, merge or skip per row right away.
 */
public record ImportValidationResult(
        List<ImportRecord> validRows,
        List<InvalidRow> invalidRows,
        List<DuplicateRecord> duplicates,
        List<LookupFailure> lookupFailures
) {

    public ImportValidationResult {
        validRows = List.copyOf(validRows);
        invalidRows = List.copyOf(invalidRows);
        duplicates = List.copyOf(duplicates);
        lookupFailures = List.copyOf(lookupFailures);
    }

    /**
     * Duplicates and failed lookups are advisory and never make a run invalid.
     */
    @JsonProperty("isValid")
    public boolean isValid() {
        return invalidRows.isEmpty();
    }
}
