package com.repclub.importer.domain.importdata.model;

import java.util.List;

public record DuplicateCheckResult(List<DuplicateRecord> duplicates, List<LookupFailure> lookupFailures) {

    public DuplicateCheckResult {
        duplicates = List.copyOf(duplicates);
        lookupFailures = List.copyOf(lookupFailures);
    }
}
