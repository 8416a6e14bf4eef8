package com.repclub.importer.domain.importdata.model;

import com.repclub.importer.domain.common.enums.LookupStatus;

import java.util.Map;

public record LookupOutcome(LookupStatus status, Map<String, Object> existingRecord, String error) {

    private static final LookupOutcome NOT_FOUND = new LookupOutcome(LookupStatus.NOT_FOUND, null, null);
    private static final LookupOutcome SKIPPED = new LookupOutcome(LookupStatus.SKIPPED, null, null);

    public static LookupOutcome found(Map<String, Object> existingRecord) {
        return new LookupOutcome(LookupStatus.FOUND, existingRecord, null);
    }

    public static LookupOutcome notFound() {
        return NOT_FOUND;
    }

    public static LookupOutcome skipped() {
        return SKIPPED;
    }

    public static LookupOutcome failed(String error) {
        return new LookupOutcome(LookupStatus.LOOKUP_FAILED, null, error);
    }
}
