package com.repclub.importer.domain.common.enums;

/**
 * Outcome of one duplicate lookup against the record store.
 */
public enum LookupStatus {
    FOUND,
    NOT_FOUND,
    LOOKUP_FAILED,
    SKIPPED          // a duplicate key was empty, no lookup issued
}
