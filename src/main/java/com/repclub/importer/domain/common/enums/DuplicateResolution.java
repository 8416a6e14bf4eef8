package com.repclub.importer.domain.common.enums;

/**
 * What the reviewer decided for an import row that matched an existing record.
 */
public enum DuplicateResolution {
    MERGE,
    CREATE,
    SKIP
}
