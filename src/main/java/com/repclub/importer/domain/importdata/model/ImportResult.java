package com.repclub.importer.domain.importdata.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters produced when a reviewed import is written to the store.
 */
@Data
@NoArgsConstructor
public class ImportResult {

    private boolean success = true;
    private int imported;
    private int merged;
    private int skipped;
    private int failed;
    private List<ImportRowError> errors = new ArrayList<>();

    public void recordImported() {
        imported++;
    }

    public void recordMerged() {
        merged++;
    }

    public void recordSkipped() {
        skipped++;
    }

    public void recordFailure(int rowIndex, String error) {
        failed++;
        errors.add(new ImportRowError(rowIndex, error));
    }

    public int getProcessed() {
        return imported + merged + skipped + failed;
    }
}
