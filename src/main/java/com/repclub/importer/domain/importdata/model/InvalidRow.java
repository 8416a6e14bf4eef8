package com.repclub.importer.domain.importdata.model;

import java.util.List;
import java.util.Map;

public record InvalidRow(int rowIndex, Map<String, Object> data, List<String> errors) {

    public InvalidRow {
        errors = List.copyOf(errors);
    }
}
