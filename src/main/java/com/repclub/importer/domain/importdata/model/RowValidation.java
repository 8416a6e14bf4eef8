package com.repclub.importer.domain.importdata.model;

import java.util.List;

public record RowValidation(List<String> errors) {

    public RowValidation {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
