package com.repclub.importer.domain.importdata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.repclub.importer.domain.common.enums.FieldType;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * One canonical target column of an importable table.
 */
@Getter
@Builder(toBuilder = true)
public class ImportFieldConfig {

    private final String name;

    private final String label;

    @Builder.Default
    private final FieldType type = FieldType.STRING;

    private final boolean required;

    /**
     * Allowed values for {@link FieldType#ENUM}, in declared case. Matched case-insensitively.
     */
    @Builder.Default
    private final List<String> enumValues = List.of();

    /**
     * Applied when the source file leaves the field unset.
     */
    private final Object defaultValue;

    @JsonIgnore
    private final FieldValidator validator;

    private final String description;

    /**
     * Sample values used for the downloadable template.
     */
    @Builder.Default
    private final List<String> examples = List.of();

    public String getLabel() {
        return label != null ? label : name;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public boolean hasValidator() {
        return validator != null;
    }
}
