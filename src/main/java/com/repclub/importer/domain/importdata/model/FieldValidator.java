package com.repclub.importer.domain.importdata.model;

/**
 * Custom per-field rule, run after the type check on non-empty values.
 */
@FunctionalInterface
public interface FieldValidator {

    /**
     * @param value the trimmed source value
     * @return null when the value is acceptable, otherwise the error message
     *         (a blank message is reported as "&lt;label&gt; validation failed")
     */
    String validate(String value);
}
