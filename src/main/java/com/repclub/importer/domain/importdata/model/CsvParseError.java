package com.repclub.importer.domain.importdata.model;

/**
 * Non-fatal problem found while tokenizing one data row.
 *
 * @param row     0-based index of the data row (header excluded)
 * @param code    MissingQuotes, InvalidQuotes, TooFewFields or TooManyFields
 * @param message human-readable description
 */
public record CsvParseError(int row, String code, String message) {
}
