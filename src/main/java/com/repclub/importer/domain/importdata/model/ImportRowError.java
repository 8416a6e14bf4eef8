package com.repclub.importer.domain.importdata.model;

public record ImportRowError(int rowIndex, String error) {
}
