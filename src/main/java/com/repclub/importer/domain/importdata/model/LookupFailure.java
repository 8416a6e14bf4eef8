package com.repclub.importer.domain.importdata.model;

import java.util.Map;

/**
 * A row whose duplicate lookup failed. It was treated as new; a reviewer should check it.
 */
public record LookupFailure(int importRowIndex, Map<String, Object> importData, String message) {
}
