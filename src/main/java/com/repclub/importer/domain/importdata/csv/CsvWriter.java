package com.repclub.importer.domain.importdata.csv;

import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes headers and rows back to delimited text with the quoting rules
 * {@link CsvParser} understands. Used for downloadable import templates.
 */
@Component
public class CsvWriter {

    private static final char DEFAULT_DELIMITER = ',';
    private static final String RECORD_SEPARATOR = "\r\n";

    public String generateCsv(List<String> headers, List<? extends Map<String, ?>> rows) {
        return generateCsv(headers, rows, DEFAULT_DELIMITER);
    }

    public String generateCsv(List<String> headers, List<? extends Map<String, ?>> rows, char delimiter) {
        StringBuilder csv = new StringBuilder();
        appendRecord(csv, new ArrayList<>(headers), delimiter);
        for (Map<String, ?> row : rows) {
            csv.append(RECORD_SEPARATOR);
            List<Object> values = new ArrayList<>(headers.size());
            for (String header : headers) {
                values.add(row.get(header));
            }
            appendRecord(csv, values, delimiter);
        }
        return csv.toString();
    }

    /**
     * Template for a module: field names as headers, one row per example index.
     */
    public String generateTemplate(ImportModuleConfig config, boolean includeExamples) {
        List<String> headers = config.getFieldNames();
        List<Map<String, String>> rows = new ArrayList<>();

        if (includeExamples) {
            int exampleCount = config.getFields().stream()
                    .mapToInt(field -> field.getExamples().size())
                    .max()
                    .orElse(0);
            for (int i = 0; i < exampleCount; i++) {
                Map<String, String> row = new LinkedHashMap<>();
                for (ImportFieldConfig field : config.getFields()) {
                    List<String> examples = field.getExamples();
                    row.put(field.getName(), i < examples.size() ? examples.get(i) : "");
                }
                rows.add(row);
            }
        }
        return generateCsv(headers, rows);
    }

    private void appendRecord(StringBuilder csv, List<?> values, char delimiter) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                csv.append(delimiter);
            }
            csv.append(escape(values.get(i), delimiter));
        }
    }

    static String escape(Object value, char delimiter) {
        if (value == null) return "";
        String str = value.toString();
        boolean padded = !str.isEmpty()
                && (Character.isWhitespace(str.charAt(0)) || Character.isWhitespace(str.charAt(str.length() - 1)));
        if (padded || str.indexOf(delimiter) >= 0 || str.contains("\"") || str.contains("\n") || str.contains("\r")) {
            return "\"" + str.replace("\"", "\"\"") + "\"";
        }
        return str;
    }
}
