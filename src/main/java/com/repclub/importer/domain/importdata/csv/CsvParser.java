package com.repclub.importer.domain.importdata.csv;

import com.repclub.importer.domain.importdata.model.CsvParseError;
import com.repclub.importer.domain.importdata.model.ParsedCsvData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns delimited text into a header list and ordered row maps.
 * Malformed rows are reported in {@link ParsedCsvData#errors()} and never stop the parse.
 */
@Slf4j
@Component
public class CsvParser {

    static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final int DELIMITER_SAMPLE_LINES = 5;
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16_LE_BOM = {(byte) 0xFF, (byte) 0xFE};
    private static final byte[] UTF16_BE_BOM = {(byte) 0xFE, (byte) 0xFF};

    public ParsedCsvData parse(String content) {
        return parse(content, ParseOptions.defaults());
    }

    /**
     * Reads raw file bytes. The charset comes from the BOM when there is one,
     * otherwise UTF-8 if the bytes are valid UTF-8, otherwise ISO-8859-1.
     */
    public ParsedCsvData parse(InputStream source, ParseOptions options) {
        byte[] bytes;
        try {
            bytes = source.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("CSV parsing failed: " + e.getMessage(), e);
        }
        return parse(decode(bytes), options);
    }

    public ParsedCsvData parse(String content, ParseOptions options) {
        if (content == null || content.isEmpty()) {
            return ParsedCsvData.of(List.of(), List.of(), List.of());
        }
        if (content.charAt(0) == BOM) {
            content = content.substring(1);
        }

        char delimiter = options.getDelimiter() != null ? options.getDelimiter() : detectDelimiter(content);
        List<CsvParseError> errors = new ArrayList<>();
        List<RawRecord> records = tokenize(content, delimiter);

        List<String> headers = new ArrayList<>();
        List<Map<String, String>> rows = new ArrayList<>();
        boolean headerPending = options.isHasHeader();
        int dataRow = 0;

        if (!options.isHasHeader()) {
            int width = 0;
            for (RawRecord record : records) {
                if (!record.isBlank()) {
                    width = Math.max(width, record.cells().size());
                }
            }
            for (int i = 1; i <= width; i++) {
                headers.add("Column " + i);
            }
        }

        for (RawRecord record : records) {
            if (record.isBlank() && (options.isSkipEmptyLines() || headerPending)) {
                continue;
            }
            List<String> cells = options.isTrimFields() ? trimAll(record.cells()) : record.cells();

            if (headerPending) {
                headers.addAll(cells);
                headerPending = false;
                continue;
            }

            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                row.put(headers.get(i), i < cells.size() ? cells.get(i) : "");
            }
            // rows with only empty cells are never emitted, so they take no index
            if (!hasAnyValue(row)) {
                continue;
            }

            for (String issue : record.issues()) {
                errors.add(new CsvParseError(dataRow, issue, quoteMessage(issue)));
            }
            if (options.isHasHeader() && cells.size() != headers.size()) {
                errors.add(fieldCountError(dataRow, headers.size(), cells.size()));
            }
            rows.add(row);
            dataRow++;
        }

        if (!errors.isEmpty()) {
            log.debug("Parsed {} rows with {} errors", rows.size(), errors.size());
        }
        return ParsedCsvData.of(headers, rows, errors);
    }

    /**
     * Picks the candidate with the highest average count over the first lines.
     * Ties keep the earlier candidate, so comma wins when nothing stands out.
     */
    public char detectDelimiter(String sample) {
        String[] lines = sample.split("\n", -1);
        int lineCount = Math.min(lines.length, DELIMITER_SAMPLE_LINES);

        char best = CANDIDATE_DELIMITERS[0];
        double bestAverage = -1;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int total = 0;
            for (int i = 0; i < lineCount; i++) {
                total += countOccurrences(lines[i], candidate);
            }
            double average = (double) total / lineCount;
            if (average > bestAverage) {
                best = candidate;
                bestAverage = average;
            }
        }
        return best;
    }

    private List<RawRecord> tokenize(String content, char delimiter) {
        List<RawRecord> records = new ArrayList<>();
        List<String> cells = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean afterClosingQuote = false;
        boolean recordStarted = false;

        int length = content.length();
        for (int i = 0; i < length; i++) {
            char c = content.charAt(i);

            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < length && content.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                        afterClosingQuote = true;
                    }
                } else {
                    current.append(c);
                }
                continue;
            }

            if (c == delimiter) {
                cells.add(current.toString());
                current.setLength(0);
                afterClosingQuote = false;
                recordStarted = true;
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < length && content.charAt(i + 1) == '\n') {
                    i++;
                }
                cells.add(current.toString());
                records.add(new RawRecord(cells, issues));
                cells = new ArrayList<>();
                issues = new ArrayList<>();
                current.setLength(0);
                afterClosingQuote = false;
                recordStarted = false;
            } else if (c == QUOTE && current.length() == 0 && !afterClosingQuote) {
                inQuotes = true;
                recordStarted = true;
            } else {
                if (afterClosingQuote && !issues.contains("InvalidQuotes")) {
                    issues.add("InvalidQuotes");
                }
                current.append(c);
                recordStarted = true;
            }
        }

        if (inQuotes) {
            issues.add("MissingQuotes");
        }
        if (recordStarted || current.length() > 0) {
            cells.add(current.toString());
            records.add(new RawRecord(cells, issues));
        }
        return records;
    }

    private static List<String> trimAll(List<String> cells) {
        List<String> trimmed = new ArrayList<>(cells.size());
        for (String cell : cells) {
            trimmed.add(cell.trim());
        }
        return trimmed;
    }

    private static boolean hasAnyValue(Map<String, String> row) {
        for (String value : row.values()) {
            if (!value.trim().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private static String decode(byte[] bytes) {
        int bomLength = getBomLength(bytes);
        return new String(bytes, bomLength, bytes.length - bomLength, detectEncoding(bytes));
    }

    private static Charset detectEncoding(byte[] content) {
        if (startsWith(content, UTF8_BOM)) {
            return StandardCharsets.UTF_8;
        }
        if (startsWith(content, UTF16_LE_BOM)) {
            return StandardCharsets.UTF_16LE;
        }
        if (startsWith(content, UTF16_BE_BOM)) {
            return StandardCharsets.UTF_16BE;
        }
        return isValidUtf8(content) ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1;
    }

    private static int getBomLength(byte[] content) {
        if (startsWith(content, UTF8_BOM)) {
            return UTF8_BOM.length;
        }
        if (startsWith(content, UTF16_LE_BOM) || startsWith(content, UTF16_BE_BOM)) {
            return 2;
        }
        return 0;
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Structural check of multi-byte sequences; overlong forms are not rejected.
     */
    private static boolean isValidUtf8(byte[] content) {
        int i = 0;
        while (i < content.length) {
            int b = content[i] & 0xFF;
            int continuation;
            if (b < 0x80) {
                continuation = 0;
            } else if ((b & 0xE0) == 0xC0) {
                continuation = 1;
            } else if ((b & 0xF0) == 0xE0) {
                continuation = 2;
            } else if ((b & 0xF8) == 0xF0) {
                continuation = 3;
            } else {
                return false;
            }
            if (i + continuation >= content.length && continuation > 0) {
                return false;
            }
            for (int k = 1; k <= continuation; k++) {
                if ((content[i + k] & 0xC0) != 0x80) {
                    return false;
                }
            }
            i += continuation + 1;
        }
        return true;
    }

    private static CsvParseError fieldCountError(int row, int expected, int actual) {
        String code = actual < expected ? "TooFewFields" : "TooManyFields";
        String message = (actual < expected ? "Too few fields" : "Too many fields")
                + ": expected " + expected + " fields but parsed " + actual;
        return new CsvParseError(row, code, message);
    }

    private static String quoteMessage(String code) {
        return "MissingQuotes".equals(code)
                ? "Quoted field unterminated"
                : "Trailing quote on quoted field is malformed";
    }

    private static int countOccurrences(String str, char c) {
        int count = 0;
        for (char ch : str.toCharArray()) {
            if (ch == c) count++;
        }
        return count;
    }

    private record RawRecord(List<String> cells, List<String> issues) {

        boolean isBlank() {
            for (String cell : cells) {
                if (!cell.trim().isEmpty()) {
                    return false;
                }
            }
            return true;
        }
    }
}
