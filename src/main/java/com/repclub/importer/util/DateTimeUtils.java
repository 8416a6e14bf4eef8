package com.repclub.importer.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

public final class DateTimeUtils {

    /**
     * Date shapes accepted in import files, each with a strict formatter so
     * impossible dates such as 02/30/2024 are rejected.
     */
    private static final List<DateShape> IMPORT_DATE_SHAPES = List.of(
            new DateShape(Pattern.compile("\\d{4}-\\d{2}-\\d{2}"), strict("uuuu-MM-dd")),
            new DateShape(Pattern.compile("\\d{2}/\\d{2}/\\d{4}"), strict("MM/dd/uuuu")),
            new DateShape(Pattern.compile("\\d{2}-\\d{2}-\\d{4}"), strict("MM-dd-uuuu"))
    );

    private DateTimeUtils() {}

    /**
     * Parses YYYY-MM-DD, MM/DD/YYYY or MM-DD-YYYY
     * @return the date, or empty when the shape or the calendar date is wrong
     */
    public static Optional<LocalDate> parseImportDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DateShape shape : IMPORT_DATE_SHAPES) {
            if (shape.pattern().matcher(trimmed).matches()) {
                try {
                    return Optional.of(LocalDate.parse(trimmed, shape.formatter()));
                } catch (DateTimeParseException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Formats the current instant of the clock as an ISO-8601 UTC string
     */
    public static String nowIso(Clock clock) {
        return Instant.now(clock).toString();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private record DateShape(Pattern pattern, DateTimeFormatter formatter) {
    }
}
