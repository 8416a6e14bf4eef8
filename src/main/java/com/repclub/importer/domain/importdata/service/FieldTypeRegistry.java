package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.util.DateTimeUtils;
import com.repclub.importer.util.PhoneUtils;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validators and transformers per {@link FieldType}, shared by the row
 * transformer and the row validator so both read a value the same way.
 *
 * <p>Empty or whitespace-only input is always valid and transforms to null;
 * required-ness is checked separately.
 */
@Component
public class FieldTypeRegistry {

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern NUMBER_NOISE = Pattern.compile("[,$]");
    private static final Pattern CURRENCY_NOISE = Pattern.compile("[$,\\s]");
    private static final Pattern EMAIL = Pattern.compile("[^\\s@]+@[^\\s@]+\\.[^\\s@]+");
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "y");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0", "n");

    private final Map<FieldType, FieldTypeHandler> handlers = new EnumMap<>(FieldType.class);

    public FieldTypeRegistry() {
        handlers.put(FieldType.STRING, new StringHandler());
        handlers.put(FieldType.NUMBER, new NumberHandler(NUMBER_NOISE, false));
        handlers.put(FieldType.DATE, new DateHandler());
        handlers.put(FieldType.EMAIL, new EmailHandler());
        handlers.put(FieldType.PHONE, new PhoneHandler());
        handlers.put(FieldType.BOOLEAN, new BooleanHandler());
        handlers.put(FieldType.CURRENCY, new NumberHandler(CURRENCY_NOISE, true));
        handlers.put(FieldType.ENUM, new EnumHandler());
    }

    public boolean isValid(String value, ImportFieldConfig field) {
        if (isEmpty(value)) {
            return true;
        }
        return handlerFor(field).isValid(value.trim(), field);
    }

    public Object transform(String value, ImportFieldConfig field) {
        if (isEmpty(value)) {
            return null;
        }
        return handlerFor(field).transform(value.trim(), field);
    }

    public FieldTypeHandler handlerFor(ImportFieldConfig field) {
        FieldType type = field.getType() != null ? field.getType() : FieldType.STRING;
        return handlers.get(type);
    }

    static boolean isEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static class StringHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return true;
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return value;
        }
    }

    /**
     * Number and currency differ only in which characters are stripped and
     * whether negatives are allowed.
     */
    private static class NumberHandler implements FieldTypeHandler {

        private final Pattern noise;
        private final boolean nonNegative;

        NumberHandler(Pattern noise, boolean nonNegative) {
            this.noise = noise;
            this.nonNegative = nonNegative;
        }

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return parse(value) != null;
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return parse(value);
        }

        private Double parse(String value) {
            String cleaned = noise.matcher(value).replaceAll("");
            if (!DECIMAL.matcher(cleaned).matches()) {
                return null;
            }
            double number = Double.parseDouble(cleaned);
            if (!Double.isFinite(number) || (nonNegative && number < 0)) {
                return null;
            }
            return number;
        }
    }

    private static class DateHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return DateTimeUtils.parseImportDate(value).isPresent();
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return DateTimeUtils.parseImportDate(value).orElse(null);
        }
    }

    private static class EmailHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return EMAIL.matcher(value).matches();
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return value.toLowerCase(Locale.ROOT);
        }
    }

    private static class PhoneHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return PhoneUtils.isValid(value);
        }

        // Stored as typed; only validation looks at the digits.
        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return value;
        }
    }

    private static class BooleanHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            String lower = value.toLowerCase(Locale.ROOT);
            return TRUE_VALUES.contains(lower) || FALSE_VALUES.contains(lower);
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            String lower = value.toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(lower)) {
                return Boolean.TRUE;
            }
            return FALSE_VALUES.contains(lower) ? Boolean.FALSE : null;
        }
    }

    private static class EnumHandler implements FieldTypeHandler {

        @Override
        public boolean isValid(String value, ImportFieldConfig field) {
            return field.getEnumValues().stream().anyMatch(allowed -> allowed.equalsIgnoreCase(value));
        }

        @Override
        public Object transform(String value, ImportFieldConfig field) {
            return field.getEnumValues().stream()
                    .filter(allowed -> allowed.equalsIgnoreCase(value))
                    .findFirst()
                    .orElse(value.toLowerCase(Locale.ROOT));
        }
    }
}
