package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldTypeRegistryTest {

    private FieldTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new FieldTypeRegistry();
    }

    private static ImportFieldConfig field(FieldType type) {
        return ImportFieldConfig.builder().name("value").type(type).build();
    }

    @Test
    void currency_SymbolsAndSeparators_AreStripped() {
        ImportFieldConfig currency = field(FieldType.CURRENCY);

        assertTrue(registry.isValid("$1,250.50", currency));
        assertEquals(1250.5, registry.transform("$1,250.50", currency));
        assertEquals(12500.0, registry.transform("12 500", currency));
    }

    @Test
    void currency_NegativeAmount_IsInvalid() {
        ImportFieldConfig currency = field(FieldType.CURRENCY);

        assertFalse(registry.isValid("-5", currency));
        assertNull(registry.transform("-5", currency));
    }

    @Test
    void number_ValidForms_AreParsed() {
        ImportFieldConfig number = field(FieldType.NUMBER);

        assertEquals(1234.5, registry.transform("1,234.5", number));
        assertEquals(99.0, registry.transform("$99", number));
        assertEquals(-3.5, registry.transform("-3.5", number));
        assertEquals(1500.0, registry.transform("1.5e3", number));
    }

    @Test
    void number_Garbage_IsInvalidAndTransformsToNull() {
        ImportFieldConfig number = field(FieldType.NUMBER);

        for (String value : List.of("12abc", "NaN", "Infinity", "1e999", "1.2.3", "--4")) {
            assertFalse(registry.isValid(value, number), value);
            assertNull(registry.transform(value, number), value);
        }
    }

    @Test
    void date_SupportedShapes_AreParsed() {
        ImportFieldConfig date = field(FieldType.DATE);

        assertEquals(LocalDate.of(2024, 2, 29), registry.transform("2024-02-29", date));
        assertEquals(LocalDate.of(2024, 12, 31), registry.transform("12/31/2024", date));
        assertEquals(LocalDate.of(2024, 12, 31), registry.transform("12-31-2024", date));
    }

    @Test
    void date_ImpossibleOrUnsupported_IsInvalid() {
        ImportFieldConfig date = field(FieldType.DATE);

        for (String value : List.of("02/29/2023", "2024-13-01", "2024/12/31", "1/5/2024", "31/12/2024", "tomorrow")) {
            assertFalse(registry.isValid(value, date), value);
            assertNull(registry.transform(value, date), value);
        }
    }

    @Test
    void email_IsTrimmedAndLowercased() {
        ImportFieldConfig email = field(FieldType.EMAIL);

        assertTrue(registry.isValid(" John@X.com ", email));
        assertEquals("john@x.com", registry.transform(" John@X.com ", email));
        assertFalse(registry.isValid("john@x", email));
        assertFalse(registry.isValid("jo hn@x.com", email));
    }

    @Test
    void phone_KeepsTypedFormAndChecksDigitCount() {
        ImportFieldConfig phone = field(FieldType.PHONE);

        assertTrue(registry.isValid("(555) 123-4567", phone));
        assertEquals("(555) 123-4567", registry.transform("(555) 123-4567", phone));
        assertTrue(registry.isValid("+44 20 7946 0958", phone));
        assertFalse(registry.isValid("12345", phone));
        assertFalse(registry.isValid("555-CALL-NOW", phone));
    }

    @Test
    void booleanValues_AcceptedSpellings() {
        ImportFieldConfig bool = field(FieldType.BOOLEAN);

        assertEquals(Boolean.TRUE, registry.transform("Yes", bool));
        assertEquals(Boolean.TRUE, registry.transform("1", bool));
        assertEquals(Boolean.FALSE, registry.transform("n", bool));
        assertFalse(registry.isValid("maybe", bool));
        assertNull(registry.transform("maybe", bool));
    }

    @Test
    void enumValues_MatchCaseInsensitivelyToDeclaredCase() {
        ImportFieldConfig status = ImportFieldConfig.builder()
                .name("status").type(FieldType.ENUM).enumValues(List.of("Active", "Frozen")).build();

        assertTrue(registry.isValid("frozen", status));
        assertEquals("Frozen", registry.transform("frozen", status));
        assertFalse(registry.isValid("gone", status));
        assertEquals("gone", registry.transform("GONE", status));
    }

    @Test
    void string_IsTrimmed() {
        assertEquals("hi", registry.transform("  hi ", field(FieldType.STRING)));
    }

    @Test
    void emptyInput_IsValidAndNullForEveryType() {
        for (FieldType type : FieldType.values()) {
            ImportFieldConfig config = field(type);
            assertTrue(registry.isValid("", config), type.name());
            assertTrue(registry.isValid("   ", config), type.name());
            assertTrue(registry.isValid(null, config), type.name());
            assertNull(registry.transform("  ", config), type.name());
        }
    }

    @Test
    void transform_AppliedTwice_GivesSameValue() {
        Map<FieldType, String> samples = Map.of(
                FieldType.STRING, " Spin ",
                FieldType.NUMBER, "1,234.5",
                FieldType.DATE, "12/31/2024",
                FieldType.EMAIL, "John@X.com",
                FieldType.PHONE, "(555) 123-4567",
                FieldType.BOOLEAN, "yes",
                FieldType.CURRENCY, "$1,250.50");

        samples.forEach((type, raw) -> {
            ImportFieldConfig config = field(type);
            Object once = registry.transform(raw, config);
            Object twice = registry.transform(once.toString(), config);
            assertEquals(once, twice, type.name());
        });
    }
}
