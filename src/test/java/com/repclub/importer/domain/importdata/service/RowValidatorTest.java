package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.domain.importdata.model.ImportRecord;
import com.repclub.importer.domain.importdata.model.RowValidation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RowValidatorTest {

    private RowValidator rowValidator;
    private RowTransformer rowTransformer;
    private ImportModuleConfig config;

    @BeforeEach
    void setUp() {
        FieldTypeRegistry registry = new FieldTypeRegistry();
        rowValidator = new RowValidator(registry);
        rowTransformer = new RowTransformer(registry);
        config = ImportModuleConfig.builder()
                .tableName("memberships")
                .field(ImportFieldConfig.builder().name("email").label("Email").type(FieldType.EMAIL).required(true).build())
                .field(ImportFieldConfig.builder().name("balance").label("Balance").type(FieldType.CURRENCY).build())
                .field(ImportFieldConfig.builder()
                        .name("status").label("Status").type(FieldType.ENUM)
                        .enumValues(List.of("active", "frozen"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("visits").label("Visits").type(FieldType.NUMBER)
                        .validator(value -> Double.parseDouble(value) >= 0 ? null : "Visits cannot be negative")
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("locker").label("Locker").type(FieldType.NUMBER)
                        .validator(value -> Double.parseDouble(value) <= 100 ? null : "")
                        .build())
                .duplicateKey("email")
                .build();
    }

    private static Map<String, Object> values(Object... pairs) {
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put((String) pairs[i], pairs[i + 1]);
        }
        return values;
    }

    @Test
    void validateRow_MissingRequiredField_ReportsLabel() {
        RowValidation validation = rowValidator.validateRow(values("email", null), config);

        assertFalse(validation.isValid());
        assertEquals(List.of("Email is required"), validation.errors());
    }

    @Test
    void validateRow_ValidRow_HasNoErrors() {
        RowValidation validation = rowValidator.validateRow(
                values("email", "john@x.com", "balance", 10.0, "status", "active", "visits", 3.0), config);

        assertTrue(validation.isValid());
    }

    @Test
    void validateRow_SeveralProblems_AreAllCollected() {
        RowValidation validation = rowValidator.validateRow(
                values("email", "not-an-email", "status", "cancelled"), config);

        assertEquals(List.of("Email has invalid format", "Status must be one of: active, frozen"),
                validation.errors());
    }

    @Test
    void validateRow_CustomValidatorMessage_IsReported() {
        RowValidation validation = rowValidator.validateRow(values("email", "a@b.com", "visits", -2.0), config);

        assertEquals(List.of("Visits cannot be negative"), validation.errors());
    }

    @Test
    void validateRow_CustomValidatorWithoutMessage_UsesGenericMessage() {
        RowValidation validation = rowValidator.validateRow(values("email", "a@b.com", "locker", 500.0), config);

        assertEquals(List.of("Locker validation failed"), validation.errors());
    }

    @Test
    void validateRow_EmptyOptionalField_SkipsCustomValidator() {
        RowValidation validation = rowValidator.validateRow(values("email", "a@b.com", "visits", null), config);

        assertTrue(validation.isValid());
    }

    @Test
    void validateRow_TransformedRowWithUncoercibleValue_ReportsFormat() {
        ImportRecord record = rowTransformer.transformRow(0,
                Map.of("email", "a@b.com", "balance", "ten"),
                Map.of("email", "email", "balance", "balance"),
                config);

        RowValidation validation = rowValidator.validateRow(record, config);

        assertEquals(List.of("Balance has invalid format"), validation.errors());
    }

    @Test
    void validateRow_DefaultValue_SatisfiesRequiredField() {
        ImportModuleConfig withDefault = ImportModuleConfig.builder()
                .tableName("profiles")
                .field(ImportFieldConfig.builder().name("email").label("Email").required(true).build())
                .field(ImportFieldConfig.builder()
                        .name("role").label("Role").type(FieldType.ENUM).required(true)
                        .enumValues(List.of("member", "staff")).defaultValue("member")
                        .build())
                .duplicateKey("email")
                .build();
        ImportRecord record = rowTransformer.transformRow(0,
                Map.of("email", "a@b.com", "role", ""),
                Map.of("email", "email", "role", "role"),
                withDefault);

        assertTrue(rowValidator.validateRow(record, withDefault).isValid());
        assertEquals("member", record.get("role"));
    }

    @Test
    void validateField_WhitespaceOnRequiredField_IsMissing() {
        ImportFieldConfig name = ImportFieldConfig.builder().name("first_name").label("First Name").required(true).build();

        assertEquals(Optional.of("First Name is required"), rowValidator.validateField("   ", name));
        assertEquals(Optional.empty(), rowValidator.validateField("Jane", name));
    }
}
