package com.repclub.importer.domain.importdata.service;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import com.repclub.importer.domain.importdata.model.ImportModuleConfig;
import com.repclub.importer.exception.ResourceNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in importable tables.
 */
@Component
public class ImportModuleRegistry {

    private final Map<String, ImportModuleConfig> modules = new LinkedHashMap<>();

    public ImportModuleRegistry() {
        register(members());
        register(staff());
        register(equipment());
        register(classes());
    }

    public ImportModuleConfig getModule(String module) {
        ImportModuleConfig config = modules.get(module);
        if (config == null) {
            throw new ResourceNotFoundException("Import module", module);
        }
        return config;
    }

    public List<ImportModuleConfig> getModules() {
        return new ArrayList<>(modules.values());
    }

    private void register(ImportModuleConfig config) {
        modules.put(config.getModule(), config);
    }

    static ImportModuleConfig members() {
        return ImportModuleConfig.builder()
                .module("members")
                .displayName("Members")
                .tableName("profiles")
                .field(email())
                .field(firstName())
                .field(lastName())
                .field(phone())
                .field(ImportFieldConfig.builder()
                        .name("role")
                        .label("Role")
                        .type(FieldType.ENUM)
                        .enumValues(List.of("owner", "manager", "staff", "trainer", "member"))
                        .defaultValue("member")
                        .examples(List.of("member", "member"))
                        .build())
                .duplicateKey("email")
                .duplicateDisplayField("email")
                .build();
    }

    static ImportModuleConfig staff() {
        return ImportModuleConfig.builder()
                .module("staff")
                .displayName("Staff")
                .tableName("profiles")
                .field(email())
                .field(firstName())
                .field(lastName())
                .field(phone())
                .field(ImportFieldConfig.builder()
                        .name("role")
                        .label("Role")
                        .type(FieldType.ENUM)
                        .enumValues(List.of("manager", "staff", "trainer"))
                        .defaultValue("staff")
                        .description("Staff members cannot be imported as owners")
                        .examples(List.of("trainer", "staff"))
                        .build())
                .duplicateKey("email")
                .duplicateDisplayField("email")
                .build();
    }

    static ImportModuleConfig equipment() {
        return ImportModuleConfig.builder()
                .module("equipment")
                .displayName("Equipment")
                .tableName("equipment")
                .field(ImportFieldConfig.builder()
                        .name("name").label("Name").required(true)
                        .examples(List.of("Treadmill T5", "Olympic Bench"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("equipment_type").label("Equipment Type")
                        .type(FieldType.ENUM)
                        .enumValues(List.of("cardio", "strength", "functional", "other"))
                        .defaultValue("cardio")
                        .examples(List.of("cardio", "strength"))
                        .build())
                .field(ImportFieldConfig.builder().name("brand").label("Brand")
                        .examples(List.of("Life Fitness", "Rogue")).build())
                .field(ImportFieldConfig.builder().name("model").label("Model").build())
                .field(ImportFieldConfig.builder()
                        .name("serial_number").label("Serial Number")
                        .description("Used to recognise equipment that already exists")
                        .examples(List.of("LF-T5-00912", "RG-OB-2231"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("purchase_date").label("Purchase Date").type(FieldType.DATE)
                        .examples(List.of("2023-04-15", "06/01/2022"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("purchase_price").label("Purchase Price").type(FieldType.CURRENCY)
                        .examples(List.of("$4,999.00", "650"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("warranty_expiry").label("Warranty Expiry").type(FieldType.DATE).build())
                .field(ImportFieldConfig.builder()
                        .name("status").label("Status")
                        .type(FieldType.ENUM)
                        .enumValues(List.of("active", "maintenance", "out_of_service", "retired"))
                        .defaultValue("active")
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("maintenance_interval_days").label("Maintenance Interval (days)")
                        .type(FieldType.NUMBER)
                        .defaultValue(90.0)
                        .validator(value -> wholeNumberBetween(value, 1, 730)
                                ? null
                                : "Maintenance interval must be a whole number of days between 1 and 730")
                        .build())
                .field(ImportFieldConfig.builder().name("notes").label("Notes").build())
                .duplicateKey("serial_number")
                .duplicateDisplayField("name")
                .build();
    }

    static ImportModuleConfig classes() {
        return ImportModuleConfig.builder()
                .module("classes")
                .displayName("Classes")
                .tableName("classes")
                .field(ImportFieldConfig.builder()
                        .name("name").label("Class Name").required(true)
                        .examples(List.of("Morning Spin", "Power Yoga"))
                        .build())
                .field(ImportFieldConfig.builder().name("description").label("Description").build())
                .field(ImportFieldConfig.builder()
                        .name("scheduled_at").label("Scheduled Date").type(FieldType.DATE).required(true)
                        .examples(List.of("2025-01-06", "2025-01-07"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("duration_minutes").label("Duration (minutes)")
                        .type(FieldType.NUMBER)
                        .defaultValue(60.0)
                        .validator(value -> wholeNumberBetween(value, 5, 480)
                                ? null
                                : "Duration must be between 5 and 480 minutes")
                        .examples(List.of("45", "60"))
                        .build())
                .field(ImportFieldConfig.builder()
                        .name("max_capacity").label("Max Capacity")
                        .type(FieldType.NUMBER)
                        .defaultValue(20.0)
                        .validator(value -> wholeNumberBetween(value, 1, 500) ? null : "")
                        .examples(List.of("20", "15"))
                        .build())
                .duplicateKey("name")
                .duplicateKey("scheduled_at")
                .duplicateDisplayField("name")
                .build();
    }

    private static ImportFieldConfig email() {
        return ImportFieldConfig.builder()
                .name("email").label("Email").type(FieldType.EMAIL).required(true)
                .examples(List.of("jane.doe@example.com", "sam.lee@example.com"))
                .build();
    }

    private static ImportFieldConfig firstName() {
        return ImportFieldConfig.builder()
                .name("first_name").label("First Name").required(true)
                .examples(List.of("Jane", "Sam"))
                .build();
    }

    private static ImportFieldConfig lastName() {
        return ImportFieldConfig.builder()
                .name("last_name").label("Last Name")
                .examples(List.of("Doe", "Lee"))
                .build();
    }

    private static ImportFieldConfig phone() {
        return ImportFieldConfig.builder()
                .name("phone").label("Phone").type(FieldType.PHONE)
                .examples(List.of("(555) 123-4567", "+1 555 987 6543"))
                .build();
    }

    private static boolean wholeNumberBetween(String value, int min, int max) {
        try {
            double number = Double.parseDouble(value.replaceAll("[,$]", ""));
            return number == Math.rint(number) && number >= min && number <= max;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
