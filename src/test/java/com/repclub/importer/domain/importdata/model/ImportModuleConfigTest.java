package com.repclub.importer.domain.importdata.model;

import com.repclub.importer.domain.common.enums.FieldType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportModuleConfigTest {

    private static ImportFieldConfig field(String name) {
        return ImportFieldConfig.builder().name(name).build();
    }

    @Test
    void build_ValidConfig_FillsDefaults() {
        ImportModuleConfig config = ImportModuleConfig.builder()
                .tableName("lockers")
                .field(field("code"))
                .field(field("zone"))
                .duplicateKey("code")
                .build();

        assertEquals("lockers", config.getModule());
        assertEquals("lockers", config.getDisplayName());
        assertEquals("code", config.getDuplicateDisplayField());
        assertEquals(List.of("code", "zone"), config.getFieldNames());
        assertEquals("zone", config.findField("zone").map(ImportFieldConfig::getLabel).orElse(null));
        assertTrue(config.findField("missing").isEmpty());
    }

    @Test
    void build_DuplicateFieldNames_Throws() {
        assertThrows(IllegalArgumentException.class, () -> ImportModuleConfig.builder()
                .tableName("lockers")
                .field(field("code"))
                .field(field("code"))
                .duplicateKey("code")
                .build());
    }

    @Test
    void build_DuplicateKeyNotAField_Throws() {
        assertThrows(IllegalArgumentException.class, () -> ImportModuleConfig.builder()
                .tableName("lockers")
                .field(field("code"))
                .duplicateKey("serial")
                .build());
    }

    @Test
    void build_NoDuplicateKeys_Throws() {
        assertThrows(IllegalArgumentException.class, () -> ImportModuleConfig.builder()
                .tableName("lockers")
                .field(field("code"))
                .build());
    }

    @Test
    void build_EnumWithoutValues_Throws() {
        assertThrows(IllegalArgumentException.class, () -> ImportModuleConfig.builder()
                .tableName("lockers")
                .field(ImportFieldConfig.builder().name("size").type(FieldType.ENUM).build())
                .field(field("code"))
                .duplicateKey("code")
                .build());
    }

    @Test
    void build_MissingTableName_Throws() {
        assertThrows(IllegalArgumentException.class, () -> ImportModuleConfig.builder()
                .field(field("code"))
                .duplicateKey("code")
                .build());
    }
}
