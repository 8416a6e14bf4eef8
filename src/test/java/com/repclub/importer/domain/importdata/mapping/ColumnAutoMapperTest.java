package com.repclub.importer.domain.importdata.mapping;

import com.repclub.importer.domain.common.enums.FieldType;
import com.repclub.importer.domain.importdata.model.ImportFieldConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ColumnAutoMapperTest {

    private ColumnAutoMapper autoMapper;
    private ImportFieldConfig email;
    private ImportFieldConfig firstName;
    private ImportFieldConfig phone;

    @BeforeEach
    void setUp() {
        autoMapper = new ColumnAutoMapper();
        email = ImportFieldConfig.builder().name("email").label("Email").type(FieldType.EMAIL).build();
        firstName = ImportFieldConfig.builder().name("first_name").label("First Name").build();
        phone = ImportFieldConfig.builder().name("phone").label("Phone").type(FieldType.PHONE).build();
    }

    @Test
    void normalize_RemovesCaseAndPunctuation() {
        assertEquals("emailaddress", ColumnNormalizer.normalize("E-mail Address"));
        assertEquals("firstname", ColumnNormalizer.normalize("  First_Name "));
        assertEquals("", ColumnNormalizer.normalize(null));
        assertTrue(ColumnNormalizer.sameColumn("First Name", "first_name"));
    }

    @Test
    void autoMap_ExactNameOrLabel_MapsColumn() {
        Map<String, String> mapping = autoMapper.autoMap(List.of("EMAIL", "First Name"), List.of(email, firstName));

        assertEquals("email", mapping.get("EMAIL"));
        assertEquals("first_name", mapping.get("First Name"));
    }

    @Test
    void autoMap_WeakContainment_LeavesColumnUnmapped() {
        Map<String, String> mapping = autoMapper.autoMap(List.of("E-mail Address"), List.of(email));

        assertTrue(mapping.containsKey("E-mail Address"));
        assertNull(mapping.get("E-mail Address"));
        assertEquals(5.0 / 12 * 0.8, autoMapper.score("E-mail Address", email), 1e-9);
    }

    @Test
    void autoMap_StrongContainment_MapsColumn() {
        Map<String, String> mapping = autoMapper.autoMap(List.of("Phone No"), List.of(phone));

        assertEquals("phone", mapping.get("Phone No"));
        assertEquals(5.0 / 7 * 0.8, autoMapper.score("Phone No", phone), 1e-9);
    }

    @Test
    void autoMap_BetterLaterColumn_WinsField() {
        Map<String, String> mapping = autoMapper.autoMap(List.of("Emails", "Email"), List.of(email));

        assertNull(mapping.get("Emails"));
        assertEquals("email", mapping.get("Email"));
    }

    @Test
    void autoMap_EqualScores_EarlierColumnWins() {
        Map<String, String> mapping = autoMapper.autoMap(List.of("Email", "email"), List.of(email));

        assertEquals("email", mapping.get("Email"));
        assertNull(mapping.get("email"));
    }

    @Test
    void autoMap_EqualScores_EarlierDeclaredFieldWins() {
        ImportFieldConfig mobile = ImportFieldConfig.builder().name("mobile").label("Phone").build();
        ImportFieldConfig homePhone = ImportFieldConfig.builder().name("phone").label("Home Phone").build();

        Map<String, String> mapping = autoMapper.autoMap(List.of("Phone"), List.of(mobile, homePhone));

        assertEquals("mobile", mapping.get("Phone"));
    }

    @Test
    void autoMap_EveryColumnPresentInSourceOrder() {
        Map<String, String> mapping = autoMapper.autoMap(
                List.of("Notes", "Phone", "Email"), List.of(email, firstName, phone));

        assertEquals(List.of("Notes", "Phone", "Email"), List.copyOf(mapping.keySet()));
        assertNull(mapping.get("Notes"));
        assertEquals("phone", mapping.get("Phone"));
        assertEquals("email", mapping.get("Email"));
    }

    @Test
    void autoMap_NoFieldReceivesTwoColumns() {
        Map<String, String> mapping = autoMapper.autoMap(
                List.of("first name", "First_Name", "FIRSTNAME"), List.of(firstName));

        long mapped = mapping.values().stream().filter("first_name"::equals).count();
        assertEquals(1, mapped);
        assertEquals("first_name", mapping.get("first name"));
    }

    @Test
    void score_BlankColumn_IsZero() {
        assertEquals(0.0, autoMapper.score("  ", email));
        assertEquals(0.0, autoMapper.score("Birthday", email));
    }
}
