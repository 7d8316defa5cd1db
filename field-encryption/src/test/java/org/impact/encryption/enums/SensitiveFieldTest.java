package org.impact.encryption.enums;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SensitiveFieldTest {

    @Test
    void testRegistry_ContainsPatientIdentifiers() {
        List<String> names = Arrays.stream(SensitiveField.values()).map(SensitiveField::getFieldName).toList();

        assertEquals(List.of("nhs_number", "mrn", "hospital_number", "first_name", "last_name",
                "date_of_birth", "deceased_date", "postcode"), names);
    }

    @Test
    void testSearchable_OnlyNhsNumberAndMrn() {
        List<SensitiveField> searchable = Arrays.stream(SensitiveField.values())
                .filter(SensitiveField::isSearchable)
                .toList();

        assertEquals(List.of(SensitiveField.NHS_NUMBER, SensitiveField.MRN), searchable);
    }

    @Test
    void testGetHashFieldName() {
        assertEquals("nhs_number_hash", SensitiveField.NHS_NUMBER.getHashFieldName());
        assertEquals("mrn_hash", SensitiveField.MRN.getHashFieldName());
    }

    @Test
    void testFromFieldName_UnknownAndNull() {
        assertTrue(SensitiveField.fromFieldName("postcode").isPresent());
        assertTrue(SensitiveField.fromFieldName("name").isEmpty());
        assertTrue(SensitiveField.fromFieldName(null).isEmpty());
        assertFalse(SensitiveField.isSensitive("NHS_NUMBER"));
    }

    @Test
    void testRequire_RejectsUnregisteredField() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SensitiveField.require("email"));

        assertEquals("Field email is not designated as encrypted", e.getMessage());
    }

    @Test
    void testRequireSearchable() {
        assertEquals(SensitiveField.MRN, SensitiveField.requireSearchable("mrn"));

        IllegalArgumentException notSearchable = assertThrows(IllegalArgumentException.class,
                () -> SensitiveField.requireSearchable("first_name"));
        IllegalArgumentException unknown = assertThrows(IllegalArgumentException.class,
                () -> SensitiveField.requireSearchable("email"));

        assertEquals("Field first_name is not searchable", notSearchable.getMessage());
        assertEquals("Field email is not designated as encrypted", unknown.getMessage());
    }
}
