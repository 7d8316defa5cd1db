package org.impact.encryption.service.impl;

import org.impact.encryption.TestCipherKeys;
import org.impact.encryption.enums.CryptoErrorKind;
import org.impact.encryption.exception.DecryptionException;
import org.impact.encryption.model.FieldCipherKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentEncryptionServiceImplTest {

    private FieldEncryptionServiceImpl fieldEncryptionService;
    private BlindIndexServiceImpl blindIndexService;
    private DocumentEncryptionServiceImpl documentEncryptionService;

    @BeforeEach
    void setUp() {
        FieldCipherKeys keys = TestCipherKeys.primary();
        fieldEncryptionService = new FieldEncryptionServiceImpl(keys);
        blindIndexService = new BlindIndexServiceImpl(keys);
        documentEncryptionService = new DocumentEncryptionServiceImpl(fieldEncryptionService, blindIndexService);
    }

    @Test
    void testEncryptDocument_PatientExample() {
        // Given
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", "9434765919");
        patient.put("name", "John Doe");

        // When
        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);
        Map<String, Object> decrypted = documentEncryptionService.decryptDocument(encrypted);

        // Then
        assertTrue(((String) encrypted.get("nhs_number")).startsWith("ENC:"));
        assertEquals("John Doe", encrypted.get("name"));
        assertEquals(blindIndexService.generateSearchHash("nhs_number", "9434765919"),
                encrypted.get("nhs_number_hash"));
        assertEquals("9434765919", decrypted.get("nhs_number"));
        assertEquals("John Doe", decrypted.get("name"));
    }

    @Test
    void testEncryptDocument_AddsHashesForSearchableFieldsOnly() {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", "943 476 5919");
        patient.put("mrn", "MRN-0042");
        patient.put("postcode", "SW1A 1AA");

        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);

        assertEquals(blindIndexService.generateSearchHash("nhs_number", "9434765919"), encrypted.get("nhs_number_hash"));
        assertEquals(blindIndexService.generateSearchHash("mrn", "MRN-0042"), encrypted.get("mrn_hash"));
        assertFalse(encrypted.containsKey("postcode_hash"));
        assertTrue(fieldEncryptionService.isEncrypted(encrypted.get("postcode")));
    }

    @Test
    void testEncryptDocument_DoesNotMutateInput() {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("mrn", "MRN-0042");

        documentEncryptionService.encryptDocument(patient);

        assertEquals(Map.of("mrn", "MRN-0042"), patient);
    }

    @Test
    void testEncryptDocument_Idempotent() {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", "9434765919");

        Map<String, Object> once = documentEncryptionService.encryptDocument(patient);
        Map<String, Object> twice = documentEncryptionService.encryptDocument(once);

        assertEquals(once, twice);
    }

    @Test
    void testEncryptDocument_NullAndEmptyValues() {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", null);
        patient.put("mrn", "");

        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);

        assertNull(encrypted.get("nhs_number"));
        assertEquals("", encrypted.get("mrn"));
        assertFalse(encrypted.containsKey("nhs_number_hash"));
        assertFalse(encrypted.containsKey("mrn_hash"));
        assertNull(documentEncryptionService.encryptDocument(null));
    }

    @Test
    void testEncryptDocument_IsShallowButDecryptIsRecursive() {
        // Given
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("nhs_number", "9434765919");
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("next_of_kin", nested);

        // When
        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);

        // Then
        assertEquals("9434765919", ((Map<?, ?>) encrypted.get("next_of_kin")).get("nhs_number"));

        // Given a nested ciphertext produced elsewhere
        Map<String, Object> storedNested = new LinkedHashMap<>();
        storedNested.put("nhs_number", fieldEncryptionService.encryptField("nhs_number", "9434765919"));
        storedNested.put("relationship", "spouse");
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("next_of_kin", storedNested);

        // When
        Map<String, Object> decrypted = documentEncryptionService.decryptDocument(stored);

        // Then
        Map<?, ?> decryptedNested = (Map<?, ?>) decrypted.get("next_of_kin");
        assertEquals("9434765919", decryptedNested.get("nhs_number"));
        assertEquals("spouse", decryptedNested.get("relationship"));
    }

    @Test
    void testDecryptDocument_DecryptsTaggedValuesUnderAnyKey() {
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("legacy_identifier", fieldEncryptionService.encryptField("mrn", "MRN-0042"));

        Map<String, Object> decrypted = documentEncryptionService.decryptDocument(stored);

        assertEquals("MRN-0042", decrypted.get("legacy_identifier"));
    }

    @Test
    void testDecryptDocument_ListsPassThrough() {
        Object token = fieldEncryptionService.encryptField("mrn", "MRN-0042");
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("previous_mrns", List.of(token));

        Map<String, Object> decrypted = documentEncryptionService.decryptDocument(stored);

        assertEquals(List.of(token), decrypted.get("previous_mrns"));
    }

    @Test
    void testDecryptDocument_FailsClosedOnTamper() {
        // Given
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", "9434765919");
        patient.put("mrn", "MRN-0042");
        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);
        DocumentEncryptionServiceImpl otherKeyService = new DocumentEncryptionServiceImpl(
                new FieldEncryptionServiceImpl(TestCipherKeys.other()),
                new BlindIndexServiceImpl(TestCipherKeys.other()));

        // When
        DecryptionException e = assertThrows(DecryptionException.class,
                () -> otherKeyService.decryptDocument(encrypted));

        // Then
        assertEquals(CryptoErrorKind.AUTHENTICATION_FAILED, e.getKind());
    }

    @Test
    void testDecryptDocument_LegacyPlaintextPassesThrough() {
        Map<String, Object> legacy = new LinkedHashMap<>();
        legacy.put("nhs_number", "9434765919");
        legacy.put("age", 63);

        assertEquals(legacy, documentEncryptionService.decryptDocument(legacy));
        assertNull(documentEncryptionService.decryptDocument(null));
    }

    @Test
    void testStripSearchHashes() {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("nhs_number", "9434765919");
        patient.put("mrn", "MRN-0042");
        patient.put("name", "John Doe");
        Map<String, Object> encrypted = documentEncryptionService.encryptDocument(patient);

        Map<String, Object> stripped = documentEncryptionService.stripSearchHashes(encrypted);

        assertFalse(stripped.containsKey("nhs_number_hash"));
        assertFalse(stripped.containsKey("mrn_hash"));
        assertEquals(encrypted.get("nhs_number"), stripped.get("nhs_number"));
        assertEquals("John Doe", stripped.get("name"));
        assertTrue(encrypted.containsKey("nhs_number_hash"));
    }
}
