package org.impact.encryption.service.impl;

import org.bson.Document;
import org.impact.encryption.TestCipherKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlindIndexServiceImplTest {

    private BlindIndexServiceImpl blindIndexService;

    @BeforeEach
    void setUp() {
        blindIndexService = new BlindIndexServiceImpl(TestCipherKeys.primary());
    }

    @Test
    void testNormalize_RemovesWhitespaceAndLowercases() {
        assertEquals("9434765919", blindIndexService.normalize(" 943 476\t5919 "));
        assertEquals("mrn-0042", blindIndexService.normalize("MRN - 0042"));
        assertNull(blindIndexService.normalize(null));
    }

    @Test
    void testGenerateSearchHash_NormalizationEquivalence() {
        // Given
        String canonical = blindIndexService.generateSearchHash("nhs_number", "9434765919");

        // When
        String spaced = blindIndexService.generateSearchHash("nhs_number", "943 476 5919");
        String padded = blindIndexService.generateSearchHash("nhs_number", "  9434765919\n");

        // Then
        assertEquals(canonical, spaced);
        assertEquals(canonical, padded);
    }

    @Test
    void testGenerateSearchHash_CaseInsensitive() {
        assertEquals(blindIndexService.generateSearchHash("mrn", "ab12cd"),
                blindIndexService.generateSearchHash("mrn", "AB12CD"));
    }

    @Test
    void testGenerateSearchHash_DeterministicHex() {
        String first = blindIndexService.generateSearchHash("mrn", "MRN-0042");
        String second = blindIndexService.generateSearchHash("mrn", "MRN-0042");

        assertEquals(first, second);
        assertEquals(64, first.length());
        assertTrue(first.matches("[0-9a-f]{64}"));
    }

    @Test
    void testGenerateSearchHash_BoundToFieldName() {
        assertNotEquals(blindIndexService.generateSearchHash("nhs_number", "12345"),
                blindIndexService.generateSearchHash("mrn", "12345"));
    }

    @Test
    void testGenerateSearchHash_DependsOnKey() {
        BlindIndexServiceImpl otherService = new BlindIndexServiceImpl(TestCipherKeys.other());

        assertNotEquals(blindIndexService.generateSearchHash("mrn", "12345"),
                otherService.generateSearchHash("mrn", "12345"));
    }

    @Test
    void testGenerateSearchHash_EmptyInputs() {
        assertNull(blindIndexService.generateSearchHash("nhs_number", null));
        assertNull(blindIndexService.generateSearchHash("nhs_number", ""));
        assertNull(blindIndexService.generateSearchHash("nhs_number", "   "));
    }

    @Test
    void testGenerateSearchHash_UnregisteredField() {
        assertThrows(IllegalArgumentException.class, () -> blindIndexService.generateSearchHash("email", "a@b.c"));
    }

    @Test
    void testCreateSearchableQuery() {
        Document query = blindIndexService.createSearchableQuery("nhs_number", "943 476 5919");

        assertEquals(1, query.size());
        assertEquals(blindIndexService.generateSearchHash("nhs_number", "9434765919"), query.get("nhs_number_hash"));
    }

    @Test
    void testCreateIdentifierSearchQuery_MatchesEitherIdentifier() {
        // When
        Document query = blindIndexService.createIdentifierSearchQuery("A1234");

        // Then
        List<?> alternatives = query.get("$or", List.class);
        assertEquals(2, alternatives.size());
        assertEquals(new Document("nhs_number_hash", blindIndexService.generateSearchHash("nhs_number", "A1234")),
                alternatives.get(0));
        assertEquals(new Document("mrn_hash", blindIndexService.generateSearchHash("mrn", "A1234")),
                alternatives.get(1));
    }

    @Test
    void testToQuery() {
        Document predicate = blindIndexService.createSearchableQuery("mrn", "MRN-0042");

        Query query = blindIndexService.toQuery(predicate);

        assertEquals(predicate, query.getQueryObject());
    }
}
