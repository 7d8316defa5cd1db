package org.impact.encryption.service;

import org.bson.Document;
import org.springframework.data.mongodb.core.query.Query;

/**
 * Deterministic keyed hashes ("blind indexes") of normalized plaintext, stored
 * beside the ciphertext in {@code <field>_hash} so encrypted fields can be found
 * by exact value without decrypting the collection.
 *
 * Only exact matches after normalization are supported; there is no prefix or fuzzy search.
 */
public interface BlindIndexService {

    /**
     * Remove all whitespace and lowercase, so "123 456 7890" and "1234567890" match.
     */
    String normalize(Object value);

    /**
     * @return lowercase hex HMAC-SHA256 of the normalized value, or null for null/blank values
     * @throws IllegalArgumentException if the field is not a registered sensitive field
     */
    String generateSearchHash(String fieldName, Object value);

    /**
     * Equality predicate on the hash field, e.g. {@code {"nhs_number_hash": "..."}}.
     */
    Document createSearchableQuery(String fieldName, Object rawValue);

    /**
     * Predicate matching the search term against every searchable field,
     * e.g. NHS number or MRN: {@code {"$or": [{"nhs_number_hash": ...}, {"mrn_hash": ...}]}}.
     */
    Document createIdentifierSearchQuery(Object searchTerm);

    Query toQuery(Document predicate);
}
