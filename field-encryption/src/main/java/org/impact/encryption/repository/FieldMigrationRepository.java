package org.impact.encryption.repository;

import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Document store operations needed to migrate one field of a collection
 * between plaintext and encrypted representations.
 */
public interface FieldMigrationRepository {

    /**
     * Documents where the field exists and does not carry the encryption prefix.
     */
    Flux<Document> findPlaintext(String collection, String fieldName);

    /**
     * Documents where the field carries the encryption prefix.
     */
    Flux<Document> findEncrypted(String collection, String fieldName);

    Mono<Long> countPlaintext(String collection, String fieldName);

    Mono<Long> countEncrypted(String collection, String fieldName);

    /**
     * Apply {@code $set} to the document with the given id, but only while
     * {@code fieldName} still holds {@code expectedValue}.
     *
     * @return true if the document was modified
     */
    Mono<Boolean> updateIfUnchanged(String collection, Object id, String fieldName, Object expectedValue,
                                    Map<String, Object> updates);

    /**
     * Ascending index on the given field, returns the index name.
     */
    Mono<String> ensureIndex(String collection, String fieldName);
}
