package org.impact.encryption.service;

import org.impact.encryption.model.MigrationReport;
import org.impact.encryption.model.MigrationRequest;
import reactor.core.publisher.Mono;

/**
 * Retrofits existing collections to (or back from) encrypted fields.
 *
 * Every pass is idempotent: documents already in the target representation are
 * skipped, so re-running after an interruption only touches what is left.
 * Failures on single documents are counted and logged, never fatal to the pass.
 */
public interface MigrationService {

    /**
     * Encrypt a plaintext field across a collection.
     *
     * @param collection Collection name (e.g. "patients")
     * @param fieldName Registered sensitive field to encrypt
     * @param batchSize Number of documents to process per batch
     */
    Mono<MigrationReport> migrateToEncrypted(String collection, String fieldName, int batchSize);

    Mono<MigrationReport> migrateToEncrypted(MigrationRequest request);

    /**
     * Rollback: decrypt an encrypted field across a collection.
     * WARNING: reduces security, only for testing or rollback.
     */
    Mono<MigrationReport> migrateFromEncrypted(String collection, String fieldName, int batchSize);

    Mono<MigrationReport> migrateFromEncrypted(MigrationRequest request);

    /**
     * Recompute {@code <field>_hash} from the decrypted value with the current
     * normalization. Only the hash field is written; ciphertext is left as is.
     */
    Mono<MigrationReport> rehashSearchField(String collection, String fieldName, int batchSize);

    Mono<MigrationReport> rehashSearchField(MigrationRequest request);

    /**
     * Create the ascending index on {@code <field>_hash}.
     *
     * @return index name
     */
    Mono<String> ensureSearchHashIndex(String collection, String fieldName);
}
