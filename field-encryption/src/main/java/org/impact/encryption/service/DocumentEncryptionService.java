package org.impact.encryption.service;

import java.util.Map;

/**
 * Applies field encryption to whole MongoDB documents.
 *
 * Encryption is shallow (top-level sensitive keys only) while decryption is
 * recursive and keyed on the value prefix. Stored data depends on this asymmetry.
 */
public interface DocumentEncryptionService {

    /**
     * Encrypt all top-level sensitive fields and add {@code <field>_hash} for searchable ones.
     * Nested documents are not touched. The input map is not modified.
     *
     * @param document Document to encrypt, may be null
     * @return New document with encrypted fields
     */
    Map<String, Object> encryptDocument(Map<String, Object> document);

    /**
     * Decrypt every encrypted value at any depth of nested maps, whatever its key.
     * Fails as a whole if any single value cannot be decrypted.
     *
     * @param document Document to decrypt, may be null
     * @return New document with decrypted fields
     * @throws org.impact.encryption.exception.DecryptionException if any value fails to decrypt
     */
    Map<String, Object> decryptDocument(Map<String, Object> document);

    /**
     * Copy of the document without the top-level {@code <field>_hash} siblings.
     */
    Map<String, Object> stripSearchHashes(Map<String, Object> document);
}
