package org.impact.encryption.service;

import org.impact.encryption.model.DecryptedValue;

/**
 * Encrypts and decrypts single field values.
 *
 * Uses AES-256-GCM with a random nonce per call. Encrypted values carry the
 * {@code ENC:} prefix so they can be recognised without knowing the schema.
 */
public interface FieldEncryptionService {

    /**
     * Encrypt a field value if it's a sensitive field.
     *
     * @param fieldName Name of the field (e.g. "nhs_number")
     * @param value Value to encrypt; non-string values are converted to their string form
     * @return Encrypted token, or the original value if null, empty, not sensitive or already encrypted
     * @throws org.impact.encryption.exception.EncryptionException if the cipher fails
     */
    Object encryptField(String fieldName, Object value);

    /**
     * Decrypt a field value if it's encrypted.
     *
     * @param fieldName Name of the field, used for error reporting
     * @param value Value to decrypt
     * @return Decrypted string, or the original value if null, empty or not an encryption token
     * @throws org.impact.encryption.exception.DecryptionException if the token is malformed or fails authentication
     */
    Object decryptField(String fieldName, Object value);

    /**
     * Like {@link #decryptField(String, Object)} but tells the caller whether the
     * value was actually decrypted or passed through as legacy plaintext.
     */
    DecryptedValue decryptFieldValue(String fieldName, Object value);

    boolean isEncrypted(Object value);
}
