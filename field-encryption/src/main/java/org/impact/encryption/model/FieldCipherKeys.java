package org.impact.encryption.model;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.util.Objects;

/**
 * Process-wide cipher handle: the AES-256 field encryption key and the
 * separate HMAC key used for blind indexes.
 *
 * Built once at startup by the key manager and passed to every service
 * that encrypts, decrypts or hashes. Immutable and safe to share across threads.
 */
public final class FieldCipherKeys {

    public static final String ENCRYPTION_ALGORITHM = "AES";
    public static final String INDEX_ALGORITHM = "HmacSHA256";
    public static final int KEY_LENGTH = 32; // 256 bits

    private final SecretKey encryptionKey;
    private final SecretKey indexKey;

    public FieldCipherKeys(SecretKey encryptionKey, SecretKey indexKey) {
        this.encryptionKey = Objects.requireNonNull(encryptionKey, "encryptionKey");
        this.indexKey = Objects.requireNonNull(indexKey, "indexKey");
    }

    /**
     * Builds a handle straight from raw key bytes, e.g. for tests or tooling
     * that manages its own key material.
     */
    public static FieldCipherKeys fromRawKeys(byte[] encryptionKey, byte[] indexKey) {
        if (encryptionKey == null || encryptionKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Encryption key must be " + KEY_LENGTH + " bytes");
        }
        if (indexKey == null || indexKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Index key must be " + KEY_LENGTH + " bytes");
        }
        return new FieldCipherKeys(
                new SecretKeySpec(encryptionKey, ENCRYPTION_ALGORITHM),
                new SecretKeySpec(indexKey, INDEX_ALGORITHM));
    }

    public SecretKey getEncryptionKey() {
        return encryptionKey;
    }

    public SecretKey getIndexKey() {
        return indexKey;
    }

    @Override
    public String toString() {
        return "FieldCipherKeys[REDACTED]";
    }
}
