package org.impact.encryption.service;

import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.model.KeyMaterial;

import javax.crypto.SecretKey;

/**
 * Owns the master secret and salt and derives the working keys from them.
 */
public interface KeyManagerService {

    /**
     * Load the master secret and salt, creating both on first run.
     *
     * @return freshly read key material; the caller destroys it after use
     * @throws org.impact.encryption.exception.KeyConfigurationException if the
     *         files cannot be read, written or are corrupt
     */
    KeyMaterial initialize();

    /**
     * PBKDF2-HMAC-SHA256 over the master secret and salt, 32-byte output.
     */
    SecretKey deriveKey(KeyMaterial keyMaterial);

    /**
     * The process-wide cipher handle. Initialized exactly once, on first call.
     */
    FieldCipherKeys getCipher();
}
