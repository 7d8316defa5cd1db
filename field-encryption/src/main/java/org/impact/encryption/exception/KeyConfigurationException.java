package org.impact.encryption.exception;

import org.impact.encryption.enums.CryptoErrorKind;

/**
 * Exception thrown when key material cannot be created, loaded or derived.
 * Fatal at startup: there is no fallback to an ephemeral key.
 */
public class KeyConfigurationException extends FieldEncryptionException {

    public KeyConfigurationException(CryptoErrorKind kind, String message) {
        super(kind, message);
    }

    public KeyConfigurationException(CryptoErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
