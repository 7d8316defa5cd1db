package org.impact.encryption.exception;

import lombok.Getter;
import org.impact.encryption.enums.CryptoErrorKind;

/**
 * Exception thrown when an encrypted field value cannot be decrypted.
 * Never accompanied by a partial or substitute plaintext.
 */
@Getter
public class DecryptionException extends FieldEncryptionException {

    private final String fieldName;

    public DecryptionException(CryptoErrorKind kind, String fieldName) {
        super(kind, message(kind, fieldName));
        this.fieldName = fieldName;
    }

    public DecryptionException(CryptoErrorKind kind, String fieldName, Throwable cause) {
        super(kind, message(kind, fieldName), cause);
        this.fieldName = fieldName;
    }

    private static String message(CryptoErrorKind kind, String fieldName) {
        return switch (kind) {
            case AUTHENTICATION_FAILED -> String.format("Invalid encryption token for %s", fieldName);
            case MALFORMED_TOKEN -> String.format("Malformed encryption token for %s", fieldName);
            case UNSUPPORTED_VERSION -> String.format("Unsupported encryption token version for %s", fieldName);
            default -> String.format("Failed to decrypt %s", fieldName);
        };
    }
}
