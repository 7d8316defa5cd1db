package org.impact.encryption.exception;

import lombok.Getter;
import org.impact.encryption.enums.CryptoErrorKind;

/**
 * Exception thrown when a sensitive field value cannot be encrypted
 */
@Getter
public class EncryptionException extends FieldEncryptionException {

    private final String fieldName;

    public EncryptionException(CryptoErrorKind kind, String fieldName, Throwable cause) {
        super(kind, String.format("Failed to encrypt %s", fieldName), cause);
        this.fieldName = fieldName;
    }
}
