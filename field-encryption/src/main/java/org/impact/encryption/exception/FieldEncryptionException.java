package org.impact.encryption.exception;

import lombok.Getter;
import org.impact.encryption.enums.CryptoErrorKind;

/**
 * Base type for every failure raised by the field encryption library.
 * The {@link CryptoErrorKind} tells callers what went wrong without parsing messages.
 */
@Getter
public abstract class FieldEncryptionException extends RuntimeException {

    private final CryptoErrorKind kind;

    protected FieldEncryptionException(CryptoErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FieldEncryptionException(CryptoErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
