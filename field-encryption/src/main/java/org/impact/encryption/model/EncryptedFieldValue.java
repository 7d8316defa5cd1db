package org.impact.encryption.model;

import org.impact.encryption.enums.CryptoErrorKind;
import org.impact.encryption.exception.DecryptionException;

import java.util.Base64;

/**
 * Wire format of an encrypted field: {@code "ENC:" + base64url(payload)}.
 *
 * Payload layout: version (1 byte) | nonce (12 bytes) | ciphertext | GCM tag (16 bytes).
 */
public final class EncryptedFieldValue {

    public static final String PREFIX = "ENC:";
    public static final String PREFIX_REGEX = "^" + PREFIX;

    public static final byte VERSION_AES_GCM = 0x01;
    public static final int GCM_IV_LENGTH = 12; // 96 bits for GCM
    public static final int GCM_TAG_LENGTH = 16; // 128 bits
    public static final int MIN_PAYLOAD_LENGTH = 1 + GCM_IV_LENGTH + GCM_TAG_LENGTH;

    private EncryptedFieldValue() {
    }

    public static boolean isEncrypted(Object value) {
        return value instanceof String s && s.startsWith(PREFIX);
    }

    public static String wrap(byte[] payload) {
        return PREFIX + Base64.getUrlEncoder().encodeToString(payload);
    }

    /**
     * Strips the prefix and decodes the payload, checking only its shape.
     */
    public static byte[] unwrap(String fieldName, String token) {
        if (!isEncrypted(token)) {
            throw new DecryptionException(CryptoErrorKind.MALFORMED_TOKEN, fieldName);
        }
        byte[] payload;
        try {
            payload = Base64.getUrlDecoder().decode(token.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new DecryptionException(CryptoErrorKind.MALFORMED_TOKEN, fieldName, e);
        }
        if (payload.length < MIN_PAYLOAD_LENGTH) {
            throw new DecryptionException(CryptoErrorKind.MALFORMED_TOKEN, fieldName);
        }
        if (payload[0] != VERSION_AES_GCM) {
            throw new DecryptionException(CryptoErrorKind.UNSUPPORTED_VERSION, fieldName);
        }
        return payload;
    }
}
