package org.impact.encryption.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.impact.encryption.enums.CryptoErrorKind;
import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.exception.DecryptionException;
import org.impact.encryption.exception.EncryptionException;
import org.impact.encryption.model.DecryptedValue;
import org.impact.encryption.model.EncryptedFieldValue;
import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.service.FieldEncryptionService;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Date;

import static org.impact.encryption.model.EncryptedFieldValue.GCM_IV_LENGTH;
import static org.impact.encryption.model.EncryptedFieldValue.GCM_TAG_LENGTH;
import static org.impact.encryption.model.EncryptedFieldValue.VERSION_AES_GCM;

@Slf4j
@RequiredArgsConstructor
public class FieldEncryptionServiceImpl implements FieldEncryptionService {

    private static final String ALGORITHM = "AES/GCM/NoPadding";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final FieldCipherKeys keys;

    @Override
    public Object encryptField(String fieldName, Object value) {
        // Skip if null or empty
        if (isEmpty(value)) {
            return value;
        }

        // Only encrypt designated sensitive fields
        if (!SensitiveField.isSensitive(fieldName)) {
            return value;
        }

        if (isEncrypted(value)) {
            log.debug("Field {} already encrypted", fieldName);
            return value;
        }

        byte[] plaintext = stringify(fieldName, value).getBytes(StandardCharsets.UTF_8);
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            SECURE_RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keys.getEncryptionKey(), new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encrypted = cipher.doFinal(plaintext);

            // version | iv | ciphertext+tag
            byte[] payload = ByteBuffer.allocate(1 + iv.length + encrypted.length)
                    .put(VERSION_AES_GCM)
                    .put(iv)
                    .put(encrypted)
                    .array();

            log.debug("Encrypted field: {}", fieldName);
            return EncryptedFieldValue.wrap(payload);
        } catch (GeneralSecurityException e) {
            log.error("Failed to encrypt field {}: {}", fieldName, e.getClass().getSimpleName());
            throw new EncryptionException(CryptoErrorKind.CIPHER_FAILURE, fieldName, e);
        }
    }

    @Override
    public Object decryptField(String fieldName, Object value) {
        return decryptFieldValue(fieldName, value).getValue();
    }

    @Override
    public DecryptedValue decryptFieldValue(String fieldName, Object value) {
        if (isEmpty(value)) {
            return DecryptedValue.empty(value);
        }
        if (!isEncrypted(value)) {
            return DecryptedValue.legacy(value);
        }

        byte[] payload = EncryptedFieldValue.unwrap(fieldName, (String) value);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            GCMParameterSpec spec = new GCMParameterSpec(GCM_TAG_LENGTH * 8, payload, 1, GCM_IV_LENGTH);
            cipher.init(Cipher.DECRYPT_MODE, keys.getEncryptionKey(), spec);

            int offset = 1 + GCM_IV_LENGTH;
            byte[] decrypted = cipher.doFinal(payload, offset, payload.length - offset);

            log.debug("Decrypted field: {}", fieldName);
            return DecryptedValue.decrypted(decodeUtf8(fieldName, decrypted));
        } catch (AEADBadTagException e) {
            log.error("Invalid token when decrypting {}", fieldName);
            throw new DecryptionException(CryptoErrorKind.AUTHENTICATION_FAILED, fieldName, e);
        } catch (GeneralSecurityException e) {
            log.error("Failed to decrypt field {}: {}", fieldName, e.getClass().getSimpleName());
            throw new DecryptionException(CryptoErrorKind.AUTHENTICATION_FAILED, fieldName, e);
        }
    }

    @Override
    public boolean isEncrypted(Object value) {
        return EncryptedFieldValue.isEncrypted(value);
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence cs && cs.length() == 0);
    }

    private static String stringify(String fieldName, Object value) {
        try {
            if (value instanceof CharSequence cs) {
                return cs.toString();
            }
            if (value instanceof Date date) {
                return date.toInstant().toString();
            }
            return String.valueOf(value);
        } catch (RuntimeException e) {
            throw new EncryptionException(CryptoErrorKind.ENCODING_FAILURE, fieldName, e);
        }
    }

    private static String decodeUtf8(String fieldName, byte[] bytes) {
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new DecryptionException(CryptoErrorKind.MALFORMED_TOKEN, fieldName, e);
        }
    }
}
