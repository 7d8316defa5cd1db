package org.impact.encryption;

import org.impact.encryption.model.FieldCipherKeys;

import java.util.Arrays;

/**
 * Fixed key handles so service tests skip PBKDF2.
 */
public final class TestCipherKeys {

    private TestCipherKeys() {
    }

    public static FieldCipherKeys primary() {
        return filled((byte) 0x11, (byte) 0x22);
    }

    public static FieldCipherKeys other() {
        return filled((byte) 0x33, (byte) 0x44);
    }

    private static FieldCipherKeys filled(byte encryption, byte index) {
        byte[] encryptionKey = new byte[FieldCipherKeys.KEY_LENGTH];
        byte[] indexKey = new byte[FieldCipherKeys.KEY_LENGTH];
        Arrays.fill(encryptionKey, encryption);
        Arrays.fill(indexKey, index);
        return FieldCipherKeys.fromRawKeys(encryptionKey, indexKey);
    }
}
