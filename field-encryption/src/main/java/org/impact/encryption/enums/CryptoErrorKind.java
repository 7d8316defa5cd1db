package org.impact.encryption.enums;

public enum CryptoErrorKind {
    // write path
    ENCODING_FAILURE,
    CIPHER_FAILURE,

    // read path
    MALFORMED_TOKEN,
    UNSUPPORTED_VERSION,
    AUTHENTICATION_FAILED,

    // startup
    KEY_MATERIAL_MISSING,
    KEY_MATERIAL_CORRUPT,
    KEY_MATERIAL_UNWRITABLE,
    INVALID_KDF_PARAMETERS
}
