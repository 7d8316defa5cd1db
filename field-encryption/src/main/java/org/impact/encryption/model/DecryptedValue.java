package org.impact.encryption.model;

import lombok.Value;

/**
 * Outcome of decrypting a single field value. Failures are never represented
 * here; they surface as {@link org.impact.encryption.exception.DecryptionException}.
 */
@Value
public class DecryptedValue {

    public enum Source {
        /** null or empty input, returned as given */
        EMPTY,
        /** value had no encryption prefix and was passed through */
        LEGACY_PLAINTEXT,
        /** value was an encryption token and authenticated successfully */
        DECRYPTED
    }

    Object value;
    Source source;

    public static DecryptedValue empty(Object value) {
        return new DecryptedValue(value, Source.EMPTY);
    }

    public static DecryptedValue legacy(Object value) {
        return new DecryptedValue(value, Source.LEGACY_PLAINTEXT);
    }

    public static DecryptedValue decrypted(String value) {
        return new DecryptedValue(value, Source.DECRYPTED);
    }

    public boolean wasEncrypted() {
        return source == Source.DECRYPTED;
    }

    @Override
    public String toString() {
        return "DecryptedValue[source=" + source + ", value=[REDACTED]]";
    }
}
