package org.impact.encryption.model;

import javax.security.auth.Destroyable;
import java.util.Arrays;

/**
 * Raw master secret and salt as read from (or written to) the key files.
 * Held only long enough to derive the working keys, then destroyed.
 */
public final class KeyMaterial implements Destroyable {

    private final byte[] masterSecret;
    private final byte[] salt;
    private final boolean created;
    private volatile boolean destroyed;

    public KeyMaterial(byte[] masterSecret, byte[] salt, boolean created) {
        this.masterSecret = masterSecret.clone();
        this.salt = salt.clone();
        this.created = created;
    }

    public byte[] getMasterSecret() {
        checkNotDestroyed();
        return masterSecret.clone();
    }

    public byte[] getSalt() {
        checkNotDestroyed();
        return salt.clone();
    }

    /**
     * True when this material was generated by the current process (first run).
     */
    public boolean isCreated() {
        return created;
    }

    @Override
    public void destroy() {
        Arrays.fill(masterSecret, (byte) 0);
        Arrays.fill(salt, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "KeyMaterial[REDACTED]";
    }
}
