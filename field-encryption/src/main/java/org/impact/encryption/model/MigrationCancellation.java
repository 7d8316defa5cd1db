package org.impact.encryption.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for migration runs, checked between batches.
 */
public final class MigrationCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static MigrationCancellation none() {
        return new MigrationCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
