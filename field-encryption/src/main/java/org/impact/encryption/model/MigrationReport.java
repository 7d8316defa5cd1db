package org.impact.encryption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.impact.encryption.enums.MigrationDirection;

import java.time.Instant;

/**
 * Summary of one migration pass over a single collection field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationReport {

    private MigrationDirection direction;
    private String collection;
    private String fieldName;

    private long candidates;       // documents selected for this pass
    private long migrated;         // documents written by this pass
    private long alreadyMigrated;  // documents already in the target representation
    private long skipped;          // null or empty values
    private long failed;
    private long batches;
    private boolean cancelled;

    private Instant startedAt;
    private Instant completedAt;

    public boolean hasFailures() {
        return failed > 0;
    }
}
