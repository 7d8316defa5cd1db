package org.impact.encryption.enums;

import lombok.Getter;

@Getter
public enum MigrationDirection {
    ENCRYPT("encrypted"),
    DECRYPT("decrypted"),
    REHASH("rehashed");

    private final String pastTense;

    MigrationDirection(String pastTense) {
        this.pastTense = pastTense;
    }
}
