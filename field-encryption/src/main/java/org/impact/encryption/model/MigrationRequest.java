package org.impact.encryption.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MigrationRequest {

    String collection;
    String fieldName;

    @Builder.Default
    int batchSize = 100;

    @Builder.Default
    MigrationCancellation cancellation = MigrationCancellation.none();

    public static MigrationRequest of(String collection, String fieldName, int batchSize) {
        return MigrationRequest.builder()
                .collection(collection)
                .fieldName(fieldName)
                .batchSize(batchSize)
                .build();
    }
}
