package org.impact.encryption.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "impact.encryption")
@Data
public class FieldEncryptionProperties {

    public static final int MIN_PBKDF2_ITERATIONS = 100_000;

    private String keyFile = "/root/.field-encryption-key";
    private String saltFile = "/root/.field-encryption-salt";
    private int pbkdf2Iterations = MIN_PBKDF2_ITERATIONS;

    private Migration migration = new Migration();

    @Data
    public static class Migration {
        private int batchSize = 100;
        private String timestampField = "updated_at";
    }
}
