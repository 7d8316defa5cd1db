package org.impact.encryption.config;

import lombok.extern.slf4j.Slf4j;
import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.repository.FieldMigrationRepository;
import org.impact.encryption.repository.MongoFieldMigrationRepository;
import org.impact.encryption.service.BlindIndexService;
import org.impact.encryption.service.DocumentEncryptionService;
import org.impact.encryption.service.FieldEncryptionService;
import org.impact.encryption.service.KeyManagerService;
import org.impact.encryption.service.MigrationService;
import org.impact.encryption.service.PseudonymizationService;
import org.impact.encryption.service.impl.BlindIndexServiceImpl;
import org.impact.encryption.service.impl.DocumentEncryptionServiceImpl;
import org.impact.encryption.service.impl.FieldEncryptionServiceImpl;
import org.impact.encryption.service.impl.FileKeyManagerServiceImpl;
import org.impact.encryption.service.impl.MigrationServiceImpl;
import org.impact.encryption.service.impl.PseudonymizationServiceImpl;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.mongo.MongoReactiveDataAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

import java.time.Clock;

/**
 * Wires the field encryption services into a host application.
 * The cipher keys are resolved while the context starts, so missing or corrupt
 * key material keeps the application from coming up at all.
 */
@AutoConfiguration(after = MongoReactiveDataAutoConfiguration.class)
@EnableConfigurationProperties(FieldEncryptionProperties.class)
@Slf4j
public class FieldEncryptionConfig {

    @Bean
    @ConditionalOnMissingBean
    public KeyManagerService keyManagerService(FieldEncryptionProperties properties) {
        log.info("Field encryption key file: {}, salt file: {}", properties.getKeyFile(), properties.getSaltFile());
        return new FileKeyManagerServiceImpl(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldCipherKeys fieldCipherKeys(KeyManagerService keyManagerService) {
        return keyManagerService.getCipher();
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldEncryptionService fieldEncryptionService(FieldCipherKeys fieldCipherKeys) {
        return new FieldEncryptionServiceImpl(fieldCipherKeys);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlindIndexService blindIndexService(FieldCipherKeys fieldCipherKeys) {
        return new BlindIndexServiceImpl(fieldCipherKeys);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentEncryptionService documentEncryptionService(FieldEncryptionService fieldEncryptionService,
                                                               BlindIndexService blindIndexService) {
        return new DocumentEncryptionServiceImpl(fieldEncryptionService, blindIndexService);
    }

    @Bean
    @ConditionalOnMissingBean
    public PseudonymizationService pseudonymizationService() {
        return new PseudonymizationServiceImpl();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(ReactiveMongoTemplate.class)
    static class MigrationConfig {

        @Bean
        @ConditionalOnMissingBean
        public FieldMigrationRepository fieldMigrationRepository(ReactiveMongoTemplate reactiveMongoTemplate) {
            return new MongoFieldMigrationRepository(reactiveMongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public MigrationService migrationService(FieldMigrationRepository fieldMigrationRepository,
                                                 FieldEncryptionService fieldEncryptionService,
                                                 BlindIndexService blindIndexService,
                                                 FieldEncryptionProperties properties) {
            return new MigrationServiceImpl(fieldMigrationRepository, fieldEncryptionService, blindIndexService,
                    properties.getMigration().getTimestampField(), Clock.systemUTC());
        }
    }
}
