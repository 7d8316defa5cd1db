package org.impact.encryption.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.exception.DecryptionException;
import org.impact.encryption.service.BlindIndexService;
import org.impact.encryption.service.DocumentEncryptionService;
import org.impact.encryption.service.FieldEncryptionService;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class DocumentEncryptionServiceImpl implements DocumentEncryptionService {

    private final FieldEncryptionService fieldEncryptionService;
    private final BlindIndexService blindIndexService;

    @Override
    public Map<String, Object> encryptDocument(Map<String, Object> document) {
        if (document == null) {
            return null;
        }

        Map<String, Object> encrypted = new LinkedHashMap<>(document);

        for (SensitiveField field : SensitiveField.values()) {
            String fieldName = field.getFieldName();
            if (!encrypted.containsKey(fieldName)) {
                continue;
            }
            Object value = encrypted.get(fieldName);

            // hash has to come from plaintext; an already encrypted value keeps its stored hash
            if (field.isSearchable() && !fieldEncryptionService.isEncrypted(value)) {
                String hash = blindIndexService.generateSearchHash(fieldName, value);
                if (hash != null) {
                    encrypted.put(field.getHashFieldName(), hash);
                }
            }
            encrypted.put(fieldName, fieldEncryptionService.encryptField(fieldName, value));
        }

        return encrypted;
    }

    @Override
    public Map<String, Object> decryptDocument(Map<String, Object> document) {
        if (document == null) {
            return null;
        }

        Map<String, Object> decrypted = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String fieldName = entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map<?, ?> nested) {
                decrypted.put(fieldName, decryptDocument(asDocument(nested)));
            } else if (fieldEncryptionService.isEncrypted(value)) {
                try {
                    decrypted.put(fieldName, fieldEncryptionService.decryptField(fieldName, value));
                } catch (DecryptionException e) {
                    log.error("Aborting document decryption: field {} failed ({})", fieldName, e.getKind());
                    throw e;
                }
            } else {
                decrypted.put(fieldName, value);
            }
        }

        return decrypted;
    }

    @Override
    public Map<String, Object> stripSearchHashes(Map<String, Object> document) {
        if (document == null) {
            return null;
        }
        Map<String, Object> stripped = new LinkedHashMap<>(document);
        for (SensitiveField field : SensitiveField.values()) {
            stripped.remove(field.getHashFieldName());
        }
        return stripped;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asDocument(Map<?, ?> nested) {
        return (Map<String, Object>) nested;
    }
}
