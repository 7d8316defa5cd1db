package org.impact.encryption.service.impl;

import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.service.PseudonymizationService;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class PseudonymizationServiceImpl implements PseudonymizationService {

    // general PII aliases that are not encrypted but must never reach a log
    private static final Set<String> PII_FIELDS = Set.of("name", "first_name", "last_name", "address", "phone", "email");

    private static final Set<String> REDACTED_FIELDS;

    static {
        Set<String> fields = new LinkedHashSet<>();
        for (SensitiveField field : SensitiveField.values()) {
            fields.add(field.getFieldName());
        }
        fields.addAll(PII_FIELDS);
        REDACTED_FIELDS = Set.copyOf(fields);
    }

    @Override
    public Map<String, Object> pseudonymizeForLogging(Map<String, Object> document) {
        if (document == null) {
            return null;
        }
        Map<String, Object> safe = new LinkedHashMap<>(document);
        for (String field : REDACTED_FIELDS) {
            if (safe.containsKey(field)) {
                safe.put(field, REDACTED);
            }
        }
        return safe;
    }
}
