package org.impact.encryption.service;

import java.util.Map;

/**
 * Produces copies of documents that are safe to write to logs and audit trails.
 */
public interface PseudonymizationService {

    String REDACTED = "[REDACTED]";

    /**
     * Shallow copy with every sensitive or PII key replaced by {@value #REDACTED}.
     * Surrogate keys such as internal IDs are kept so log lines stay correlatable.
     */
    Map<String, Object> pseudonymizeForLogging(Map<String, Object> document);
}
