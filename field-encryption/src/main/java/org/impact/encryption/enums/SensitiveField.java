package org.impact.encryption.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of patient fields that are encrypted at rest.
 *
 * Direct identifiers, personal identifiers, sensitive dates and geographic
 * identifiers (UK GDPR Article 32 + Caldicott Principles). Searchable fields
 * get a sibling {@code <field>_hash} blind index when a document is encrypted.
 */
@Getter
public enum SensitiveField {

    NHS_NUMBER("nhs_number", true),
    MRN("mrn", true),
    HOSPITAL_NUMBER("hospital_number", false),
    FIRST_NAME("first_name", false),
    LAST_NAME("last_name", false),
    DATE_OF_BIRTH("date_of_birth", false),
    DECEASED_DATE("deceased_date", false),
    POSTCODE("postcode", false);

    public static final String HASH_SUFFIX = "_hash";

    private static final Map<String, SensitiveField> BY_FIELD_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(SensitiveField::getFieldName, Function.identity())));

    private final String fieldName;
    private final boolean searchable;

    SensitiveField(String fieldName, boolean searchable) {
        this.fieldName = fieldName;
        this.searchable = searchable;
    }

    /**
     * Name of the sibling field holding the blind index for this field.
     */
    public String getHashFieldName() {
        return fieldName + HASH_SUFFIX;
    }

    public static Optional<SensitiveField> fromFieldName(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_FIELD_NAME.get(fieldName));
    }

    /**
     * Same as {@link #fromFieldName(String)} but rejects unregistered names.
     */
    public static SensitiveField require(String fieldName) {
        return fromFieldName(fieldName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Field " + fieldName + " is not designated as encrypted"));
    }

    /**
     * Same as {@link #require(String)} but also rejects fields without a blind index.
     */
    public static SensitiveField requireSearchable(String fieldName) {
        SensitiveField field = require(fieldName);
        if (!field.isSearchable()) {
            throw new IllegalArgumentException("Field " + fieldName + " is not searchable");
        }
        return field;
    }

    public static boolean isSensitive(String fieldName) {
        return fromFieldName(fieldName).isPresent();
    }
}
