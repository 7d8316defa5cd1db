package org.impact.encryption.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.service.BlindIndexService;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.data.mongodb.core.query.Query;

import javax.crypto.Mac;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * HMAC-SHA256 blind index generator.
 *
 * The digest covers {@code fieldName:normalizedValue} under the index key, so the
 * same value stored in two different fields produces unrelated hashes and a leaked
 * hash column cannot be dictionary-attacked without the key.
 */
@Slf4j
@RequiredArgsConstructor
public class BlindIndexServiceImpl implements BlindIndexService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final FieldCipherKeys keys;

    @Override
    public String normalize(Object value) {
        if (value == null) {
            return null;
        }
        return WHITESPACE.matcher(String.valueOf(value)).replaceAll("").toLowerCase(Locale.ROOT);
    }

    @Override
    public String generateSearchHash(String fieldName, Object value) {
        SensitiveField field = SensitiveField.require(fieldName);
        String normalized = normalize(value);
        if (normalized == null || normalized.isEmpty()) {
            return null;
        }
        try {
            Mac hmac = Mac.getInstance(FieldCipherKeys.INDEX_ALGORITHM);
            hmac.init(keys.getIndexKey());
            hmac.update(field.getFieldName().getBytes(StandardCharsets.UTF_8));
            hmac.update((byte) ':');
            byte[] digest = hmac.doFinal(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JRE; reaching this means a broken provider
            throw new IllegalStateException("Failed to compute search hash for " + fieldName, e);
        }
    }

    @Override
    public Document createSearchableQuery(String fieldName, Object rawValue) {
        SensitiveField field = SensitiveField.require(fieldName);
        return new Document(field.getHashFieldName(), generateSearchHash(fieldName, rawValue));
    }

    @Override
    public Document createIdentifierSearchQuery(Object searchTerm) {
        List<Document> alternatives = new ArrayList<>();
        for (SensitiveField field : SensitiveField.values()) {
            if (field.isSearchable()) {
                alternatives.add(createSearchableQuery(field.getFieldName(), searchTerm));
            }
        }
        log.debug("Built identifier lookup over {} hash fields", alternatives.size());
        return new Document("$or", alternatives);
    }

    @Override
    public Query toQuery(Document predicate) {
        return new BasicQuery(predicate);
    }
}
