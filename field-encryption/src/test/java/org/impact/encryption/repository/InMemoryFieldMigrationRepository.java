package org.impact.encryption.repository;

import org.bson.Document;
import org.impact.encryption.model.EncryptedFieldValue;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Single-collection stand-in for MongoDB that mirrors the query semantics of
 * {@link MongoFieldMigrationRepository}: plaintext means "field exists and is not an ENC: string".
 */
public class InMemoryFieldMigrationRepository implements FieldMigrationRepository {

    private final Map<Object, Document> documents = new LinkedHashMap<>();
    private final Set<Object> failingIds = new HashSet<>();
    private final List<String> indexes = new ArrayList<>();
    private final AtomicInteger writes = new AtomicInteger();
    private Runnable afterWrite = () -> { };

    public InMemoryFieldMigrationRepository insert(Document document) {
        documents.put(document.get("_id"), new Document(document));
        return this;
    }

    public Document get(Object id) {
        return documents.get(id);
    }

    public List<Document> all() {
        return new ArrayList<>(documents.values());
    }

    public int getWrites() {
        return writes.get();
    }

    public List<String> getIndexes() {
        return indexes;
    }

    public void failWritesFor(Object id) {
        failingIds.add(id);
    }

    public void afterWrite(Runnable hook) {
        this.afterWrite = hook;
    }

    @Override
    public Flux<Document> findPlaintext(String collection, String fieldName) {
        return Flux.defer(() -> Flux.fromIterable(select(plaintext(fieldName))));
    }

    @Override
    public Flux<Document> findEncrypted(String collection, String fieldName) {
        return Flux.defer(() -> Flux.fromIterable(select(encrypted(fieldName))));
    }

    @Override
    public Mono<Long> countPlaintext(String collection, String fieldName) {
        return Mono.fromCallable(() -> (long) select(plaintext(fieldName)).size());
    }

    @Override
    public Mono<Long> countEncrypted(String collection, String fieldName) {
        return Mono.fromCallable(() -> (long) select(encrypted(fieldName)).size());
    }

    @Override
    public Mono<Boolean> updateIfUnchanged(String collection, Object id, String fieldName, Object expectedValue,
                                           Map<String, Object> updates) {
        return Mono.fromCallable(() -> {
            if (failingIds.contains(id)) {
                throw new IllegalStateException("write rejected for " + id);
            }
            Document stored = documents.get(id);
            if (stored == null || !Objects.equals(stored.get(fieldName), expectedValue)) {
                return false;
            }
            stored.putAll(updates);
            writes.incrementAndGet();
            afterWrite.run();
            return true;
        });
    }

    @Override
    public Mono<String> ensureIndex(String collection, String fieldName) {
        return Mono.fromCallable(() -> {
            indexes.add(fieldName);
            return fieldName;
        });
    }

    private List<Document> select(Predicate<Document> filter) {
        return documents.values().stream()
                .filter(filter)
                .map(Document::new)
                .toList();
    }

    private static Predicate<Document> plaintext(String fieldName) {
        return doc -> doc.containsKey(fieldName) && !EncryptedFieldValue.isEncrypted(doc.get(fieldName));
    }

    private static Predicate<Document> encrypted(String fieldName) {
        return doc -> EncryptedFieldValue.isEncrypted(doc.get(fieldName));
    }
}
