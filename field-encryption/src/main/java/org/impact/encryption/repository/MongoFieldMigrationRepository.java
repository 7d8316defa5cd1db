package org.impact.encryption.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.impact.encryption.model.EncryptedFieldValue;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class MongoFieldMigrationRepository implements FieldMigrationRepository {

    private final ReactiveMongoTemplate reactiveMongoTemplate;

    @Override
    public Flux<Document> findPlaintext(String collection, String fieldName) {
        return reactiveMongoTemplate.find(plaintextQuery(fieldName), Document.class, collection);
    }

    @Override
    public Flux<Document> findEncrypted(String collection, String fieldName) {
        return reactiveMongoTemplate.find(encryptedQuery(fieldName), Document.class, collection);
    }

    @Override
    public Mono<Long> countPlaintext(String collection, String fieldName) {
        return reactiveMongoTemplate.count(plaintextQuery(fieldName), collection);
    }

    @Override
    public Mono<Long> countEncrypted(String collection, String fieldName) {
        return reactiveMongoTemplate.count(encryptedQuery(fieldName), collection);
    }

    @Override
    public Mono<Boolean> updateIfUnchanged(String collection, Object id, String fieldName, Object expectedValue,
                                           Map<String, Object> updates) {
        Query query = new Query(Criteria.where("_id").is(id).and(fieldName).is(expectedValue));
        Update update = new Update();
        updates.forEach(update::set);
        return reactiveMongoTemplate.updateFirst(query, update, collection)
                .map(result -> result.getModifiedCount() > 0);
    }

    @Override
    public Mono<String> ensureIndex(String collection, String fieldName) {
        log.info("Ensuring index {} on collection {}", fieldName, collection);
        return reactiveMongoTemplate.indexOps(collection)
                .ensureIndex(new Index().on(fieldName, Sort.Direction.ASC).named(fieldName));
    }

    // {field: {$exists: true, $not: /^ENC:/}}
    static Query plaintextQuery(String fieldName) {
        return new Query(Criteria.where(fieldName).exists(true).not().regex(EncryptedFieldValue.PREFIX_REGEX));
    }

    // {field: /^ENC:/}
    static Query encryptedQuery(String fieldName) {
        return new Query(Criteria.where(fieldName).regex(EncryptedFieldValue.PREFIX_REGEX));
    }
}
