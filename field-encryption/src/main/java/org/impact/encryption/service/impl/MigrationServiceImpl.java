package org.impact.encryption.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.impact.encryption.enums.MigrationDirection;
import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.exception.FieldEncryptionException;
import org.impact.encryption.model.MigrationCancellation;
import org.impact.encryption.model.MigrationReport;
import org.impact.encryption.model.MigrationRequest;
import org.impact.encryption.repository.FieldMigrationRepository;
import org.impact.encryption.service.BlindIndexService;
import org.impact.encryption.service.FieldEncryptionService;
import org.impact.encryption.service.MigrationService;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

@Slf4j
@RequiredArgsConstructor
public class MigrationServiceImpl implements MigrationService {

    private static final String ID_FIELD = "_id";

    private enum Outcome { MIGRATED, ALREADY_MIGRATED, SKIPPED }

    private final FieldMigrationRepository repository;
    private final FieldEncryptionService fieldEncryptionService;
    private final BlindIndexService blindIndexService;
    private final String timestampField;
    private final Clock clock;

    @Override
    public Mono<MigrationReport> migrateToEncrypted(String collection, String fieldName, int batchSize) {
        return migrateToEncrypted(MigrationRequest.of(collection, fieldName, batchSize));
    }

    @Override
    public Mono<MigrationReport> migrateToEncrypted(MigrationRequest request) {
        return validate(request).then(Mono.defer(() -> {
            String collection = request.getCollection();
            String fieldName = request.getFieldName();
            log.info("Starting migration for field: {} in {}", fieldName, collection);

            return Mono.zip(repository.countPlaintext(collection, fieldName),
                            repository.countEncrypted(collection, fieldName))
                    .flatMap(counts -> {
                        Progress progress = new Progress(MigrationDirection.ENCRYPT, request, counts.getT1());
                        progress.alreadyMigrated.addAndGet(counts.getT2());
                        log.info("Found {} documents to encrypt ({} already encrypted)", counts.getT1(), counts.getT2());
                        return run(request, progress, repository.findPlaintext(collection, fieldName),
                                doc -> encryptOne(request, doc));
                    });
        }));
    }

    @Override
    public Mono<MigrationReport> migrateFromEncrypted(String collection, String fieldName, int batchSize) {
        return migrateFromEncrypted(MigrationRequest.of(collection, fieldName, batchSize));
    }

    @Override
    public Mono<MigrationReport> migrateFromEncrypted(MigrationRequest request) {
        return validate(request).then(Mono.defer(() -> {
            String collection = request.getCollection();
            String fieldName = request.getFieldName();
            log.warn("⚠️ Decrypting field {} in {} - this reduces security!", fieldName, collection);

            return Mono.zip(repository.countEncrypted(collection, fieldName),
                            repository.countPlaintext(collection, fieldName))
                    .flatMap(counts -> {
                        Progress progress = new Progress(MigrationDirection.DECRYPT, request, counts.getT1());
                        progress.alreadyMigrated.addAndGet(counts.getT2());
                        log.info("Found {} encrypted documents", counts.getT1());
                        return run(request, progress, repository.findEncrypted(collection, fieldName),
                                doc -> decryptOne(request, doc));
                    });
        }));
    }

    @Override
    public Mono<MigrationReport> rehashSearchField(String collection, String fieldName, int batchSize) {
        return rehashSearchField(MigrationRequest.of(collection, fieldName, batchSize));
    }

    @Override
    public Mono<MigrationReport> rehashSearchField(MigrationRequest request) {
        return validate(request).then(Mono.defer(() -> {
            String collection = request.getCollection();
            String fieldName = request.getFieldName();
            SensitiveField field = SensitiveField.requireSearchable(fieldName);
            log.info("Starting rehash of {} in {}", field.getHashFieldName(), collection);

            return repository.countEncrypted(collection, fieldName)
                    .flatMap(total -> {
                        Progress progress = new Progress(MigrationDirection.REHASH, request, total);
                        log.info("Found {} encrypted documents to rehash", total);
                        return run(request, progress, repository.findEncrypted(collection, fieldName),
                                doc -> rehashOne(request, doc));
                    });
        }));
    }

    @Override
    public Mono<String> ensureSearchHashIndex(String collection, String fieldName) {
        return Mono.fromCallable(() -> SensitiveField.requireSearchable(fieldName))
                .flatMap(field -> repository.ensureIndex(collection, field.getHashFieldName()));
    }

    private Mono<Outcome> encryptOne(MigrationRequest request, Document doc) {
        String fieldName = request.getFieldName();
        Object value = doc.get(fieldName);
        if (isBlank(value)) {
            return Mono.just(Outcome.SKIPPED);
        }
        Object encrypted = fieldEncryptionService.encryptField(fieldName, value);
        if (Objects.equals(encrypted, value)) {
            return Mono.just(Outcome.ALREADY_MIGRATED);
        }
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(fieldName, encrypted);
        updates.put(timestampField, Date.from(clock.instant()));
        return update(request, doc, value, updates);
    }

    private Mono<Outcome> decryptOne(MigrationRequest request, Document doc) {
        String fieldName = request.getFieldName();
        Object value = doc.get(fieldName);
        if (!fieldEncryptionService.isEncrypted(value)) {
            return Mono.just(Outcome.ALREADY_MIGRATED);
        }
        Object decrypted = fieldEncryptionService.decryptField(fieldName, value);
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(fieldName, decrypted);
        updates.put(timestampField, Date.from(clock.instant()));
        return update(request, doc, value, updates);
    }

    private Mono<Outcome> rehashOne(MigrationRequest request, Document doc) {
        String fieldName = request.getFieldName();
        String hashField = SensitiveField.requireSearchable(fieldName).getHashFieldName();
        Object value = doc.get(fieldName);
        if (!fieldEncryptionService.isEncrypted(value)) {
            return Mono.just(Outcome.SKIPPED);
        }
        Object plaintext = fieldEncryptionService.decryptField(fieldName, value);
        String hash = blindIndexService.generateSearchHash(fieldName, plaintext);
        if (hash == null) {
            return Mono.just(Outcome.SKIPPED);
        }
        if (hash.equals(doc.get(hashField))) {
            return Mono.just(Outcome.ALREADY_MIGRATED);
        }
        Map<String, Object> updates = new LinkedHashMap<>();
        updates.put(hashField, hash);
        return update(request, doc, value, updates);
    }

    // only applies while the stored value still equals the one that was read
    private Mono<Outcome> update(MigrationRequest request, Document doc, Object expectedValue,
                                 Map<String, Object> updates) {
        return repository.updateIfUnchanged(request.getCollection(), doc.get(ID_FIELD), request.getFieldName(),
                        expectedValue, updates)
                .map(modified -> modified ? Outcome.MIGRATED : Outcome.ALREADY_MIGRATED);
    }

    private Mono<MigrationReport> run(MigrationRequest request, Progress progress, Flux<Document> candidates,
                                      Function<Document, Mono<Outcome>> step) {
        MigrationCancellation cancellation = request.getCancellation();
        String pastTense = progress.direction.getPastTense();

        return candidates
                .buffer(request.getBatchSize())
                // checked when a batch is about to run, not when it is prefetched
                .concatMap(batch -> {
                    if (cancellation.isCancelled()) {
                        progress.cancelled.set(true);
                        log.warn("Migration of {} cancelled after {} batches", request.getFieldName(),
                                progress.batches.get());
                        return Mono.just(false);
                    }
                    return processBatch(batch, progress, step)
                            .then(Mono.fromCallable(() -> {
                                progress.batches.incrementAndGet();
                                log.info("Progress: {}/{} documents {}", progress.processed(),
                                        progress.candidates, pastTense);
                                return true;
                            }));
                })
                .takeWhile(Boolean::booleanValue)
                .then(Mono.fromCallable(() -> progress.toReport(clock.instant())))
                .doOnNext(report -> log.info(
                        "Migration {} for {}.{}: {} documents {}, {} already {}, {} skipped, {} failed",
                        report.isCancelled() ? "cancelled" : "complete", report.getCollection(),
                        report.getFieldName(), report.getMigrated(), pastTense, report.getAlreadyMigrated(),
                        pastTense, report.getSkipped(), report.getFailed()));
    }

    private Mono<Void> processBatch(List<Document> batch, Progress progress, Function<Document, Mono<Outcome>> step) {
        return Flux.fromIterable(batch)
                .concatMap(doc -> Mono.defer(() -> step.apply(doc))
                        .doOnNext(progress::record)
                        .onErrorResume(e -> {
                            progress.failed.incrementAndGet();
                            log.error("Failed to migrate document {}: {}", doc.get(ID_FIELD), failureKind(e));
                            return Mono.empty();
                        }))
                .then();
    }

    private static Object failureKind(Throwable e) {
        return e instanceof FieldEncryptionException
                ? ((FieldEncryptionException) e).getKind()
                : e.getClass().getSimpleName();
    }

    private Mono<Void> validate(MigrationRequest request) {
        if (request.getCollection() == null || request.getCollection().isBlank()) {
            return Mono.error(new IllegalArgumentException("Collection name is required"));
        }
        if (request.getBatchSize() <= 0) {
            return Mono.error(new IllegalArgumentException("Batch size must be positive: " + request.getBatchSize()));
        }
        if (!SensitiveField.isSensitive(request.getFieldName())) {
            log.warn("Field {} is not designated as encrypted", request.getFieldName());
            return Mono.error(new IllegalArgumentException(
                    "Field " + request.getFieldName() + " is not designated as encrypted"));
        }
        return Mono.empty();
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence cs && cs.length() == 0);
    }

    private final class Progress {
        private final MigrationDirection direction;
        private final MigrationRequest request;
        private final long candidates;
        private final Instant startedAt;

        private final AtomicLong migrated = new AtomicLong();
        private final AtomicLong alreadyMigrated = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();
        private final AtomicLong failed = new AtomicLong();
        private final AtomicLong batches = new AtomicLong();
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Progress(MigrationDirection direction, MigrationRequest request, long candidates) {
            this.direction = direction;
            this.request = request;
            this.candidates = candidates;
            this.startedAt = clock.instant();
        }

        private void record(Outcome outcome) {
            switch (outcome) {
                case MIGRATED -> migrated.incrementAndGet();
                case ALREADY_MIGRATED -> alreadyMigrated.incrementAndGet();
                case SKIPPED -> skipped.incrementAndGet();
            }
        }

        private long processed() {
            return migrated.get() + skipped.get() + failed.get();
        }

        private MigrationReport toReport(Instant completedAt) {
            return MigrationReport.builder()
                    .direction(direction)
                    .collection(request.getCollection())
                    .fieldName(request.getFieldName())
                    .candidates(candidates)
                    .migrated(migrated.get())
                    .alreadyMigrated(alreadyMigrated.get())
                    .skipped(skipped.get())
                    .failed(failed.get())
                    .batches(batches.get())
                    .cancelled(cancelled.get())
                    .startedAt(startedAt)
                    .completedAt(completedAt)
                    .build();
        }
    }
}
