package org.impact.migrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import org.impact.encryption.config.FieldEncryptionProperties;
import org.impact.encryption.enums.SensitiveField;
import org.impact.encryption.exception.FieldEncryptionException;
import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.model.MigrationCancellation;
import org.impact.encryption.model.MigrationReport;
import org.impact.encryption.model.MigrationRequest;
import org.impact.encryption.repository.MongoFieldMigrationRepository;
import org.impact.encryption.service.BlindIndexService;
import org.impact.encryption.service.FieldEncryptionService;
import org.impact.encryption.service.MigrationService;
import org.impact.encryption.service.impl.BlindIndexServiceImpl;
import org.impact.encryption.service.impl.FieldEncryptionServiceImpl;
import org.impact.encryption.service.impl.FileKeyManagerServiceImpl;
import org.impact.encryption.service.impl.MigrationServiceImpl;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Standalone CLI to migrate sensitive fields of a MongoDB collection
 * Usage: java -jar encryption-migrator.jar --operation encrypt --mongo-uri mongodb://localhost:27017
 * --database impact --collection patients --field nhs_number,mrn
 */
public class EncryptionMigratorCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURES = 2;

    private static final Set<String> OPERATIONS = Set.of("encrypt", "decrypt", "rehash", "index");
    private static final Set<String> FORMATS = Set.of("text", "json");
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    public static void main(String[] args) {
        Map<String, String> options = parseArgs(args);
        String usageError = validate(options);
        if (usageError != null) {
            System.err.println("Error: " + usageError);
            printUsage(System.err);
            System.exit(EXIT_USAGE);
        }

        MigrationCancellation cancellation = new MigrationCancellation();
        CountDownLatch finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            cancellation.cancel();
            try {
                // let the current batch finish and the report print
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "migration-shutdown"));

        int exitCode;
        try {
            exitCode = runAgainstMongo(options, cancellation, System.out);
        } catch (FieldEncryptionException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            exitCode = EXIT_USAGE;
        } finally {
            finished.countDown();
        }
        System.exit(exitCode);
    }

    private static int runAgainstMongo(Map<String, String> options, MigrationCancellation cancellation,
                                       PrintStream out) throws Exception {
        FieldEncryptionProperties properties = toProperties(options);
        FieldCipherKeys keys = new FileKeyManagerServiceImpl(properties).getCipher();
        FieldEncryptionService fieldEncryptionService = new FieldEncryptionServiceImpl(keys);
        BlindIndexService blindIndexService = new BlindIndexServiceImpl(keys);

        try (MongoClient mongoClient = MongoClients.create(options.get("mongo-uri"))) {
            ReactiveMongoTemplate template = new ReactiveMongoTemplate(mongoClient, options.get("database"));
            MigrationService migrationService = new MigrationServiceImpl(
                    new MongoFieldMigrationRepository(template),
                    fieldEncryptionService,
                    blindIndexService,
                    properties.getMigration().getTimestampField(),
                    Clock.systemUTC());
            return execute(options, migrationService, cancellation, out);
        }
    }

    /**
     * Run the requested operation for every field, one after the other, and print the outcome.
     *
     * @return process exit code
     */
    static int execute(Map<String, String> options, MigrationService migrationService,
                       MigrationCancellation cancellation, PrintStream out) throws Exception {
        String operation = options.get("operation");
        String collection = options.get("collection");
        List<String> fields = parseFields(options.get("field"));
        boolean json = "json".equals(options.getOrDefault("format", "text"));

        if ("index".equals(operation)) {
            Map<String, String> indexes = new LinkedHashMap<>();
            for (String field : fields) {
                indexes.put(field, migrationService.ensureSearchHashIndex(collection, field).block());
            }
            if (json) {
                out.println(objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(indexes));
            } else {
                indexes.forEach((field, index) ->
                        out.println("Index " + index + " ready on " + collection + " for " + field));
            }
            return EXIT_OK;
        }

        int batchSize = options.containsKey("batch-size")
                ? Integer.parseInt(options.get("batch-size"))
                : toProperties(options).getMigration().getBatchSize();
        List<MigrationReport> reports = new ArrayList<>();
        for (String field : fields) {
            if (cancellation.isCancelled()) {
                break;
            }
            MigrationRequest request = MigrationRequest.builder()
                    .collection(collection)
                    .fieldName(field)
                    .batchSize(batchSize)
                    .cancellation(cancellation)
                    .build();
            MigrationReport report = switch (operation) {
                case "encrypt" -> migrationService.migrateToEncrypted(request).block();
                case "decrypt" -> migrationService.migrateFromEncrypted(request).block();
                case "rehash" -> migrationService.rehashSearchField(request).block();
                default -> throw new IllegalArgumentException("Unknown operation: " + operation);
            };
            reports.add(report);
        }

        if (json) {
            out.println(objectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(reports));
        } else {
            reports.forEach(report -> out.println(formatText(report)));
        }
        return exitCode(reports);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i += 2) {
            if (i + 1 < args.length && args[i].startsWith("--")) {
                String key = args[i].substring(2);
                String value = args[i + 1];
                options.put(key, value);
            }
        }
        return options;
    }

    /**
     * @return the problem with the options, or null when they are usable
     */
    static String validate(Map<String, String> options) {
        for (String required : List.of("operation", "mongo-uri", "database", "collection", "field")) {
            if (options.get(required) == null || options.get(required).isBlank()) {
                return "--" + required + " is required";
            }
        }
        if (!OPERATIONS.contains(options.get("operation"))) {
            return "Unknown operation: " + options.get("operation");
        }
        if (!FORMATS.contains(options.getOrDefault("format", "text"))) {
            return "Unknown format: " + options.get("format");
        }
        if (options.containsKey("batch-size")) {
            try {
                if (Integer.parseInt(options.get("batch-size")) <= 0) {
                    return "--batch-size must be positive";
                }
            } catch (NumberFormatException e) {
                return "--batch-size must be a number";
            }
        }
        List<String> fields = parseFields(options.get("field"));
        if (fields.isEmpty()) {
            return "--field is required";
        }
        boolean needsBlindIndex = Set.of("rehash", "index").contains(options.get("operation"));
        for (String field : fields) {
            if (!SensitiveField.isSensitive(field)) {
                return "Field " + field + " is not designated as encrypted";
            }
            if (needsBlindIndex && !SensitiveField.require(field).isSearchable()) {
                return "Field " + field + " is not searchable";
            }
        }
        return null;
    }

    static List<String> parseFields(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .distinct()
                .toList();
    }

    static FieldEncryptionProperties toProperties(Map<String, String> options) {
        FieldEncryptionProperties properties = new FieldEncryptionProperties();
        if (options.containsKey("key-file")) {
            properties.setKeyFile(options.get("key-file"));
        }
        if (options.containsKey("salt-file")) {
            properties.setSaltFile(options.get("salt-file"));
        }
        return properties;
    }

    static int exitCode(List<MigrationReport> reports) {
        return reports.stream().anyMatch(MigrationReport::hasFailures) ? EXIT_FAILURES : EXIT_OK;
    }

    static String formatText(MigrationReport report) {
        String pastTense = report.getDirection().getPastTense();
        return String.format("%s.%s: %d %s, %d already %s, %d skipped, %d failed in %d batches%s",
                report.getCollection(), report.getFieldName(), report.getMigrated(), pastTense,
                report.getAlreadyMigrated(), pastTense, report.getSkipped(), report.getFailed(),
                report.getBatches(), report.isCancelled() ? " (cancelled)" : "");
    }

    private static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  EncryptionMigratorCli --operation <encrypt|decrypt|rehash|index> --mongo-uri <uri>"
                + " --database <db> --collection <name> --field <f1,f2>");
        err.println("                        [--batch-size <n>] [--key-file <path>] [--salt-file <path>]"
                + " [--format <text|json>]");
        err.println("  Fields: " + Arrays.stream(SensitiveField.values())
                .map(SensitiveField::getFieldName)
                .toList());
        err.println("  Searchable fields (rehash, index): " + Arrays.stream(SensitiveField.values())
                .filter(SensitiveField::isSearchable)
                .map(SensitiveField::getFieldName)
                .toList());
    }
}
