package org.impact.encryption.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.impact.encryption.config.FieldEncryptionProperties;
import org.impact.encryption.enums.CryptoErrorKind;
import org.impact.encryption.exception.KeyConfigurationException;
import org.impact.encryption.model.FieldCipherKeys;
import org.impact.encryption.model.KeyMaterial;
import org.impact.encryption.service.KeyManagerService;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * File-backed key manager.
 *
 * The master secret and salt live in two owner-only files. On first run both are
 * generated; afterwards they are loaded verbatim. The AES key is derived with
 * PBKDF2-HMAC-SHA256 and the blind index key is derived from it with HMAC-SHA256
 * (HKDF-like), so one pair of files yields both keys.
 */
@Slf4j
public class FileKeyManagerServiceImpl implements KeyManagerService {

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String INDEX_KEY_LABEL = "impact-field-encryption/blind-index/v1";
    private static final int MASTER_SECRET_RANDOM_BYTES = 32;
    private static final int MIN_MASTER_SECRET_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    private static final Set<PosixFilePermission> OWNER_ONLY = EnumSet.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE);

    // one monitor per key file so two instances in the same JVM never race on the file lock
    private static final ConcurrentMap<Path, Object> PATH_MONITORS = new ConcurrentHashMap<>();

    private final Path keyFile;
    private final Path saltFile;
    private final int iterations;
    private final SecureRandom secureRandom = new SecureRandom();

    private volatile FieldCipherKeys cipher;

    public FileKeyManagerServiceImpl(FieldEncryptionProperties properties) {
        this(Paths.get(properties.getKeyFile()), Paths.get(properties.getSaltFile()), properties.getPbkdf2Iterations());
    }

    public FileKeyManagerServiceImpl(Path keyFile, Path saltFile, int iterations) {
        this.keyFile = keyFile.toAbsolutePath().normalize();
        this.saltFile = saltFile.toAbsolutePath().normalize();
        this.iterations = iterations;
    }

    @Override
    public FieldCipherKeys getCipher() {
        FieldCipherKeys local = cipher;
        if (local == null) {
            synchronized (this) {
                local = cipher;
                if (local == null) {
                    KeyMaterial material = initialize();
                    try {
                        local = deriveCipherKeys(material);
                        cipher = local;
                    } finally {
                        material.destroy();
                    }
                }
            }
        }
        return local;
    }

    @Override
    public KeyMaterial initialize() {
        Object monitor = PATH_MONITORS.computeIfAbsent(keyFile, p -> new Object());
        synchronized (monitor) {
            createParentDirectories();
            Path lockFile = keyFile.resolveSibling(keyFile.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return loadOrCreate();
            } catch (IOException e) {
                throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_UNWRITABLE,
                        "Cannot lock encryption key file: " + lockFile, e);
            }
        }
    }

    @Override
    public SecretKey deriveKey(KeyMaterial keyMaterial) {
        if (iterations < FieldEncryptionProperties.MIN_PBKDF2_ITERATIONS) {
            throw new KeyConfigurationException(CryptoErrorKind.INVALID_KDF_PARAMETERS,
                    "PBKDF2 iterations must be at least " + FieldEncryptionProperties.MIN_PBKDF2_ITERATIONS
                            + " but was " + iterations);
        }
        byte[] secret = keyMaterial.getMasterSecret();
        char[] password = new String(secret, StandardCharsets.US_ASCII).toCharArray();
        byte[] salt = keyMaterial.getSalt();
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, FieldCipherKeys.KEY_LENGTH * 8);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            try {
                return new SecretKeySpec(keyBytes, FieldCipherKeys.ENCRYPTION_ALGORITHM);
            } finally {
                Arrays.fill(keyBytes, (byte) 0);
            }
        } catch (GeneralSecurityException e) {
            throw new KeyConfigurationException(CryptoErrorKind.INVALID_KDF_PARAMETERS,
                    "Failed to derive field encryption key", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
            Arrays.fill(secret, (byte) 0);
            Arrays.fill(salt, (byte) 0);
        }
    }

    private FieldCipherKeys deriveCipherKeys(KeyMaterial material) {
        SecretKey encryptionKey = deriveKey(material);
        byte[] encryptionKeyBytes = encryptionKey.getEncoded();
        try {
            Mac hmac = Mac.getInstance(FieldCipherKeys.INDEX_ALGORITHM);
            hmac.init(new SecretKeySpec(encryptionKeyBytes, FieldCipherKeys.INDEX_ALGORITHM));
            byte[] indexKeyBytes = hmac.doFinal(INDEX_KEY_LABEL.getBytes(StandardCharsets.UTF_8));
            try {
                log.debug("Derived field encryption and blind index keys");
                return FieldCipherKeys.fromRawKeys(encryptionKeyBytes, indexKeyBytes);
            } finally {
                Arrays.fill(indexKeyBytes, (byte) 0);
            }
        } catch (GeneralSecurityException e) {
            throw new KeyConfigurationException(CryptoErrorKind.INVALID_KDF_PARAMETERS,
                    "Failed to derive blind index key", e);
        } finally {
            Arrays.fill(encryptionKeyBytes, (byte) 0);
        }
    }

    private KeyMaterial loadOrCreate() throws IOException {
        boolean keyExists = Files.exists(keyFile);
        boolean saltExists = Files.exists(saltFile);

        if (keyExists && saltExists) {
            return load();
        }
        if (keyExists || saltExists) {
            // regenerating one half of the pair would make existing ciphertext undecryptable
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_MISSING, String.format(
                    "Encryption key and salt must exist together (key file %s: %s, salt file %s: %s). "
                            + "Restore the missing file from backup.",
                    keyFile, keyExists ? "present" : "missing", saltFile, saltExists ? "present" : "missing"));
        }
        return create();
    }

    private KeyMaterial load() {
        byte[] secret = readRestricted(keyFile);
        byte[] salt = readRestricted(saltFile);

        if (secret.length < MIN_MASTER_SECRET_LENGTH || !isAscii(secret)) {
            Arrays.fill(secret, (byte) 0);
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_CORRUPT,
                    "Encryption key file is corrupt (expected at least " + MIN_MASTER_SECRET_LENGTH
                            + " ASCII bytes): " + keyFile);
        }
        if (salt.length != SALT_LENGTH) {
            Arrays.fill(secret, (byte) 0);
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_CORRUPT,
                    "Encryption salt file is corrupt (expected " + SALT_LENGTH + " bytes, found "
                            + salt.length + "): " + saltFile);
        }

        try {
            log.debug("Loaded existing encryption key");
            return new KeyMaterial(secret, salt, false);
        } finally {
            Arrays.fill(secret, (byte) 0);
            Arrays.fill(salt, (byte) 0);
        }
    }

    private KeyMaterial create() {
        log.warn("Generating new field encryption key - this should only happen once!");

        byte[] random = new byte[MASTER_SECRET_RANDOM_BYTES];
        secureRandom.nextBytes(random);
        byte[] secret = Base64.getUrlEncoder().encode(random);
        Arrays.fill(random, (byte) 0);

        byte[] salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);

        Path saltTemp = temporarySibling(saltFile);
        Path keyTemp = temporarySibling(keyFile);
        boolean saltInPlace = false;
        try {
            writeRestricted(saltTemp, salt);
            writeRestricted(keyTemp, secret);

            // key goes last: a key file on disk always has its salt beside it
            Files.move(saltTemp, saltFile, StandardCopyOption.ATOMIC_MOVE);
            saltInPlace = true;
            Files.move(keyTemp, keyFile, StandardCopyOption.ATOMIC_MOVE);

            log.info("Encryption key created: {}", keyFile);
            log.info("Salt created: {}", saltFile);
            log.warn("⚠️ IMPORTANT: Backup these files to a secure offline location!");

            return new KeyMaterial(secret, salt, true);
        } catch (IOException e) {
            discard(saltTemp);
            discard(keyTemp);
            if (saltInPlace) {
                discard(saltFile);
            }
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_UNWRITABLE,
                    "Cannot write encryption key material: " + keyFile, e);
        } finally {
            Arrays.fill(secret, (byte) 0);
            Arrays.fill(salt, (byte) 0);
        }
    }

    private byte[] readRestricted(Path file) {
        restrictPermissions(file);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_MISSING,
                    "Cannot read encryption key material: " + file, e);
        }
    }

    private void writeRestricted(Path file, byte[] content) throws IOException {
        Files.deleteIfExists(file);
        if (supportsPosix(file.getParent())) {
            FileAttribute<Set<PosixFilePermission>> attribute = PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            Files.createFile(file, attribute);
        } else {
            Files.createFile(file);
        }
        Files.write(file, content, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.SYNC);
    }

    private void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Could not remove partial key material {}: {}", file, e.getMessage());
        }
    }

    static Path temporarySibling(Path file) {
        return file.resolveSibling(file.getFileName() + ".tmp");
    }

    private void restrictPermissions(Path file) {
        if (!supportsPosix(file)) {
            return;
        }
        try {
            Set<PosixFilePermission> current = Files.getPosixFilePermissions(file);
            if (!OWNER_ONLY.containsAll(current)) {
                log.warn("Encryption key material {} had permissions {}; restricting to owner read/write",
                        file, PosixFilePermissions.toString(current));
                Files.setPosixFilePermissions(file, OWNER_ONLY);
            }
        } catch (IOException e) {
            log.warn("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }

    private void createParentDirectories() {
        try {
            Path parent = keyFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path saltParent = saltFile.getParent();
            if (saltParent != null) {
                Files.createDirectories(saltParent);
            }
        } catch (IOException e) {
            throw new KeyConfigurationException(CryptoErrorKind.KEY_MATERIAL_UNWRITABLE,
                    "Cannot create directory for encryption key material: " + keyFile.getParent(), e);
        }
    }

    private static boolean supportsPosix(Path path) {
        return path != null && Files.getFileAttributeView(path, PosixFileAttributeView.class) != null;
    }

    // the secret is the PBKDF2 password; only ASCII survives the char[] round trip byte for byte
    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return false;
            }
        }
        return true;
    }
}
