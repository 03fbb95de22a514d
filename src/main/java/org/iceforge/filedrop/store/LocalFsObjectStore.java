package org.iceforge.filedrop.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Local filesystem implementation of {@link ObjectStore}.
 *
 * <p>Layout under the root folder:
 * <pre>
 *   {root}/files/{publicKey}            content
 *   {root}/.metadata/{publicKey}.json   metadata copy
 *   {root}/.metadata/{privateKey}.json  metadata copy
 * </pre>
 * Every file is written to a temp file in the target directory and moved into place, so a
 * reader sees either the previous document or the new one.
 */
public class LocalFsObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(LocalFsObjectStore.class);

    static final String FILES_DIR = "files";
    static final String METADATA_DIR = ".metadata";
    private static final String METADATA_SUFFIX = ".json";

    private final Path root;
    private final Path filesDir;
    private final Path metadataDir;
    private final KeyGenerator keyGenerator;
    private final Clock clock;
    private final ObjectLocks locks;

    public LocalFsObjectStore(Path root) {
        this(root, new SecureRandomKeyGenerator(), Clock.systemDefaultZone(), new ObjectLocks());
    }

    public LocalFsObjectStore(Path root, KeyGenerator keyGenerator, Clock clock, ObjectLocks locks) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.filesDir = this.root.resolve(FILES_DIR);
        this.metadataDir = this.root.resolve(METADATA_DIR);
        try {
            Files.createDirectories(filesDir);
            Files.createDirectories(metadataDir);
        } catch (IOException e) {
            throw new StoreConfigurationException("Failed to create storage folders under " + this.root, e);
        }
        log.info("Using LOCAL object store: root={}", this.root);
    }

    @Override
    public StoreModels.KeyPair put(byte[] content, String originalName, String contentType) {
        Objects.requireNonNull(content, "content");
        StoreModels.KeyPair keys = keyGenerator.generate();
        ObjectMetadata meta = ObjectMetadata.created(keys, originalName, contentType, clock.instant(), content.length);

        List<Path> written = new ArrayList<>(3);
        try {
            Path contentPath = contentPath(keys.publicKey());
            written.add(contentPath);
            writeAtomically(contentPath, content);

            byte[] doc = MetadataCodec.encode(meta);
            for (String key : List.of(keys.publicKey(), keys.privateKey())) {
                Path metaPath = metadataPath(key);
                written.add(metaPath);
                writeAtomically(metaPath, doc);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Local put failed for {}, rolling back {} artifact(s)",
                    ObjectKeys.abbreviate(keys.publicKey()), written.size(), e);
            rollback(written);
            throw new StoreException("Local put failed for " + ObjectKeys.abbreviate(keys.publicKey()), e);
        }

        log.debug("Stored {} bytes under {}", content.length, ObjectKeys.abbreviate(keys.publicKey()));
        return keys;
    }

    @Override
    public StoreModels.StoredObject get(String publicKey) {
        String key = ObjectKeys.requireValid(publicKey, "publicKey");
        return locks.withLock(key, () -> {
            ObjectMetadata meta = readMetadata(key)
                    .filter(m -> key.equals(m.publicKey()))
                    .orElseThrow(() -> new ObjectNotFoundException(key));

            byte[] content;
            try {
                content = Files.readAllBytes(contentPath(key));
            } catch (NoSuchFileException e) {
                log.error("Metadata present but content missing for {}", ObjectKeys.abbreviate(key));
                throw new StoreException("Content missing for " + ObjectKeys.abbreviate(key), e);
            } catch (IOException e) {
                throw new StoreException("Local read failed for " + ObjectKeys.abbreviate(key), e);
            }

            writeMetadataCopies(meta, meta.accessedAt(clock.instant()));
            return new StoreModels.StoredObject(content, meta.mimeType(), meta.originalName());
        });
    }

    @Override
    public boolean delete(String privateKey) {
        String key = ObjectKeys.requireValid(privateKey, "privateKey");
        Optional<ObjectMetadata> peek = readMetadata(key);
        if (peek.isEmpty() || !key.equals(peek.get().privateKey())) {
            return false;
        }
        String publicKey = peek.get().publicKey();

        return locks.withLock(publicKey, () -> {
            // Re-read under the lock; a concurrent delete may have won.
            Optional<ObjectMetadata> current = readMetadata(key);
            if (current.isEmpty()) {
                return false;
            }

            List<IOException> failures = new ArrayList<>();
            removeIfExists(contentPath(publicKey), failures);
            // The private copy goes last so a failed delete can be retried with the same key.
            removeIfExists(metadataPath(publicKey), failures);
            if (Files.exists(metadataPath(publicKey))) {
                throw metadataLeftBehind(publicKey, failures);
            }
            removeIfExists(metadataPath(key), failures);
            if (Files.exists(metadataPath(key))) {
                throw metadataLeftBehind(publicKey, failures);
            }
            if (!failures.isEmpty()) {
                log.warn("Deleted metadata for {} but content removal failed", ObjectKeys.abbreviate(publicKey));
            }
            return true;
        });
    }

    private static StoreException metadataLeftBehind(String publicKey, List<IOException> failures) {
        StoreException ex = new StoreException("Local delete left metadata behind for " + ObjectKeys.abbreviate(publicKey));
        failures.forEach(ex::addSuppressed);
        return ex;
    }

    @Override
    public StoreModels.AccessTimes getMetadata(String key) {
        String k = ObjectKeys.requireValid(key, "key");
        return readMetadata(k)
                .map(ObjectMetadata::accessTimes)
                .orElseThrow(() -> new ObjectNotFoundException(k));
    }

    @Override
    public List<String> listInactiveSince(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff");
        List<String> inactive = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(metadataDir, "*" + METADATA_SUFFIX)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                String keyFromName = name.substring(0, name.length() - METADATA_SUFFIX.length());
                try {
                    ObjectMetadata m = MetadataCodec.decode(Files.readAllBytes(p));
                    // One entry per object: only the private-key copy counts.
                    if (keyFromName.equals(m.privateKey()) && m.isInactiveSince(cutoff)) {
                        inactive.add(m.privateKey());
                    }
                } catch (IOException | IllegalArgumentException e) {
                    log.debug("Skipping unreadable metadata {}", p, e);
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            throw new StoreException("Local list failed for " + metadataDir, e);
        }
        return inactive;
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    private Path contentPath(String publicKey) {
        return filesDir.resolve(publicKey);
    }

    private Path metadataPath(String key) {
        return metadataDir.resolve(key + METADATA_SUFFIX);
    }

    private Optional<ObjectMetadata> readMetadata(String key) {
        Path p = metadataPath(key);
        try {
            return Optional.of(MetadataCodec.decode(Files.readAllBytes(p)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Local metadata read failed for " + ObjectKeys.abbreviate(key), e);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt metadata for " + ObjectKeys.abbreviate(key), e);
        }
    }

    /**
     * Writes {@code updated} under both keys. If the second write fails, the first copy is put
     * back to {@code previous} so both keys keep reading the same document.
     */
    private void writeMetadataCopies(ObjectMetadata previous, ObjectMetadata updated) {
        byte[] doc = MetadataCodec.encode(updated);
        List<String> written = new ArrayList<>(2);
        for (String key : List.of(updated.publicKey(), updated.privateKey())) {
            try {
                writeAtomically(metadataPath(key), doc);
                written.add(key);
            } catch (IOException e) {
                log.error("Failed to mirror metadata for {}", ObjectKeys.abbreviate(updated.publicKey()), e);
                StoreException ex = new StoreException("Local metadata write failed for " + ObjectKeys.abbreviate(key), e);
                restoreMetadata(written, previous, ex);
                throw ex;
            }
        }
    }

    private void restoreMetadata(List<String> keys, ObjectMetadata previous, StoreException failure) {
        if (keys.isEmpty()) return;
        byte[] doc = MetadataCodec.encode(previous);
        for (String key : keys) {
            try {
                writeAtomically(metadataPath(key), doc);
            } catch (IOException e) {
                log.warn("Could not restore metadata for {}", ObjectKeys.abbreviate(key), e);
                failure.addSuppressed(e);
            }
        }
    }

    private static void writeAtomically(Path dst, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(dst.getParent(), ".tmp-", ".part");
        try {
            Files.write(tmp, bytes);
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void rollback(List<Path> written) {
        for (Path p : written) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.warn("Rollback could not remove {}", p, e);
            }
        }
    }

    private static void removeIfExists(Path p, List<IOException> failures) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to remove {}", p, e);
            failures.add(e);
        }
    }
}
