package org.iceforge.filedrop.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ObjectStore} on a single S3 (or S3-compatible) bucket. Content is stored under
 * {@code filePrefix + publicKey}, each metadata copy under {@code metadataPrefix + key + ".json"}.
 */
public class S3ObjectStore implements ObjectStore {
    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStore.class);

    private static final String METADATA_SUFFIX = ".json";
    private static final String JSON = "application/json";
    private static final int LIST_PAGE_SIZE = 1000;

    private final S3Client s3;
    private final String bucket;
    private final String filePrefix;
    private final String metadataPrefix;
    private final KeyGenerator keyGenerator;
    private final Clock clock;
    private final ObjectLocks locks;

    public S3ObjectStore(S3Client s3, String bucket, String filePrefix, String metadataPrefix) {
        this(s3, bucket, filePrefix, metadataPrefix, new SecureRandomKeyGenerator(), Clock.systemDefaultZone(), new ObjectLocks());
    }

    public S3ObjectStore(S3Client s3, String bucket, String filePrefix, String metadataPrefix,
                         KeyGenerator keyGenerator, Clock clock, ObjectLocks locks) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.filePrefix = filePrefix == null ? "" : filePrefix;
        this.metadataPrefix = metadataPrefix == null ? "" : metadataPrefix;
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locks = Objects.requireNonNull(locks, "locks");
        if (this.filePrefix.equals(this.metadataPrefix)) {
            throw new StoreConfigurationException("filePrefix and metadataPrefix must differ, both are '" + this.filePrefix + "'");
        }
    }

    /**
     * Checks the bucket is reachable, creating it when allowed.
     */
    public void verifyBucket(boolean createIfMissing) {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            logger.info("Using S3 object store: bucket={} files={} metadata={}", bucket, filePrefix, metadataPrefix);
            return;
        } catch (NoSuchBucketException e) {
            logger.debug("Bucket {} not found", bucket, e);
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw new StoreConfigurationException("S3 bucket " + bucket + " is not accessible", e);
            }
        } catch (SdkException e) {
            throw new StoreConfigurationException("S3 endpoint unreachable while checking bucket " + bucket, e);
        }

        if (!createIfMissing) {
            throw new StoreConfigurationException("Bucket " + bucket + " does not exist and createBucketIfNotExists is false");
        }
        try {
            logger.info("Creating bucket {}", bucket);
            s3.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            logger.info("Bucket {} created", bucket);
        } catch (SdkException e) {
            throw new StoreConfigurationException("Failed to create bucket " + bucket, e);
        }
    }

    @Override
    public StoreModels.KeyPair put(byte[] content, String originalName, String contentType) {
        Objects.requireNonNull(content, "content");
        StoreModels.KeyPair keys = keyGenerator.generate();
        ObjectMetadata meta = ObjectMetadata.created(keys, originalName, contentType, clock.instant(), content.length);

        List<String> written = new ArrayList<>(3);
        try {
            String contentKey = contentKey(keys.publicKey());
            written.add(contentKey);
            PutObjectRequest.Builder req = PutObjectRequest.builder().bucket(bucket).key(contentKey);
            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);
            if (originalName != null) {
                req = req.metadata(Map.of("originalname", URLEncoder.encode(originalName, StandardCharsets.UTF_8)));
            }
            s3.putObject(req.build(), RequestBody.fromBytes(content));

            byte[] doc = MetadataCodec.encode(meta);
            for (String key : List.of(keys.publicKey(), keys.privateKey())) {
                String metaKey = metadataKey(key);
                written.add(metaKey);
                putJson(metaKey, doc);
            }
        } catch (SdkException | StoreException e) {
            logger.error("S3 put failed for s3://{}/{}, rolling back {} object(s)",
                    bucket, contentKey(ObjectKeys.abbreviate(keys.publicKey())), written.size(), e);
            rollback(written);
            throw new StoreException("S3 put failed for " + ObjectKeys.abbreviate(keys.publicKey()), e);
        }
        return keys;
    }

    @Override
    public StoreModels.StoredObject get(String publicKey) {
        String key = ObjectKeys.requireValid(publicKey, "publicKey");
        return locks.withLock(key, () -> {
            ObjectMetadata meta = readMetadata(key)
                    .filter(m -> key.equals(m.publicKey()))
                    .orElseThrow(() -> new ObjectNotFoundException(key));

            byte[] content = readObject(contentKey(key)).orElseThrow(() -> {
                logger.error("Metadata present but content missing at s3://{}/{}", bucket, contentKey(ObjectKeys.abbreviate(key)));
                return new StoreException("Content missing for " + ObjectKeys.abbreviate(key));
            });

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
            if (readMetadata(key).isEmpty()) {
                return false;
            }

            List<SdkException> failures = new ArrayList<>();
            deleteObject(contentKey(publicKey), failures);
            // The private copy goes last so a failed delete can be retried with the same key.
            if (deleteObject(metadataKey(publicKey), failures) && exists(metadataKey(publicKey))) {
                throw metadataLeftBehind(publicKey, failures);
            }
            if (deleteObject(metadataKey(key), failures) && exists(metadataKey(key))) {
                throw metadataLeftBehind(publicKey, failures);
            }
            if (!failures.isEmpty()) {
                logger.warn("Deleted metadata for {} but {} removal(s) failed", ObjectKeys.abbreviate(publicKey), failures.size());
            }
            return true;
        });
    }

    private static StoreException metadataLeftBehind(String publicKey, List<SdkException> failures) {
        StoreException ex = new StoreException("S3 delete left metadata behind for " + ObjectKeys.abbreviate(publicKey));
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
        String token = null;
        do {
            ListObjectsV2Response page;
            try {
                ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(metadataPrefix)
                        .maxKeys(LIST_PAGE_SIZE);
                if (token != null) req = req.continuationToken(token);
                page = s3.listObjectsV2(req.build());
            } catch (SdkException e) {
                logger.error("S3 list failed for bucket={} prefix={}", bucket, metadataPrefix, e);
                throw new StoreException("S3 list failed: bucket=" + bucket + " prefix=" + metadataPrefix, e);
            }

            if (page.contents() != null) {
                for (S3Object o : page.contents()) {
                    String name = o.key();
                    if (!name.startsWith(metadataPrefix) || !name.endsWith(METADATA_SUFFIX)) continue;
                    String keyFromName = name.substring(metadataPrefix.length(), name.length() - METADATA_SUFFIX.length());
                    try {
                        Optional<byte[]> doc = readObject(name);
                        if (doc.isEmpty()) continue;
                        ObjectMetadata m = MetadataCodec.decode(doc.get());
                        if (keyFromName.equals(m.privateKey()) && m.isInactiveSince(cutoff)) {
                            inactive.add(m.privateKey());
                        }
                    } catch (StoreException | IllegalArgumentException e) {
                        logger.debug("Skipping unreadable metadata s3://{}/{}", bucket, name, e);
                    }
                }
            }
            token = Boolean.TRUE.equals(page.isTruncated()) ? page.nextContinuationToken() : null;
        } while (token != null);
        return inactive;
    }

    @Override
    public String describe() {
        return "s3://" + bucket;
    }

    private String contentKey(String publicKey) {
        return filePrefix + publicKey;
    }

    private String metadataKey(String key) {
        return metadataPrefix + key + METADATA_SUFFIX;
    }

    private Optional<ObjectMetadata> readMetadata(String key) {
        Optional<byte[]> doc = readObject(metadataKey(key));
        if (doc.isEmpty()) return Optional.empty();
        try {
            return Optional.of(MetadataCodec.decode(doc.get()));
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt metadata for " + ObjectKeys.abbreviate(key), e);
        }
    }

    private Optional<byte[]> readObject(String objectKey) {
        try (ResponseInputStream<GetObjectResponse> in = s3.getObject(
                GetObjectRequest.builder().bucket(bucket).key(objectKey).build())) {
            return Optional.of(in.readAllBytes());
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // Some S3-compatible APIs throw a generic 404 instead of NoSuchKey.
            if (e.statusCode() == 404) return Optional.empty();
            logger.error("S3 get failed for s3://{}/{}", bucket, objectKey, e);
            throw new StoreException("S3 get failed: s3://" + bucket + "/" + objectKey, e);
        } catch (SdkException | IOException e) {
            logger.error("S3 get failed for s3://{}/{}", bucket, objectKey, e);
            throw new StoreException("S3 get failed: s3://" + bucket + "/" + objectKey, e);
        }
    }

    private boolean exists(String objectKey) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(objectKey).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return false;
            throw new StoreException("S3 head failed: s3://" + bucket + "/" + objectKey, e);
        } catch (SdkException e) {
            throw new StoreException("S3 head failed: s3://" + bucket + "/" + objectKey, e);
        }
    }

    private void putJson(String objectKey, byte[] doc) {
        s3.putObject(PutObjectRequest.builder()
                .bucket(bucket)
                .key(objectKey)
                .contentType(JSON)
                .build(), RequestBody.fromBytes(doc));
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
                putJson(metadataKey(key), doc);
                written.add(key);
            } catch (SdkException e) {
                logger.error("Failed to mirror metadata for {}", ObjectKeys.abbreviate(updated.publicKey()), e);
                StoreException ex = new StoreException("S3 metadata write failed for " + ObjectKeys.abbreviate(key), e);
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
                putJson(metadataKey(key), doc);
            } catch (SdkException e) {
                logger.warn("Could not restore metadata s3://{}/{}", bucket, metadataKey(ObjectKeys.abbreviate(key)), e);
                failure.addSuppressed(e);
            }
        }
    }

    /** Returns true when the delete call failed. */
    private boolean deleteObject(String objectKey, List<SdkException> failures) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build());
            return false;
        } catch (SdkException e) {
            logger.warn("S3 delete failed for s3://{}/{}", bucket, objectKey, e);
            failures.add(e);
            return true;
        }
    }

    private void rollback(List<String> written) {
        for (String objectKey : written) {
            try {
                s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(objectKey).build());
            } catch (SdkException e) {
                logger.warn("Rollback could not remove s3://{}/{}", bucket, objectKey, e);
            }
        }
    }
}
