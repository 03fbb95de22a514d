package org.iceforge.filedrop.config;

import org.iceforge.filedrop.store.LocalFsObjectStore;
import org.iceforge.filedrop.store.ObjectStore;
import org.iceforge.filedrop.store.S3ObjectStore;
import org.iceforge.filedrop.store.StoreConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;

/**
 * Picks and initializes the {@link ObjectStore} backend named by {@code filedrop.storage.provider}.
 */
public final class ObjectStoreFactory {
    private static final Logger log = LoggerFactory.getLogger(ObjectStoreFactory.class);

    public static final String LOCAL = "local";
    public static final String S3 = "s3";

    private final Function<FiledropProperties.S3, S3Client> s3ClientFactory;

    public ObjectStoreFactory() {
        this(ObjectStoreFactory::buildS3Client);
    }

    /** Lets tests hand in a mocked client. */
    ObjectStoreFactory(Function<FiledropProperties.S3, S3Client> s3ClientFactory) {
        this.s3ClientFactory = s3ClientFactory;
    }

    public ObjectStore create(FiledropProperties.Storage storage) {
        String provider = storage.getProvider() == null ? LOCAL : storage.getProvider().trim().toLowerCase(Locale.ROOT);
        log.info("Initializing storage provider: {}", provider);
        return switch (provider) {
            case LOCAL -> createLocal(storage);
            case S3 -> createS3(storage.getS3());
            default -> throw new StoreConfigurationException(
                    "Unknown storage provider '" + storage.getProvider() + "'. Supported: '" + LOCAL + "', '" + S3 + "'");
        };
    }

    private ObjectStore createLocal(FiledropProperties.Storage storage) {
        String folder = storage.getFolder();
        if (folder == null || folder.isBlank()) {
            throw new StoreConfigurationException("filedrop.storage.folder is required for the local provider");
        }
        return new LocalFsObjectStore(Path.of(folder).toAbsolutePath());
    }

    private ObjectStore createS3(FiledropProperties.S3 s3) {
        if (s3.getBucket() == null || s3.getBucket().isBlank()) {
            throw new StoreConfigurationException("filedrop.storage.s3.bucket is required for the s3 provider");
        }
        S3Client client;
        try {
            client = s3ClientFactory.apply(s3);
        } catch (RuntimeException e) {
            throw new StoreConfigurationException("Failed to build S3 client for bucket " + s3.getBucket(), e);
        }
        S3ObjectStore store = new S3ObjectStore(client, s3.getBucket(), s3.getFilePrefix(), s3.getMetadataPrefix());
        store.verifyBucket(s3.isCreateBucketIfNotExists());
        return store;
    }

    static S3Client buildS3Client(FiledropProperties.S3 props) {
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(props.getRegion()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(props.isPathStyleAccess())
                                .build()
                );

        if (props.getEndpoint() != null && !props.getEndpoint().isBlank()) {
            b = b.endpointOverride(URI.create(props.getEndpoint()));
        }

        return b.build();
    }
}
