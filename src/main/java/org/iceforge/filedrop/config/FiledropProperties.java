package org.iceforge.filedrop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Service configuration under {@code filedrop.*}.
 * <p>
 * Defaults run a local store under {@code ./storage} with no extra setup.
 */
@ConfigurationProperties(prefix = "filedrop")
public class FiledropProperties {

    private final Storage storage = new Storage();
    private final Limits limits = new Limits();
    private final Cleanup cleanup = new Cleanup();

    public Storage getStorage() {
        return storage;
    }

    public Limits getLimits() {
        return limits;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public static class Storage {

        /** Backend: "local" or "s3". */
        private String provider = "local";

        /** Root folder for the local backend, relative paths resolve against the working directory. */
        private String folder = "./storage";

        private final S3 s3 = new S3();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getFolder() {
            return folder;
        }

        public void setFolder(String folder) {
            this.folder = folder;
        }

        public S3 getS3() {
            return s3;
        }
    }

    public static class S3 {

        private String bucket;

        private String region = "us-east-1";

        /** Override for S3-compatible stores (MinIO, LocalStack, ...). */
        private String endpoint;

        private boolean pathStyleAccess;

        private String filePrefix = "files/";

        private String metadataPrefix = "metadata/";

        private boolean createBucketIfNotExists;

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public String getFilePrefix() {
            return filePrefix;
        }

        public void setFilePrefix(String filePrefix) {
            this.filePrefix = filePrefix;
        }

        public String getMetadataPrefix() {
            return metadataPrefix;
        }

        public void setMetadataPrefix(String metadataPrefix) {
            this.metadataPrefix = metadataPrefix;
        }

        public boolean isCreateBucketIfNotExists() {
            return createBucketIfNotExists;
        }

        public void setCreateBucketIfNotExists(boolean createBucketIfNotExists) {
            this.createBucketIfNotExists = createBucketIfNotExists;
        }
    }

    public static class Limits {

        /** Daily upload ceiling per origin, in bytes. */
        private long uploadBytes = 100L * 1024 * 1024;

        /** Daily download ceiling per origin, in bytes. */
        private long downloadBytes = 500L * 1024 * 1024;

        /** How often counters from previous days are dropped. */
        private Duration reclaimInterval = Duration.ofHours(1);

        public long getUploadBytes() {
            return uploadBytes;
        }

        public void setUploadBytes(long uploadBytes) {
            this.uploadBytes = uploadBytes;
        }

        public long getDownloadBytes() {
            return downloadBytes;
        }

        public void setDownloadBytes(long downloadBytes) {
            this.downloadBytes = downloadBytes;
        }

        public Duration getReclaimInterval() {
            return reclaimInterval;
        }

        public void setReclaimInterval(Duration reclaimInterval) {
            this.reclaimInterval = reclaimInterval;
        }
    }

    public static class Cleanup {

        private boolean enabled = true;

        /** Objects not read for this many days are removed. */
        private int inactivityDays = 30;

        private int intervalHours = 24;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getInactivityDays() {
            return inactivityDays;
        }

        public void setInactivityDays(int inactivityDays) {
            this.inactivityDays = inactivityDays;
        }

        public int getIntervalHours() {
            return intervalHours;
        }

        public void setIntervalHours(int intervalHours) {
            this.intervalHours = intervalHours;
        }

        public Duration inactivityPeriod() {
            return Duration.ofDays(inactivityDays);
        }

        public Duration interval() {
            return Duration.ofHours(intervalHours);
        }
    }
}
