package org.iceforge.filedrop.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * The metadata document stored once under each of an object's two keys. Field names are the
 * on-disk JSON names and must stay stable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectMetadata(
        String publicKey,
        String privateKey,
        String originalName,
        String mimeType,
        Instant createdAt,
        Instant lastAccessed,
        long fileSize
) {

    public static ObjectMetadata created(StoreModels.KeyPair keys, String originalName, String mimeType,
                                         Instant createdAt, long fileSize) {
        return new ObjectMetadata(keys.publicKey(), keys.privateKey(), originalName, mimeType,
                createdAt, null, fileSize);
    }

    /**
     * Copy with {@code lastAccessed} set to {@code now}, nudged past {@code createdAt} when the
     * clock has not moved since the object was written.
     */
    public ObjectMetadata accessedAt(Instant now) {
        Instant at = now.isAfter(createdAt) ? now : createdAt.plusNanos(1_000);
        return new ObjectMetadata(publicKey, privateKey, originalName, mimeType, createdAt, at, fileSize);
    }

    /** lastAccessed when set, else createdAt. */
    @JsonIgnore
    public Instant referenceTime() {
        return lastAccessed != null ? lastAccessed : createdAt;
    }

    @JsonIgnore
    public boolean isInactiveSince(Instant cutoff) {
        return referenceTime().isBefore(cutoff);
    }

    @JsonIgnore
    public StoreModels.AccessTimes accessTimes() {
        return new StoreModels.AccessTimes(createdAt, lastAccessed);
    }
}
