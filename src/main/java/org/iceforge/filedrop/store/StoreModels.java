package org.iceforge.filedrop.store;

import java.time.Instant;

public final class StoreModels {

    private StoreModels() {}

    public record KeyPair(String publicKey, String privateKey) {}

    public record StoredObject(byte[] content, String contentType, String originalName) {}

    /** lastAccessed is null until the first successful get. */
    public record AccessTimes(Instant createdAt, Instant lastAccessed) {}
}
