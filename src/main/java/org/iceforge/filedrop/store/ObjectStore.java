package org.iceforge.filedrop.store;

import java.time.Instant;
import java.util.List;

/**
 * Key-addressed blob storage. Content lives under the public key; the metadata record is
 * readable under both keys and every change to it is mirrored to both copies before the call
 * returns.
 */
public interface ObjectStore {

    // Upload
    StoreModels.KeyPair put(byte[] content, String originalName, String contentType);

    // Download, updates lastAccessed on success
    StoreModels.StoredObject get(String publicKey);

    // Delete, false when nothing is stored under the key
    boolean delete(String privateKey);

    // Metadata under either key
    StoreModels.AccessTimes getMetadata(String key);

    // Private keys of objects whose lastAccessed (or createdAt) is strictly before cutoff
    List<String> listInactiveSince(Instant cutoff);

    /** Short backend name for logs and the health endpoint. */
    String describe();
}
