package org.iceforge.filedrop.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON form of {@link ObjectMetadata}: ISO-8601 timestamps, explicit {@code null} for a
 * never-read object.
 */
public final class MetadataCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private MetadataCodec() {}

    public static byte[] encode(ObjectMetadata m) {
        try {
            return MAPPER.writeValueAsBytes(m);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode metadata for " + ObjectKeys.abbreviate(m.publicKey()), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the bytes are not JSON or a required field is missing
     */
    public static ObjectMetadata decode(byte[] json) {
        ObjectMetadata m;
        try {
            m = MAPPER.readValue(json, ObjectMetadata.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid metadata document", e);
        }
        if (m == null) throw new IllegalArgumentException("Empty metadata document");
        if (m.publicKey() == null || m.publicKey().isBlank()) throw new IllegalArgumentException("Metadata without publicKey");
        if (m.privateKey() == null || m.privateKey().isBlank()) throw new IllegalArgumentException("Metadata without privateKey");
        if (m.createdAt() == null) throw new IllegalArgumentException("Metadata without createdAt");
        return m;
    }
}
