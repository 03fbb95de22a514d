package org.iceforge.filedrop.store;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 256-bit keys drawn from {@link SecureRandom}, hex encoded. Lowercase hex is safe as a file
 * name on case-insensitive filesystems and as an S3 key.
 */
public final class SecureRandomKeyGenerator implements KeyGenerator {

    static final int KEY_BYTES = 32;

    private final SecureRandom random;

    public SecureRandomKeyGenerator() {
        this(new SecureRandom());
    }

    SecureRandomKeyGenerator(SecureRandom random) {
        this.random = random;
    }

    @Override
    public StoreModels.KeyPair generate() {
        return new StoreModels.KeyPair(nextKey(), nextKey());
    }

    private String nextKey() {
        byte[] bytes = new byte[KEY_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
