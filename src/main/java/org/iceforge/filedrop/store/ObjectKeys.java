package org.iceforge.filedrop.store;

import java.util.regex.Pattern;

/**
 * Checks applied to caller-supplied keys before any backend I/O.
 */
public final class ObjectKeys {

    public static final int MAX_LENGTH = 128;

    // Keys end up as file names and object-store keys, so no separators or dots.
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private ObjectKeys() {}

    public static String requireValid(String key, String what) {
        if (key == null || key.isBlank()) {
            throw new InvalidKeyException(what + " is required");
        }
        if (key.length() > MAX_LENGTH) {
            throw new InvalidKeyException(what + " is longer than " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(key).matches()) {
            throw new InvalidKeyException(what + " contains illegal characters");
        }
        return key;
    }

    /** Shortened form for log lines; private keys must not be logged in full. */
    public static String abbreviate(String key) {
        if (key == null) return "null";
        return key.length() <= 8 ? key : key.substring(0, 8) + "...";
    }
}
