package org.iceforge.filedrop.store;

public class ObjectNotFoundException extends RuntimeException {
    private final String key;

    public ObjectNotFoundException(String key) {
        super("No object stored under key " + ObjectKeys.abbreviate(key));
        this.key = key;
    }

    public String key() { return key; }
}
