package org.iceforge.filedrop.store;

public class InvalidKeyException extends RuntimeException {
    public InvalidKeyException(String message) { super(message); }
}
