package org.iceforge.filedrop.store;

/**
 * The backend could not be set up. Raised at startup only.
 */
public class StoreConfigurationException extends RuntimeException {
    public StoreConfigurationException(String message, Throwable cause) { super(message, cause); }
    public StoreConfigurationException(String message) { super(message); }
}
