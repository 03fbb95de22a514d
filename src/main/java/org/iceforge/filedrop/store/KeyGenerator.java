package org.iceforge.filedrop.store;

@FunctionalInterface
public interface KeyGenerator {

    /**
     * Two independent, unguessable keys. The public key grants read access, the private key
     * grants delete access.
     */
    StoreModels.KeyPair generate();
}
