package org.iceforge.filedrop.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-object locks keyed by public key. Two operations on the same object are
 * serialized; operations on different objects only contend when they share a stripe.
 *
 * <p>In-process only. With several service instances on one bucket, the backend's own
 * per-object atomicity is all there is.
 */
public final class ObjectLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public ObjectLocks() {
        this(DEFAULT_STRIPES);
    }

    public ObjectLocks(int stripes) {
        if (stripes < 1) throw new IllegalArgumentException("stripes must be >= 1");
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String publicKey, Supplier<T> action) {
        ReentrantLock lock = stripeFor(publicKey);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String publicKey) {
        return stripes[Math.floorMod(publicKey.hashCode(), stripes.length)];
    }
}
