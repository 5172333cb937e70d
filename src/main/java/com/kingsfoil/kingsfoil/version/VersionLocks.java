package com.kingsfoil.kingsfoil.version;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped in-process locks. Mutations of one version are serialized by the version stripe; promotions
 * within one source/variant pair by the variant stripe.
 */
@Component
public class VersionLocks {

    private final ReentrantLock[] versionStripes = newStripes();
    private final ReentrantLock[] variantStripes = newStripes();

    public <T> T withVersionLock(VersionKey key, Supplier<T> action) {
        return withLock(versionStripes[stripe(key.hashCode())], action);
    }

    public <T> T withVariantLock(String sourceCode, String variant, Supplier<T> action) {
        return withLock(variantStripes[stripe(Objects.hash(sourceCode, variant))], action);
    }

    private static <T> T withLock(ReentrantLock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static int stripe(int hash) {
        return Math.floorMod(hash ^ (hash >>> 16), VersionConstants.LOCK_STRIPES);
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] stripes = new ReentrantLock[VersionConstants.LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }
}
