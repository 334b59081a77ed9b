package com.bko.gateway.lock;

import java.time.Duration;

/**
 * Shared key-value store used for session mutual exclusion.
 */
public interface LockStore {

    /**
     * Atomically creates {@code key} with the given expiry if it does not exist.
     *
     * @return {@code true} if the key was created by this call.
     */
    boolean setIfAbsent(String key, Duration ttl);

    /**
     * Deletes {@code key}. Deleting a missing key is not an error.
     */
    void delete(String key);
}
