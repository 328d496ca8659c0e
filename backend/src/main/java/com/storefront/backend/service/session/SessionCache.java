package com.storefront.backend.service.session;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store holding the "this token is live" records.
 *
 * <p>Writes overwrite by key. Implementations throw
 * {@link com.storefront.backend.exception.SessionCacheUnavailableException}
 * when the backing store cannot be reached.
 */
public interface SessionCache {

    /**
     * @param ttl entry lifetime, or {@code null} for no explicit expiry
     */
    void put(String key, SessionRecord record, Duration ttl);

    Optional<SessionRecord> get(String key);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Atomically reads and removes an entry. At most one concurrent caller
     * receives the record.
     */
    Optional<SessionRecord> take(String key);
}
