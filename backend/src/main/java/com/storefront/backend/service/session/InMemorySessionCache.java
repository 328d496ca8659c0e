package com.storefront.backend.service.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Single-node session cache for development and tests, backed by Caffeine.
 * Each entry expires after its own TTL, measured on the injected clock;
 * expired entries behave as absent and are evicted during cache maintenance.
 */
public class InMemorySessionCache implements SessionCache {

    private final Cache<String, Entry> entries;

    public InMemorySessionCache(Clock clock) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.entries = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public void put(String key, SessionRecord record, Duration ttl) {
        entries.put(key, new Entry(record, ttl == null ? Long.MAX_VALUE : ttl.toNanos()));
    }

    @Override
    public Optional<SessionRecord> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::record);
    }

    @Override
    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    @Override
    public Optional<SessionRecord> take(String key) {
        return Optional.ofNullable(entries.asMap().remove(key)).map(Entry::record);
    }

    /**
     * Live entries, after evicting everything that has expired.
     */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private record Entry(SessionRecord record, long ttlNanos) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
