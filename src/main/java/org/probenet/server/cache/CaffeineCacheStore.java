package org.probenet.server.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.vertx.core.Future;

import java.util.concurrent.TimeUnit;

/**
 * In-memory cache backend with per-entry expiration.
 */
public class CaffeineCacheStore implements CacheStore {

    private final Cache<String, CachedValue> cache;

    public CaffeineCacheStore(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }

        cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .maximumSize(size)
                .build();
    }

    @Override
    public Future<String> get(String key) {
        final CachedValue cachedValue = cache.getIfPresent(key);
        return Future.succeededFuture(cachedValue != null ? cachedValue.value() : null);
    }

    @Override
    public Future<Void> set(String key, String value, int ttlSeconds) {
        if (ttlSeconds <= 0) {
            return Future.failedFuture(new IllegalArgumentException("ttl must be positive"));
        }

        cache.put(key, new CachedValue(value, TimeUnit.SECONDS.toNanos(ttlSeconds)));
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> delete(String key) {
        cache.invalidate(key);
        return Future.succeededFuture();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record CachedValue(String value, long ttlNanos) {
    }

    private static class PerEntryExpiry implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
