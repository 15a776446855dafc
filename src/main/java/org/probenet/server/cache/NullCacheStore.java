package org.probenet.server.cache;

import io.vertx.core.Future;

/**
 * Cache backend that never stores anything, used when caching is disabled.
 */
public class NullCacheStore implements CacheStore {

    @Override
    public Future<String> get(String key) {
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> set(String key, String value, int ttlSeconds) {
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> delete(String key) {
        return Future.succeededFuture();
    }
}
