package org.probenet.server.cache;

import io.vertx.core.Future;

/**
 * Key-value cache backend holding serialized values. Any operation may fail.
 */
public interface CacheStore {

    /**
     * Returns the cached value or succeeded future with null when the key is absent.
     */
    Future<String> get(String key);

    Future<Void> set(String key, String value, int ttlSeconds);

    Future<Void> delete(String key);
}
