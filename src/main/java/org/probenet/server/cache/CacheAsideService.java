package org.probenet.server.cache;

import io.vertx.core.Future;
import org.probenet.server.json.JacksonMapper;
import org.probenet.server.log.ConditionalLogger;
import org.probenet.server.log.Logger;
import org.probenet.server.log.LoggerFactory;
import org.probenet.server.metric.MetricName;
import org.probenet.server.metric.Metrics;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Cache-aside access to a {@link CacheStore}: read, compute on miss, write back.
 * <p>
 * Cache failures never reach the caller. A failed read is a miss, a failed write still returns the computed
 * value. Only a failure of the value supplier itself fails the returned future.
 */
public class CacheAsideService {

    private static final Logger logger = LoggerFactory.getLogger(CacheAsideService.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    private static final long LOG_PERIOD_SECONDS = 10L;

    private final CacheStore cacheStore;
    private final JacksonMapper mapper;
    private final Metrics metrics;
    private final int ttlSeconds;

    public CacheAsideService(CacheStore cacheStore, JacksonMapper mapper, Metrics metrics, int ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("Cache ttl must be positive");
        }

        this.cacheStore = Objects.requireNonNull(cacheStore);
        this.mapper = Objects.requireNonNull(mapper);
        this.metrics = Objects.requireNonNull(metrics);
        this.ttlSeconds = ttlSeconds;
    }

    public <T> Future<T> get(String key, Class<T> type, Supplier<Future<T>> valueSupplier) {
        return readCached(key, type)
                .compose(cached -> cached != null
                        ? Future.succeededFuture(cached)
                        : computeAndCache(key, valueSupplier));
    }

    private <T> Future<T> readCached(String key, Class<T> type) {
        return invoke(() -> cacheStore.get(key))
                .map(value -> value != null ? mapper.decodeValue(value, type) : null)
                .onSuccess(value -> metrics.updateCacheReadMetric(value != null ? MetricName.hit : MetricName.miss))
                .recover(error -> {
                    handleCacheError("Failed to get cached value for key %s".formatted(key), error);
                    metrics.updateCacheReadMetric(MetricName.err);
                    return Future.succeededFuture();
                });
    }

    private <T> Future<T> computeAndCache(String key, Supplier<Future<T>> valueSupplier) {
        return invoke(valueSupplier)
                .compose(value -> writeCached(key, value).map(ignored -> value));
    }

    private Future<Void> writeCached(String key, Object value) {
        return invoke(() -> cacheStore.set(key, mapper.encodeToString(value), ttlSeconds))
                .onSuccess(ignored -> metrics.updateCacheWriteMetric(true))
                .recover(error -> {
                    handleCacheError("Failed to cache value for key %s with ttl %d".formatted(key, ttlSeconds), error);
                    metrics.updateCacheWriteMetric(false);
                    return Future.succeededFuture();
                });
    }

    private static <T> Future<T> invoke(Supplier<Future<T>> supplier) {
        try {
            final Future<T> future = supplier.get();
            return future != null ? future : Future.failedFuture(new IllegalStateException("No future returned"));
        } catch (Exception e) {
            return Future.failedFuture(e);
        }
    }

    private static void handleCacheError(String message, Throwable error) {
        conditionalLogger.warn(
                error.getClass().getName(),
                "%s: %s".formatted(message, error.getMessage()),
                LOG_PERIOD_SECONDS,
                TimeUnit.SECONDS);
        logger.debug(message, error);
    }
}
