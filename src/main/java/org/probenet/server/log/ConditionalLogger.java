package org.probenet.server.log;

import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Suppresses repeated messages: a message with the given key is emitted at most once per period.
 */
public class ConditionalLogger {

    private static final int CACHE_MAXIMUM_SIZE = 10_000;
    private static final int EXPIRE_CACHE_DURATION = 1;

    private final Logger logger;
    private final Clock clock;

    private final ConcurrentMap<String, Long> keyToNextLogTime;

    public ConditionalLogger(Logger logger, Clock clock) {
        this.logger = Objects.requireNonNull(logger);
        this.clock = Objects.requireNonNull(clock);

        keyToNextLogTime = Caffeine.newBuilder()
                .maximumSize(CACHE_MAXIMUM_SIZE)
                .expireAfterWrite(EXPIRE_CACHE_DURATION, TimeUnit.HOURS)
                .<String, Long>build()
                .asMap();
    }

    public ConditionalLogger(Logger logger) {
        this(logger, Clock.systemUTC());
    }

    public void warn(String key, String message, long duration, TimeUnit unit) {
        log(key, duration, unit, logger -> logger.warn(message));
    }

    /**
     * Calls {@link Consumer} if the period for the specified key has elapsed since its last call.
     */
    private void log(String key, long duration, TimeUnit unit, Consumer<Logger> consumer) {
        final long currentTime = clock.millis();
        final Long nextLogTime = keyToNextLogTime.get(key);

        if (nextLogTime == null) {
            if (keyToNextLogTime.putIfAbsent(key, currentTime + unit.toMillis(duration)) == null) {
                consumer.accept(logger);
            }
        } else if (currentTime >= nextLogTime
                && keyToNextLogTime.replace(key, nextLogTime, currentTime + unit.toMillis(duration))) {
            consumer.accept(logger);
        }
    }
}
