package org.probenet.server.cache;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class CaffeineCacheStoreTest {

    private CaffeineCacheStore target;

    @BeforeEach
    public void setUp() {
        target = new CaffeineCacheStore(2);
    }

    @Test
    public void creationShouldFailOnNonPositiveSize() {
        assertThatIllegalArgumentException().isThrownBy(() -> new CaffeineCacheStore(0));
    }

    @Test
    public void getShouldReturnNullForAbsentKey() {
        // when
        final Future<String> result = target.get("absent");

        // then
        assertThat(result.succeeded()).isTrue();
        assertThat(result.result()).isNull();
    }

    @Test
    public void getShouldReturnStoredValue() {
        // given
        target.set("key", "value", 60);

        // when
        final Future<String> result = target.get("key");

        // then
        assertThat(result.result()).isEqualTo("value");
    }

    @Test
    public void setShouldFailOnNonPositiveTtl() {
        // when
        final Future<Void> result = target.set("key", "value", 0);

        // then
        assertThat(result.failed()).isTrue();
        assertThat(target.get("key").result()).isNull();
    }

    @Test
    public void deleteShouldRemoveValue() {
        // given
        target.set("key", "value", 60);

        // when
        target.delete("key");

        // then
        assertThat(target.get("key").result()).isNull();
    }

    @Test
    public void setShouldEvictEntriesAboveMaximumSize() {
        // when
        target.set("key1", "value1", 60);
        target.set("key2", "value2", 60);
        target.set("key3", "value3", 60);

        // then
        assertThat(target.size()).isLessThanOrEqualTo(2);
    }
}
