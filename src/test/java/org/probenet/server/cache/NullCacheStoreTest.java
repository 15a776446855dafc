package org.probenet.server.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NullCacheStoreTest {

    private final NullCacheStore target = new NullCacheStore();

    @Test
    public void getShouldAlwaysMissAfterSet() {
        // given
        target.set("key", "value", 60);

        // when and then
        assertThat(target.get("key").result()).isNull();
    }
}
