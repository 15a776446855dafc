package org.probenet.server.execution.timeout;

import lombok.Getter;

import java.time.Clock;

/**
 * Single deadline shared by the provider lookups of one geo location request.
 */
public class Timeout {

    private final Clock clock;

    @Getter
    private final long deadline;

    Timeout(Clock clock, long deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Returns amount of time remaining before this {@link Timeout} expires.
     */
    public long remaining() {
        return Math.max(deadline - clock.millis(), 0);
    }
}
