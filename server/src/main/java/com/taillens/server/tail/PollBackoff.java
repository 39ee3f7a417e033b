/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import java.time.Duration;

/**
 * Adaptive poll interval: the minimum while the file is active, growing
 * geometrically up to a ceiling while it stays idle.
 */
public class PollBackoff {

    private final Duration min;
    private final Duration max;
    private final double multiplier;

    private Duration current;
    private long idleCount;

    public PollBackoff(Duration min, Duration max, double multiplier) {
        this.min = min;
        this.max = max;
        this.multiplier = multiplier;
        this.current = min;
    }

    /** The file changed: back to the minimum interval. */
    public Duration onActivity() {
        idleCount = 0;
        current = min;
        return current;
    }

    /** Nothing happened: grow the interval, capped at the maximum. */
    public Duration onIdle() {
        idleCount++;
        long grown = (long) Math.ceil(current.toMillis() * multiplier);
        current = grown >= max.toMillis() ? max : Duration.ofMillis(grown);
        return current;
    }

    public Duration current() { return current; }

    /** Consecutive idle polls since the last activity. */
    public long idleCount() { return idleCount; }
}
