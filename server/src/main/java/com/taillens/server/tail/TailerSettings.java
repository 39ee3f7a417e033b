/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable tailer configuration. Use {@link #builder(Path)}.
 */
public final class TailerSettings {

    private final Path path;
    private final int capacity;
    private final Duration minPollInterval;
    private final Duration maxPollInterval;
    private final double backoffMultiplier;
    private final Duration missingFileInterval;
    private final Duration errorCooldown;
    private final Duration shutdownTimeout;

    private TailerSettings(Builder b) {
        this.path = b.path;
        this.capacity = b.capacity;
        this.minPollInterval = b.minPollInterval;
        this.maxPollInterval = b.maxPollInterval;
        this.backoffMultiplier = b.backoffMultiplier;
        this.missingFileInterval = b.missingFileInterval;
        this.errorCooldown = b.errorCooldown;
        this.shutdownTimeout = b.shutdownTimeout;
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    public Path path() { return path; }

    /** Lines kept on (re)load and records kept in the cache; {@code 0} = unbounded. */
    public int capacity() { return capacity; }

    public Duration minPollInterval() { return minPollInterval; }

    public Duration maxPollInterval() { return maxPollInterval; }

    public double backoffMultiplier() { return backoffMultiplier; }

    public Duration missingFileInterval() { return missingFileInterval; }

    public Duration errorCooldown() { return errorCooldown; }

    public Duration shutdownTimeout() { return shutdownTimeout; }

    @Override
    public String toString() {
        return "TailerSettings{path=" + path + ", capacity=" + capacity
                + ", poll=" + minPollInterval.toMillis() + ".." + maxPollInterval.toMillis() + "ms x" + backoffMultiplier
                + ", missingFileInterval=" + missingFileInterval.toMillis() + "ms"
                + ", errorCooldown=" + errorCooldown.toMillis() + "ms}";
    }

    public static final class Builder {
        private final Path path;
        private int capacity = 10_000;
        private Duration minPollInterval = Duration.ofMillis(100);
        private Duration maxPollInterval = Duration.ofSeconds(10);
        private double backoffMultiplier = 1.5;
        private Duration missingFileInterval = Duration.ofSeconds(5);
        private Duration errorCooldown = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        private Builder(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder capacity(int capacity) { this.capacity = capacity; return this; }
        public Builder minPollInterval(Duration d) { this.minPollInterval = d; return this; }
        public Builder maxPollInterval(Duration d) { this.maxPollInterval = d; return this; }
        public Builder backoffMultiplier(double m) { this.backoffMultiplier = m; return this; }
        public Builder missingFileInterval(Duration d) { this.missingFileInterval = d; return this; }
        public Builder errorCooldown(Duration d) { this.errorCooldown = d; return this; }
        public Builder shutdownTimeout(Duration d) { this.shutdownTimeout = d; return this; }

        public TailerSettings build() {
            if (capacity < 0) {
                throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
            }
            requirePositive("minPollInterval", minPollInterval);
            requirePositive("maxPollInterval", maxPollInterval);
            requirePositive("missingFileInterval", missingFileInterval);
            requirePositive("errorCooldown", errorCooldown);
            requirePositive("shutdownTimeout", shutdownTimeout);
            if (maxPollInterval.compareTo(minPollInterval) < 0) {
                throw new IllegalArgumentException("maxPollInterval " + maxPollInterval
                        + " is below minPollInterval " + minPollInterval);
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
            }
            return new TailerSettings(this);
        }

        private static void requirePositive(String name, Duration d) {
            if (d == null || d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be positive, got " + d);
            }
        }
    }
}
