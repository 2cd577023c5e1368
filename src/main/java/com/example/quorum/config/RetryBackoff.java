package com.example.quorum.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between attempts of a task: {@code base * multiplier^(retry-1)}, capped at {@code max}.
 */
public class RetryBackoff {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(200);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(10);

    private final Duration base;
    private final double multiplier;
    private final Duration max;

    public RetryBackoff(Duration base, double multiplier, Duration max) {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("retryBackoff.base must be >= 0: " + base);
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("retryBackoff.multiplier must be >= 1: " + multiplier);
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("retryBackoff.max must be >= base: " + max);
        }
        this.base = base;
        this.multiplier = multiplier;
        this.max = max;
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(DEFAULT_BASE, DEFAULT_MULTIPLIER, DEFAULT_MAX);
    }

    /**
     * No delay between attempts.
     */
    public static RetryBackoff none() {
        return new RetryBackoff(Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry (second attempt)
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = base.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }

    public Duration getBase() {
        return base;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryBackoff that = (RetryBackoff) o;
        return Double.compare(that.multiplier, multiplier) == 0 &&
               Objects.equals(base, that.base) &&
               Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, multiplier, max);
    }

    @Override
    public String toString() {
        return "RetryBackoff{base=" + base + ", multiplier=" + multiplier + ", max=" + max + '}';
    }
}
