package com.mimecast.warden.loop;

import java.time.Duration;

/**
 * Reconnect delay with doubling backoff.
 * <p>The wait before each retry is:
 * <pre>
 *     wait = min(initial * 2 ^ consecutive_failures, max)
 * </pre>
 * <p>Example with initial 60 seconds and max 3600 seconds:
 * <ul>
 *     <li>Retry 1: 60 seconds</li>
 *     <li>Retry 2: 120 seconds</li>
 *     <li>Retry 3: 240 seconds</li>
 *     <li>Retry 7 onwards: 3600 seconds</li>
 * </ul>
 * <p>Not thread-safe.
 */
public class Backoff {

    private final Duration initial;
    private final Duration max;
    private Duration current;

    /**
     * Constructs a new Backoff instance.
     *
     * @param initial First delay.
     * @param max     Upper bound.
     */
    public Backoff(Duration initial, Duration max) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Max delay must not be below initial delay");
        }
        this.initial = initial;
        this.max = max;
        this.current = initial;
    }

    /**
     * Gets the delay to wait now and doubles the next one, capped.
     *
     * @return Delay.
     */
    public Duration next() {
        Duration delay = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return delay;
    }

    /**
     * Goes back to the initial delay.
     */
    public void reset() {
        current = initial;
    }

    public Duration getCurrent() {
        return current;
    }

    public Duration getInitial() {
        return initial;
    }

    public Duration getMax() {
        return max;
    }
}
