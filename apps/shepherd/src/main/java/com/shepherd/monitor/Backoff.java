package com.shepherd.monitor;

import java.time.Duration;

/** Exponential delay between failed analysis rounds, capped at {@code max}. */
public final class Backoff {

    private final Duration initial;
    private final Duration max;
    private final double multiplier;
    private int failures;

    public Backoff(Duration initial, Duration max, double multiplier) {
        this.initial = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
        this.multiplier = Math.max(1.0, multiplier);
    }

    /** Delay to wait after one more consecutive failure. */
    public Duration nextDelay() {
        double millis = initial.toMillis() * Math.pow(multiplier, failures);
        failures++;
        long capped = (long) Math.min(millis, (double) max.toMillis());
        return Duration.ofMillis(capped);
    }

    public void reset() {
        failures = 0;
    }

    public int failures() {
        return failures;
    }
}
