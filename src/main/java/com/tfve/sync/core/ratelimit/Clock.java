package com.tfve.sync.core.ratelimit;

/**
 * Monotonic time source for rate limiting, injectable so tests can control time.
 */
@FunctionalInterface
public interface Clock {
    long nowNanos();
}
