package com.tfve.sync.core.ratelimit;

import java.time.Duration;

/**
 * Token bucket allowing {@code permits} requests per {@code window}.
 *
 * <ul>
 *   <li>Starts full, so a run may burst up to {@code permits} requests.</li>
 *   <li>Refills continuously at {@code permits / window}.</li>
 * </ul>
 *
 * Thread-safety: token accounting is synchronized, so concurrent callers never spend the same token.
 */
public final class TokenBucket implements RateLimiter {
    private final Clock clock;
    private final long capacity;
    private final double refillPerNanos;

    private double tokens;
    private long lastNanos;

    public TokenBucket(Clock clock, long permits, Duration window) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (permits <= 0) throw new IllegalArgumentException("permits <= 0");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0");
        }
        this.clock = clock;
        this.capacity = permits;
        this.refillPerNanos = (double) permits / window.toNanos();
        this.tokens = permits;
        this.lastNanos = clock.nowNanos();
    }

    @Override
    public synchronized RateLimitResult tryAcquire() {
        refill();

        if (tokens >= 1d) {
            tokens -= 1d;
            return RateLimitResult.allow();
        }

        double missing = 1d - tokens;
        long retryAfter = (long) Math.ceil(missing / refillPerNanos);
        return RateLimitResult.reject(retryAfter);
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = Math.max(0L, now - lastNanos);
        if (elapsed == 0) return;

        tokens = Math.min(capacity, tokens + elapsed * refillPerNanos);
        lastNanos = now;
    }
}
