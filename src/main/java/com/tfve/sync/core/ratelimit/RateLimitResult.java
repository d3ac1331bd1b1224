package com.tfve.sync.core.ratelimit;

import java.time.Duration;

/**
 * Answer of {@link RateLimiter#tryAcquire()}.
 *
 * @param decision whether a permit was taken
 * @param retryAfterNanos minimum wait before a permit is available, 0 when allowed
 */
public record RateLimitResult(Decision decision, long retryAfterNanos) {

    public static RateLimitResult allow() {
        return new RateLimitResult(Decision.ALLOW, 0L);
    }

    public static RateLimitResult reject(long retryAfterNanos) {
        return new RateLimitResult(Decision.REJECT, Math.max(1L, retryAfterNanos));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }

    public Duration retryAfter() {
        return Duration.ofNanos(retryAfterNanos);
    }
}
