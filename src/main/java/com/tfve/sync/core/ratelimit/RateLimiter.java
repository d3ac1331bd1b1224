package com.tfve.sync.core.ratelimit;

/**
 * Bounds outbound API requests.
 *
 * <p>Callers ask for a permit before every HTTP request. A rejected request is not a failure: the caller
 * waits {@link RateLimitResult#retryAfter()} and asks again for the same request.</p>
 *
 * <p>Pure contract: no I/O, no threads, never blocks. One instance is shared by every client in the
 * process.</p>
 */
public interface RateLimiter {

    RateLimitResult tryAcquire();
}
