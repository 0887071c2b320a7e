package com.flamingo.ai.researchchat.security;

import java.time.Instant;

/**
 * Outcome of a rate limit check.
 *
 * @param allowed whether the request was admitted
 * @param remaining requests left in the window
 * @param resetAt when the window resets
 * @param retryAfterSeconds whole seconds until reset, at least 1 when rejected
 */
public record RateLimitDecision(
    boolean allowed, int remaining, Instant resetAt, long retryAfterSeconds) {}
