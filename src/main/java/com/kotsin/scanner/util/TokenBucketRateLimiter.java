package com.kotsin.scanner.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * TokenBucketRateLimiter - Per-minute call budget shared by all scan workers.
 *
 * The bucket holds at most {@code permitsPerMinute} tokens and refills continuously.
 * The budget can be changed at runtime (session changes); the current token count is
 * clamped to the new capacity.
 */
@Slf4j
public class TokenBucketRateLimiter {

    private static final long NANOS_PER_MINUTE = Duration.ofMinutes(1).toNanos();

    private final LongSupplier nanoClock;
    private int permitsPerMinute;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int permitsPerMinute) {
        this(permitsPerMinute, System::nanoTime);
    }

    public TokenBucketRateLimiter(int permitsPerMinute, LongSupplier nanoClock) {
        if (permitsPerMinute < 1) {
            throw new IllegalArgumentException("permitsPerMinute must be positive: " + permitsPerMinute);
        }
        this.nanoClock = nanoClock;
        this.permitsPerMinute = permitsPerMinute;
        this.tokens = permitsPerMinute;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Take a permit if one is available right now.
     */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    /**
     * Wait up to {@code timeout} for a permit.
     *
     * @return false if no permit became available in time or the thread was interrupted
     */
    public boolean tryAcquire(Duration timeout) {
        long deadline = nanoClock.getAsLong() + timeout.toNanos();
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return true;
                }
                waitNanos = (long) ((1.0 - tokens) * NANOS_PER_MINUTE / permitsPerMinute);
            }
            long remaining = deadline - nanoClock.getAsLong();
            if (remaining <= 0) {
                return false;
            }
            try {
                Thread.sleep(Math.max(1, Math.min(waitNanos, remaining) / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    public synchronized void updateBudget(int newPermitsPerMinute) {
        if (newPermitsPerMinute < 1 || newPermitsPerMinute == permitsPerMinute) {
            return;
        }
        refill();
        log.info("[RATE-LIMIT] Budget changed {} -> {} permits/min", permitsPerMinute, newPermitsPerMinute);
        permitsPerMinute = newPermitsPerMinute;
        tokens = Math.min(tokens, newPermitsPerMinute);
    }

    public synchronized int getPermitsPerMinute() {
        return permitsPerMinute;
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(permitsPerMinute, tokens + (double) elapsed * permitsPerMinute / NANOS_PER_MINUTE);
            lastRefillNanos = now;
        }
    }
}
