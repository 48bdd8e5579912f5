package com.kotsin.scanner.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong();

    @Test
    @DisplayName("Starts full and denies once the budget is spent")
    void testBudgetExhausted() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(3, nanos::get);

        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("Refills continuously over the minute")
    void testRefill() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, nanos::get);
        for (int i = 0; i < 60; i++) {
            limiter.tryAcquire();
        }
        assertFalse(limiter.tryAcquire());

        nanos.addAndGet(Duration.ofSeconds(1).toNanos());

        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("Lowering the budget clamps available tokens")
    void testUpdateBudget() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, nanos::get);

        limiter.updateBudget(15);

        assertEquals(15, limiter.getPermitsPerMinute());
        assertEquals(15.0, limiter.availableTokens(), 1e-9);
    }

    @Test
    @DisplayName("Timed acquire gives up at the deadline")
    void testTimedAcquire_Timeout() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1);
        assertTrue(limiter.tryAcquire());

        assertFalse(limiter.tryAcquire(Duration.ofMillis(20)));
    }

    @Test
    @DisplayName("Rejects a non-positive budget")
    void testInvalidBudget() {
        assertThrows(IllegalArgumentException.class, () -> new TokenBucketRateLimiter(0));
    }
}
