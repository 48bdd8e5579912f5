package com.kotsin.scanner.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitBreaker")
class CircuitBreakerTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        breaker = new CircuitBreaker("indicators", 3, Duration.ofSeconds(30), 2, now::get);
    }

    private String fail() {
        return breaker.execute(() -> {
            throw new IllegalStateException("down");
        }, () -> "fallback");
    }

    private String succeed() {
        return breaker.execute(() -> "value", () -> "fallback");
    }

    @Test
    @DisplayName("Opens after consecutive failures and serves the fallback")
    void testOpensAfterThreshold() {
        fail();
        fail();
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());

        fail();
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.isReady());
        assertEquals("fallback", succeed());
        assertEquals("CircuitBreaker 'indicators': state=OPEN, total=4, failed=3, rejected=1", breaker.getStats());
    }

    @Test
    @DisplayName("A success resets the failure streak")
    void testSuccessResetsCount() {
        fail();
        fail();
        succeed();
        fail();
        fail();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("Half-open trial calls close the circuit again")
    void testHalfOpenRecovery() {
        fail();
        fail();
        fail();
        now.addAndGet(Duration.ofSeconds(30).toMillis());

        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertEquals("value", succeed());
        assertEquals("value", succeed());
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    @DisplayName("A half-open failure reopens the circuit")
    void testHalfOpenFailure() {
        fail();
        fail();
        fail();
        now.addAndGet(Duration.ofSeconds(31).toMillis());

        fail();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }
}
