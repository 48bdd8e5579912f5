package com.kotsin.scanner.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * CircuitBreaker - Stops calling a failing collaborator for a while.
 *
 * States:
 * - CLOSED: calls pass through
 * - OPEN: consecutive failures reached the threshold, calls return the fallback
 * - HALF_OPEN: after the open timeout a limited number of trial calls decide recovery
 */
public class CircuitBreaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final long openTimeoutMs;
    private final int halfOpenMaxCalls;
    private final LongSupplier clock;

    private volatile State state = State.CLOSED;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private final AtomicLong openedTime = new AtomicLong(0);

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong rejectedCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);

    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout, int halfOpenMaxCalls) {
        this(name, failureThreshold, openTimeout, halfOpenMaxCalls, System::currentTimeMillis);
    }

    /**
     * @param clock epoch-millis source, replaceable in tests
     */
    public CircuitBreaker(String name, int failureThreshold, Duration openTimeout, int halfOpenMaxCalls,
                          LongSupplier clock) {
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.openTimeoutMs = openTimeout.toMillis();
        this.halfOpenMaxCalls = halfOpenMaxCalls;
        this.clock = clock;
    }

    /**
     * Execute a call through the circuit breaker.
     *
     * @return the action's result, or the fallback when the circuit is open or the action fails
     */
    public <T> T execute(Supplier<T> action, Supplier<T> fallback) {
        totalCalls.incrementAndGet();
        checkStateTransitions();

        if (state == State.OPEN) {
            rejectedCalls.incrementAndGet();
            LOGGER.debug("[CIRCUIT] '{}' OPEN - rejecting call", name);
            return fallback.get();
        }

        if (state == State.HALF_OPEN && halfOpenCalls.incrementAndGet() > halfOpenMaxCalls) {
            rejectedCalls.incrementAndGet();
            return fallback.get();
        }

        try {
            T result = action.get();
            onSuccess();
            return result;
        } catch (RuntimeException e) {
            onFailure(e);
            return fallback.get();
        }
    }

    public boolean isReady() {
        checkStateTransitions();
        return state != State.OPEN;
    }

    public State getState() {
        checkStateTransitions();
        return state;
    }

    public void reset() {
        state = State.CLOSED;
        failureCount.set(0);
        successCount.set(0);
        halfOpenCalls.set(0);
        LOGGER.info("[CIRCUIT] '{}' manually reset to CLOSED", name);
    }

    private void checkStateTransitions() {
        if (state == State.OPEN && clock.getAsLong() - openedTime.get() >= openTimeoutMs) {
            transitionTo(State.HALF_OPEN);
        }
    }

    private void onSuccess() {
        failureCount.set(0);
        if (state == State.HALF_OPEN && successCount.incrementAndGet() >= halfOpenMaxCalls) {
            transitionTo(State.CLOSED);
        }
    }

    private void onFailure(Exception e) {
        failedCalls.incrementAndGet();
        int failures = failureCount.incrementAndGet();
        LOGGER.warn("[CIRCUIT] '{}' failure #{}: {}", name, failures, e.getMessage());

        if (state == State.HALF_OPEN || failures >= failureThreshold) {
            transitionTo(State.OPEN);
        }
    }

    private synchronized void transitionTo(State newState) {
        State oldState = this.state;
        if (oldState == newState) {
            return;
        }
        this.state = newState;
        switch (newState) {
            case OPEN -> {
                openedTime.set(clock.getAsLong());
                halfOpenCalls.set(0);
                successCount.set(0);
                LOGGER.warn("[CIRCUIT] '{}' OPENED after {} failures", name, failureCount.get());
            }
            case HALF_OPEN -> {
                halfOpenCalls.set(0);
                successCount.set(0);
                LOGGER.info("[CIRCUIT] '{}' HALF_OPEN - testing recovery", name);
            }
            case CLOSED -> {
                failureCount.set(0);
                LOGGER.info("[CIRCUIT] '{}' CLOSED - collaborator recovered", name);
            }
        }
    }

    public String getStats() {
        return String.format("CircuitBreaker '%s': state=%s, total=%d, failed=%d, rejected=%d",
                name, state, totalCalls.get(), failedCalls.get(), rejectedCalls.get());
    }
}
