package com.kotsin.scanner.config;

import java.time.Duration;

/**
 * Central constants for the scanner that are not worth exposing as configuration.
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== SCORING ==========

    public static final double STRAT_BASE_STRENGTH = 50.0;
    public static final double MAX_SCORE = 100.0;
    public static final int POINTS_PER_WEIGHT = 10;

    // ========== FIBONACCI ==========

    public static final double[] FIB_RETRACEMENTS = {0.236, 0.382, 0.5, 0.618, 0.786};
    public static final double[] FIB_EXTENSIONS = {1.27, 1.618, 2.0, 2.618};

    // ========== RETRY CONSTANTS ==========

    public static final int MAX_RETRY_ATTEMPTS = 3;
    public static final long INITIAL_RETRY_DELAY_MS = 100;
    public static final double RETRY_BACKOFF_MULTIPLIER = 2.0;
    public static final long MAX_RETRY_DELAY_MS = 10000;

    // ========== EXECUTORS ==========

    public static final int SCAN_POOL_SIZE = 4;
    public static final int DISPATCH_POOL_SIZE = 2;
    public static final int QUEUE_CAPACITY = 1000;
    public static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    // ========== INBOX ==========

    public static final int INBOX_CAPACITY_PER_SYMBOL = 10_000;
}
