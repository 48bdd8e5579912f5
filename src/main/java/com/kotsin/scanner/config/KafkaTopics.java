package com.kotsin.scanner.config;

/**
 * KafkaTopics - Centralized Kafka topic name constants
 *
 * All topic names should be defined here to avoid scattered string literals.
 */
public final class KafkaTopics {

    private KafkaTopics() {} // Prevent instantiation

    // ========== Input ==========
    public static final String SCANNER_CANDLES = "scanner-candles";

    // ========== Output ==========
    public static final String TRADE_SIGNALS = "trade-signals";
}
