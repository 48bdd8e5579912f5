package com.kotsin.scanner.model;

/**
 * MarketSession - Time-of-day regime in US Eastern time.
 */
public enum MarketSession {

    PREMARKET("Premarket trading session"),
    INTRADAY("Regular market hours"),
    AFTERHOURS("After-hours trading"),
    CLOSED("Market closed");

    private final String description;

    MarketSession(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTrading() {
        return this != CLOSED;
    }
}
