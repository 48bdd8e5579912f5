package com.kotsin.scanner.model;

/**
 * ConfluenceFactor - Independent confirmation factors and their default weights.
 *
 * Weight x 10 is the factor's contribution to the weighted score, which is capped at 100.
 */
public enum ConfluenceFactor {

    FIBONACCI(3),
    TREND(2),
    VOLUME(2),
    TECHNICAL_PATTERN(2),
    RSI(1),
    MACD(1);

    private final int defaultWeight;

    ConfluenceFactor(int defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public int getDefaultWeight() {
        return defaultWeight;
    }
}
