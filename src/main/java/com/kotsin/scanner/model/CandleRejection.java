package com.kotsin.scanner.model;

/**
 * Reason codes for a candle refused by the validator.
 */
public enum CandleRejection {

    NON_NUMERIC("non-numeric"),
    INVALID_OHLC("invalid-ohlc"),
    SUB_MINIMUM_RANGE("sub-minimum-range"),
    OUT_OF_ORDER("out-of-order");

    private final String code;

    CandleRejection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
