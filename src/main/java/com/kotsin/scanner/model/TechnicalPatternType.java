package com.kotsin.scanner.model;

public enum TechnicalPatternType {
    BULLISH_ENGULFING,
    BEARISH_ENGULFING,
    DOJI,
    HAMMER,
    SHOOTING_STAR,
    DOUBLE_TOP,
    DOUBLE_BOTTOM,
    HEAD_AND_SHOULDERS,
    INVERSE_HEAD_AND_SHOULDERS,
    ASCENDING_TRIANGLE,
    DESCENDING_TRIANGLE
}
