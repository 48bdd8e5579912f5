package com.kotsin.scanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Candle - Validated OHLCV bar for one symbol and interval.
 *
 * Instances are only produced by the CandleValidator, so the OHLC invariants
 * (high >= max(open, close), low <= min(open, close), high > low) always hold.
 * Volume is optional; some feeds do not carry it for every bar.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Candle {

    private final String symbol;
    private final String interval;
    private final long timestamp;   // epoch millis, bar open
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final Double volume;

    public double getRange() {
        return high - low;
    }

    public double getBody() {
        return Math.abs(close - open);
    }

    public boolean hasVolume() {
        return volume != null;
    }

    public double volumeOrZero() {
        return volume != null ? volume : 0.0;
    }

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }

    public Instant getTime() {
        return Instant.ofEpochMilli(timestamp);
    }
}
