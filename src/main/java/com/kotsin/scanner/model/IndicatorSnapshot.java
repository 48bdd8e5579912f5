package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * IndicatorSnapshot - Technical indicator values for the most recent bar of a history window.
 *
 * Every value is nullable: an indicator whose lookback is longer than the window is absent,
 * and confluence factors that depend on it fail rather than guess.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorSnapshot {

    public record Macd(double macd, double signal, double histogram) {
    }

    public record Bollinger(double upper, double middle, double lower) {
    }

    private String symbol;
    private String interval;
    private long timestamp;

    private Map<Integer, Double> emas;  // period -> value
    private Double rsi;
    private Macd macd;
    private Double volumeSma;
    private Bollinger bollinger;
    private Double atr;

    public Double ema(int period) {
        return emas != null ? emas.get(period) : null;
    }
}
