package com.kotsin.scanner.technical;

import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.SwingPoint;
import com.kotsin.scanner.model.TechnicalPattern;
import com.kotsin.scanner.model.TechnicalPatternType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * TechnicalPatternDetector - Detects candlestick and chart patterns on a history snapshot.
 *
 * Detects:
 * 1. Candlestick patterns on each of the most recent bars: Engulfing, Doji, Hammer, Shooting Star
 * 2. Chart patterns from local extrema: Double Top/Bottom, Head &amp; Shoulders (and inverse)
 * 3. Triangles from the slopes of the last highs and lows
 *
 * A pattern's barIndex is the bar that completes (or confirms) it. Chart patterns are
 * confirmed {@code extremumLookback} bars after their last extremum.
 */
@Component
@Slf4j
public class TechnicalPatternDetector {

    private static final String LOG_PREFIX = "[TECH-PATTERN]";

    @Value("${pattern.candlestick.scan-bars:10}")
    private int candlestickScanBars = 10;

    @Value("${pattern.doji.body.ratio:0.1}")
    private double dojiBodyRatio = 0.1;

    @Value("${pattern.extremum.lookback:3}")
    private int extremumLookback = 3;

    @Value("${pattern.equal.level.tolerance:0.01}")
    private double equalLevelTolerance = 0.01;

    @Value("${pattern.triangle.bars:10}")
    private int triangleBars = 10;

    @Value("${pattern.triangle.flat.slope:0.001}")
    private double flatSlope = 0.001;

    /**
     * All patterns found in the snapshot, ordered by completing bar.
     */
    public List<TechnicalPattern> detect(List<Candle> snapshot) {
        List<TechnicalPattern> patterns = new ArrayList<>();
        if (snapshot == null || snapshot.size() < 2) {
            return patterns;
        }

        int from = Math.max(1, snapshot.size() - candlestickScanBars);
        for (int i = from; i < snapshot.size(); i++) {
            detectCandlestickPatterns(snapshot, i, patterns);
        }
        detectDoublePatterns(snapshot, patterns);
        detectHeadAndShoulders(snapshot, patterns);
        detectTriangles(snapshot, patterns);

        patterns.sort((a, b) -> Integer.compare(a.getBarIndex(), b.getBarIndex()));
        if (!patterns.isEmpty() && log.isDebugEnabled()) {
            log.debug("{} {} detected {} patterns: {}", LOG_PREFIX, snapshot.get(snapshot.size() - 1).getSymbol(),
                    patterns.size(), patterns.stream().map(TechnicalPattern::getName).toList());
        }
        return patterns;
    }

    /**
     * Candlestick patterns completing at one bar.
     */
    public List<TechnicalPattern> detectAt(List<Candle> snapshot, int index) {
        List<TechnicalPattern> patterns = new ArrayList<>();
        if (snapshot != null && index >= 1 && index < snapshot.size()) {
            detectCandlestickPatterns(snapshot, index, patterns);
        }
        return patterns;
    }

    // ==================== CANDLESTICK PATTERNS ====================

    private void detectCandlestickPatterns(List<Candle> data, int index, List<TechnicalPattern> patterns) {
        Candle current = data.get(index);
        Candle prev = data.get(index - 1);

        double body = current.getBody();
        double range = current.getRange();
        if (range <= 0) {
            return;
        }
        double bodyRatio = body / range;
        double upperWick = current.getHigh() - Math.max(current.getOpen(), current.getClose());
        double lowerWick = Math.min(current.getOpen(), current.getClose()) - current.getLow();

        // Bullish Engulfing: bullish body swallows the previous bearish body
        if (current.isBullish() && prev.isBearish()
                && current.getOpen() <= prev.getClose() && current.getClose() >= prev.getOpen()
                && body > prev.getBody()) {
            patterns.add(pattern(TechnicalPatternType.BULLISH_ENGULFING, "Bullish Engulfing", Direction.BULLISH,
                    index, current, Math.min(0.85, 0.5 + 0.1 * body / Math.max(prev.getBody(), 1e-9)),
                    "Bullish candle engulfs previous bearish candle"));
        }

        // Bearish Engulfing
        if (current.isBearish() && prev.isBullish()
                && current.getOpen() >= prev.getClose() && current.getClose() <= prev.getOpen()
                && body > prev.getBody()) {
            patterns.add(pattern(TechnicalPatternType.BEARISH_ENGULFING, "Bearish Engulfing", Direction.BEARISH,
                    index, current, Math.min(0.85, 0.5 + 0.1 * body / Math.max(prev.getBody(), 1e-9)),
                    "Bearish candle engulfs previous bullish candle"));
        }

        // Doji: indecision, read as a reversal against the preceding move
        if (bodyRatio < dojiBodyRatio) {
            patterns.add(pattern(TechnicalPatternType.DOJI, "Doji", priorMoveReversal(data, index),
                    index, current, 0.7 - bodyRatio, "Small body relative to range"));
        }

        // Hammer: long lower wick, small body near the top
        if (current.isBullish() && range > 3 * body && lowerWick > 2 * upperWick && bodyRatio >= dojiBodyRatio) {
            patterns.add(pattern(TechnicalPatternType.HAMMER, "Hammer", Direction.BULLISH,
                    index, current, Math.min(0.8, lowerWick / range), "Buying pressure at the lows"));
        }

        // Shooting Star: long upper wick, small body near the bottom
        if (current.isBearish() && range > 3 * body && upperWick > 2 * lowerWick && bodyRatio >= dojiBodyRatio) {
            patterns.add(pattern(TechnicalPatternType.SHOOTING_STAR, "Shooting Star", Direction.BEARISH,
                    index, current, Math.min(0.8, upperWick / range), "Selling pressure at the highs"));
        }
    }

    private Direction priorMoveReversal(List<Candle> data, int index) {
        int lookback = Math.min(5, index);
        double change = data.get(index).getClose() - data.get(index - lookback).getClose();
        if (change < 0) {
            return Direction.BULLISH;
        } else if (change > 0) {
            return Direction.BEARISH;
        }
        return null;
    }

    // ==================== CHART PATTERNS ====================

    private void detectDoublePatterns(List<Candle> data, List<TechnicalPattern> patterns) {
        List<SwingPoint> extrema = extrema(data);
        for (int i = 2; i < extrema.size(); i++) {
            SwingPoint first = extrema.get(i - 2);
            SwingPoint middle = extrema.get(i - 1);
            SwingPoint second = extrema.get(i);
            if (first.getKind() != second.getKind() || middle.getKind() == second.getKind()) {
                continue;
            }
            if (Math.abs(first.getPrice() - second.getPrice()) / first.getPrice() >= equalLevelTolerance) {
                continue;
            }
            int confirmIndex = Math.min(data.size() - 1, second.getIndex() + extremumLookback);
            if (second.isHigh()) {
                patterns.add(pattern(TechnicalPatternType.DOUBLE_TOP, "Double Top", Direction.BEARISH,
                        confirmIndex, data.get(confirmIndex), 0.8, "Two matching highs around a trough"));
            } else {
                patterns.add(pattern(TechnicalPatternType.DOUBLE_BOTTOM, "Double Bottom", Direction.BULLISH,
                        confirmIndex, data.get(confirmIndex), 0.8, "Two matching lows around a peak"));
            }
        }
    }

    private void detectHeadAndShoulders(List<Candle> data, List<TechnicalPattern> patterns) {
        List<SwingPoint> extrema = extrema(data);
        List<SwingPoint> highs = extrema.stream().filter(SwingPoint::isHigh).toList();
        List<SwingPoint> lows = extrema.stream().filter(s -> !s.isHigh()).toList();

        for (int i = 2; i < highs.size(); i++) {
            SwingPoint left = highs.get(i - 2);
            SwingPoint head = highs.get(i - 1);
            SwingPoint right = highs.get(i);
            if (head.getPrice() > left.getPrice() && head.getPrice() > right.getPrice()
                    && Math.abs(left.getPrice() - right.getPrice()) / left.getPrice() < equalLevelTolerance * 3) {
                int confirmIndex = Math.min(data.size() - 1, right.getIndex() + extremumLookback);
                patterns.add(pattern(TechnicalPatternType.HEAD_AND_SHOULDERS, "Head and Shoulders",
                        Direction.BEARISH, confirmIndex, data.get(confirmIndex), 0.85,
                        "Higher peak between two matching shoulders"));
            }
        }
        for (int i = 2; i < lows.size(); i++) {
            SwingPoint left = lows.get(i - 2);
            SwingPoint head = lows.get(i - 1);
            SwingPoint right = lows.get(i);
            if (head.getPrice() < left.getPrice() && head.getPrice() < right.getPrice()
                    && Math.abs(left.getPrice() - right.getPrice()) / left.getPrice() < equalLevelTolerance * 3) {
                int confirmIndex = Math.min(data.size() - 1, right.getIndex() + extremumLookback);
                patterns.add(pattern(TechnicalPatternType.INVERSE_HEAD_AND_SHOULDERS, "Inverse Head and Shoulders",
                        Direction.BULLISH, confirmIndex, data.get(confirmIndex), 0.85,
                        "Lower trough between two matching shoulders"));
            }
        }
    }

    private void detectTriangles(List<Candle> data, List<TechnicalPattern> patterns) {
        if (data.size() < triangleBars) {
            return;
        }
        List<Candle> recent = data.subList(data.size() - triangleBars, data.size());
        double avgPrice = recent.stream().mapToDouble(Candle::getClose).average().orElse(0);
        if (avgPrice <= 0) {
            return;
        }
        double highSlope = slope(recent.stream().mapToDouble(Candle::getHigh).toArray()) / avgPrice;
        double lowSlope = slope(recent.stream().mapToDouble(Candle::getLow).toArray()) / avgPrice;
        int last = data.size() - 1;

        if (Math.abs(highSlope) < flatSlope && lowSlope > flatSlope) {
            patterns.add(pattern(TechnicalPatternType.ASCENDING_TRIANGLE, "Ascending Triangle", Direction.BULLISH,
                    last, data.get(last), 0.75, "Flat resistance with rising lows"));
        }
        if (highSlope < -flatSlope && Math.abs(lowSlope) < flatSlope) {
            patterns.add(pattern(TechnicalPatternType.DESCENDING_TRIANGLE, "Descending Triangle", Direction.BEARISH,
                    last, data.get(last), 0.75, "Flat support with falling highs"));
        }
    }

    // ==================== HELPER METHODS ====================

    /**
     * Local extrema with a short lookback, chronological.
     */
    private List<SwingPoint> extrema(List<Candle> data) {
        List<SwingPoint> points = new ArrayList<>();
        for (int i = extremumLookback; i < data.size() - extremumLookback; i++) {
            boolean high = true;
            boolean low = true;
            for (int j = i - extremumLookback; j <= i + extremumLookback; j++) {
                if (j == i) {
                    continue;
                }
                high &= data.get(j).getHigh() < data.get(i).getHigh();
                low &= data.get(j).getLow() > data.get(i).getLow();
            }
            if (high) {
                points.add(SwingPoint.builder().index(i).price(data.get(i).getHigh())
                        .timestamp(data.get(i).getTimestamp()).kind(SwingPoint.Kind.HIGH).build());
            } else if (low) {
                points.add(SwingPoint.builder().index(i).price(data.get(i).getLow())
                        .timestamp(data.get(i).getTimestamp()).kind(SwingPoint.Kind.LOW).build());
            }
        }
        return points;
    }

    /**
     * Least-squares slope of values against their index.
     */
    static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : values) {
            meanY += v;
        }
        meanY /= n;
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            num += (i - meanX) * (values[i] - meanY);
            den += (i - meanX) * (i - meanX);
        }
        return den == 0 ? 0 : num / den;
    }

    private static TechnicalPattern pattern(TechnicalPatternType type, String name, Direction direction,
                                            int index, Candle candle, double confidence, String description) {
        return TechnicalPattern.builder()
                .type(type)
                .name(name)
                .direction(direction)
                .barIndex(index)
                .timestamp(candle.getTimestamp())
                .confidence(Math.max(0, Math.min(1, confidence)))
                .description(description)
                .build();
    }
}
