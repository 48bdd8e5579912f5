package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AbcdPattern - Harmonic four-swing structure with Fibonacci leg proportions.
 *
 * Lifecycle:
 * - Created by AbcdPatternDetector once the leg ratios validate
 * - Scored by the confluence scorer (strength, confluence flags)
 * - Retained in the ActivePatternStore while signal-eligible, until superseded or expired
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AbcdPattern {

    private String symbol;

    private SwingPoint a;
    private SwingPoint b;
    private SwingPoint c;
    private SwingPoint d;

    private double abLength;
    private double bcLength;
    private double cdLength;

    private double bcRetracement;   // bcLength / abLength
    private double abcdRatio;       // cdLength / abLength
    private double extensionLevel;  // 1.618, 1.27 or 1.0

    private FibonacciTargets fibonacciTargets;
    private Direction direction;

    // Confluence flags, filled after scoring
    private boolean fibonacciConfluence;
    private boolean trendAlignment;
    private boolean volumeConfirmation;
    private boolean technicalConfirmation;

    private double strength;        // 0-100
    private int confluenceCount;

    public String getLabel() {
        return "ABCD " + (direction == Direction.BULLISH ? "Bullish" : "Bearish");
    }

    /**
     * Widest price swing covered by the pattern, used as a volatility proxy.
     */
    public double getPatternRange() {
        double hi = Math.max(Math.max(a.getPrice(), b.getPrice()), Math.max(c.getPrice(), d.getPrice()));
        double lo = Math.min(Math.min(a.getPrice(), b.getPrice()), Math.min(c.getPrice(), d.getPrice()));
        return hi - lo;
    }
}
