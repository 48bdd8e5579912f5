package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * StratPattern - 3-bar Strat pattern matched on two consecutive bar-type transitions.
 *
 * strength is the raw pattern score (base 50 plus family bonuses), confidence is the
 * score after the confidence pass. Both are on a 0-100 scale.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StratPattern {

    public enum Family {
        REVERSAL,
        INSIDE_BREAKOUT,
        OUTSIDE_CONTINUATION
    }

    private String sequenceLabel;       // e.g. "2D->2U"
    private BarType firstTransition;
    private BarType secondTransition;
    private Family family;
    private Direction direction;
    private double strength;
    private double confidence;

    private Candle bar1;
    private Candle bar2;
    private Candle bar3;
}
