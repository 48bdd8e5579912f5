package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * PatternCandidate - Detector output in a common shape for confluence scoring and trade levels.
 *
 * anchorPrice is the structural level the stop is placed beyond (point A of an ABCD,
 * the bar2/bar3 extreme of a Strat pattern, the last bar's extreme otherwise).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternCandidate {

    private String symbol;
    private String interval;
    private PatternFamily family;
    private String label;
    private Direction direction;

    private double entryPrice;
    private double anchorPrice;
    private double referencePrice;      // price tested against priceTargets
    @Builder.Default
    private List<Double> priceTargets = new ArrayList<>();
    private double patternRange;

    private double strength;            // 0-100, detector-specific
    private double rewardMultiplier;
    private long timestamp;

    private StratPattern stratPattern;
    private AbcdPattern abcdPattern;
}
