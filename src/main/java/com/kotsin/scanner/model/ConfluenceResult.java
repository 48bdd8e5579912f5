package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * ConfluenceResult - Aggregate of all factor evaluations for one candidate.
 *
 * eligible is true only when satisfiedCount reaches the configured minimum AND the
 * weighted score reaches the configured floor. A high score never compensates for a
 * missing factor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfluenceResult {

    private int satisfiedCount;
    private double weightedScore;       // 0-100
    @Builder.Default
    private List<FactorResult> breakdown = new ArrayList<>();
    private int minimumRequired;
    private double minimumScore;
    private boolean eligible;

    public boolean isSatisfied(ConfluenceFactor factor) {
        return breakdown.stream().anyMatch(r -> r.getFactor() == factor && r.isPassed());
    }

    public String toLogString() {
        return String.format("confluence=%d/%d score=%.1f (min %d, %.1f) eligible=%s",
                satisfiedCount, breakdown.size(), weightedScore, minimumRequired, minimumScore, eligible);
    }
}
