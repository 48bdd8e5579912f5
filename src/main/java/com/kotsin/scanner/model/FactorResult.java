package com.kotsin.scanner.model;

import com.kotsin.scanner.config.ProcessingConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * FactorResult - Outcome of one confluence factor evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactorResult {

    private ConfluenceFactor factor;
    private boolean passed;
    private int weight;
    private String reason;

    public static FactorResult pass(ConfluenceFactor factor, String reason) {
        return FactorResult.builder()
                .factor(factor)
                .passed(true)
                .reason(reason)
                .build();
    }

    public static FactorResult fail(ConfluenceFactor factor, String reason) {
        return FactorResult.builder()
                .factor(factor)
                .passed(false)
                .reason(reason)
                .build();
    }

    /**
     * Points contributed to the weighted score (weight x 10 when passed).
     */
    public int getPoints() {
        return passed ? weight * ProcessingConstants.POINTS_PER_WEIGHT : 0;
    }

    public String toLogString() {
        return (passed ? "PASS" : "FAIL") + " | factor=" + factor + " | weight=" + weight
                + (reason != null ? " | reason=" + reason : "");
    }
}
