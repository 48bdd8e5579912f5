package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.config.ProcessingConstants;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.util.MathUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * FibonacciFactor - Reference price sits on a Fibonacci level.
 *
 * Candidates carrying their own projected levels (ABCD) are tested against those. Any other
 * candidate is tested against the retracement levels of the swing range made by the bars
 * before its pattern window.
 */
@Component
@RequiredArgsConstructor
public class FibonacciFactor implements ConfluenceFactorEvaluator {

    /** Bars that belong to the pattern itself and are left out of the swing range */
    private static final int PATTERN_WINDOW = 3;

    private final ScannerConfigRegistry configRegistry;

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.FIBONACCI;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        ScannerProperties.Confluence config = configRegistry.current().getConfluence();
        PatternCandidate candidate = context.getCandidate();
        double price = candidate.getReferencePrice();

        List<Double> levels = candidate.getPriceTargets().isEmpty()
                ? retracementLevels(context, config.getFibSwingLookback())
                : candidate.getPriceTargets();
        if (levels.isEmpty()) {
            return FactorResult.fail(getFactor(), "No swing range for Fibonacci levels");
        }

        for (double level : levels) {
            if (MathUtils.withinTolerance(price, level, config.getFibTolerance(), price)) {
                return FactorResult.pass(getFactor(), String.format("%.2f near level %.2f", price, level));
            }
        }
        return FactorResult.fail(getFactor(), String.format("%.2f not within %.1f%% of any level",
                price, config.getFibTolerance() * 100));
    }

    /**
     * Retracements of the high-low range over the lookback bars ending before the pattern window.
     * Bullish levels are measured down from the high, bearish levels up from the low.
     */
    static List<Double> retracementLevels(ConfluenceContext context, int lookback) {
        int end = context.getCandidateIndex() + 1 - PATTERN_WINDOW;
        int start = Math.max(0, end - lookback);
        if (end - start < 2) {
            return List.of();
        }
        double high = Double.NEGATIVE_INFINITY;
        double low = Double.POSITIVE_INFINITY;
        for (Candle c : context.getSnapshot().subList(start, end)) {
            high = Math.max(high, c.getHigh());
            low = Math.min(low, c.getLow());
        }
        double range = high - low;
        if (range <= 0) {
            return List.of();
        }
        boolean bullish = context.getCandidate().getDirection() == Direction.BULLISH;
        List<Double> levels = new ArrayList<>();
        for (double r : ProcessingConstants.FIB_RETRACEMENTS) {
            levels.add(bullish ? high - range * r : low + range * r);
        }
        return levels;
    }
}
