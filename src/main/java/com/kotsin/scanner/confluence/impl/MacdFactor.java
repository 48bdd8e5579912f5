package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.IndicatorSnapshot;
import org.springframework.stereotype.Component;

/**
 * MacdFactor - MACD above signal with a positive histogram for longs; the mirror for shorts.
 */
@Component
public class MacdFactor implements ConfluenceFactorEvaluator {

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.MACD;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        if (!context.hasIndicators() || context.getIndicators().getMacd() == null) {
            return FactorResult.fail(getFactor(), "MACD not available");
        }
        IndicatorSnapshot.Macd macd = context.getIndicators().getMacd();
        boolean aligned = context.getCandidate().getDirection() == Direction.BULLISH
                ? macd.macd() > macd.signal() && macd.histogram() > 0
                : macd.macd() < macd.signal() && macd.histogram() < 0;
        String detail = String.format("macd=%.4f signal=%.4f hist=%.4f", macd.macd(), macd.signal(), macd.histogram());
        return aligned
                ? FactorResult.pass(getFactor(), detail)
                : FactorResult.fail(getFactor(), detail);
    }
}
