package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.IndicatorSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * TrendFactor - Price and the EMA ladder are stacked in the trade direction.
 * Bullish: price > EMA20 > EMA50 > EMA100. Bearish is the mirror.
 */
@Component
@RequiredArgsConstructor
public class TrendFactor implements ConfluenceFactorEvaluator {

    private final ScannerConfigRegistry configRegistry;

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.TREND;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        if (!context.hasIndicators()) {
            return FactorResult.fail(getFactor(), "Indicators not available");
        }
        IndicatorSnapshot indicators = context.getIndicators();
        List<Integer> periods = configRegistry.current().getConfluence().getEmaPeriods();
        double sign = context.getCandidate().getDirection() == Direction.BULLISH ? 1 : -1;

        double previous = context.getCandidate().getEntryPrice();
        for (int period : periods) {
            Double ema = indicators.ema(period);
            if (ema == null) {
                return FactorResult.fail(getFactor(), "EMA" + period + " not available");
            }
            if (sign * (previous - ema) <= 0) {
                return FactorResult.fail(getFactor(), String.format("EMA ladder broken at EMA%d (%.2f vs %.2f)",
                        period, previous, ema));
            }
            previous = ema;
        }
        return FactorResult.pass(getFactor(), "EMA ladder aligned " + periods);
    }
}
