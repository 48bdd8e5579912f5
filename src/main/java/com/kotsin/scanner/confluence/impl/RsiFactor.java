package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * RsiFactor - RSI is oversold or neutral for longs, overbought or neutral for shorts.
 *
 * Bullish passes when RSI &lt; oversold or RSI is strictly between neutralLow and neutralHigh;
 * bearish when RSI &gt; overbought or inside the same neutral band.
 */
@Component
@RequiredArgsConstructor
public class RsiFactor implements ConfluenceFactorEvaluator {

    private final ScannerConfigRegistry configRegistry;

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.RSI;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        if (!context.hasIndicators() || context.getIndicators().getRsi() == null) {
            return FactorResult.fail(getFactor(), "RSI not available");
        }
        ScannerProperties.Confluence config = configRegistry.current().getConfluence();
        double rsi = context.getIndicators().getRsi();

        boolean neutral = rsi > config.getRsiNeutralLow() && rsi < config.getRsiNeutralHigh();
        boolean extreme = context.getCandidate().getDirection() == Direction.BULLISH
                ? rsi < config.getRsiOversold()
                : rsi > config.getRsiOverbought();

        if (extreme || neutral) {
            return FactorResult.pass(getFactor(), String.format("RSI %.1f %s", rsi, extreme ? "extreme" : "neutral"));
        }
        return FactorResult.fail(getFactor(), String.format("RSI %.1f against direction", rsi));
    }
}
