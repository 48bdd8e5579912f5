package com.kotsin.scanner.confluence.impl;

import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.TechnicalPattern;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * TechnicalPatternFactor - A candlestick or chart pattern in the same direction completes
 * on the candidate bar.
 */
@Component
public class TechnicalPatternFactor implements ConfluenceFactorEvaluator {

    @Override
    public ConfluenceFactor getFactor() {
        return ConfluenceFactor.TECHNICAL_PATTERN;
    }

    @Override
    public FactorResult evaluate(ConfluenceContext context) {
        long timestamp = context.getCandidate().getTimestamp();
        Optional<TechnicalPattern> match = context.getTechnicalPatterns().stream()
                .filter(p -> p.getTimestamp() == timestamp)
                .filter(p -> p.getDirection() == context.getCandidate().getDirection())
                .findFirst();
        return match
                .map(p -> FactorResult.pass(getFactor(), p.getName() + " on candidate bar"))
                .orElseGet(() -> FactorResult.fail(getFactor(), "No agreeing pattern on candidate bar"));
    }
}
