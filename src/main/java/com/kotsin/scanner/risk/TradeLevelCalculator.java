package com.kotsin.scanner.risk;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.AccountContext;
import com.kotsin.scanner.model.ConfluenceResult;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.SessionInfo;
import com.kotsin.scanner.model.TechnicalPattern;
import com.kotsin.scanner.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * TradeLevelCalculator - Converts a scored candidate into stop, target and position size.
 *
 * Stop:
 * - ANCHOR: anchor -/+ anchor x stopBuffer (below for longs, above for shorts)
 * - ATR: entry -/+ ATR x atrStopMultiplier, pattern range when ATR is unavailable
 *
 * Target: entry +/- |entry - stop| x reward multiplier.
 *
 * Size: equity x maxRiskFraction x session risk multiplier / |entry - stop|, clamped to
 * equity x maxPositionFraction / entry.
 *
 * A zero risk distance, or a stop on the wrong side of entry, yields no levels.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeLevelCalculator {

    private final ScannerConfigRegistry configRegistry;

    public Optional<TradeLevels> calculate(PatternCandidate candidate, IndicatorSnapshot indicators,
                                           AccountContext account, SessionInfo session) {
        ScannerProperties.Risk config = configRegistry.current().getRisk();
        double entry = candidate.getEntryPrice();
        double sign = candidate.getDirection().sign();

        double stop = stopFor(candidate, indicators, config);
        double riskPerUnit = Math.abs(entry - stop);

        if (!MathUtils.isValidNumber(stop) || MathUtils.isZero(riskPerUnit) || sign * (entry - stop) <= 0) {
            log.warn("[RISK] {} {} degenerate levels: entry={} stop={} policy={}, dropping",
                    candidate.getSymbol(), candidate.getLabel(), entry, stop, config.getStopPolicy());
            return Optional.empty();
        }

        double takeProfit = entry + sign * riskPerUnit * candidate.getRewardMultiplier();

        double riskBudget = account.getEquity() * account.getMaxRiskFraction() * session.getRiskMultiplier();
        double size = riskBudget / riskPerUnit;
        double maxSize = account.getEquity() * account.getMaxPositionFraction() / entry;
        size = Math.min(size, maxSize);

        if (!MathUtils.isValidNumber(size) || size <= 0) {
            log.warn("[RISK] {} {} non-positive position size {} (equity={}, riskPerUnit={}), dropping",
                    candidate.getSymbol(), candidate.getLabel(), size, account.getEquity(), riskPerUnit);
            return Optional.empty();
        }

        return Optional.of(TradeLevels.builder()
                .entryPrice(entry)
                .stopLoss(stop)
                .takeProfit(takeProfit)
                .positionSize(size)
                .riskPerUnit(riskPerUnit)
                .riskRewardRatio(Math.abs(takeProfit - entry) / riskPerUnit)
                .stopPolicy(config.getStopPolicy())
                .build());
    }

    /**
     * Confidence = weighted score / 100, plus the recency bonus when a technical pattern in the
     * same direction completed within the last recencyBars bars; capped at 1.0.
     */
    public double confidence(ConfluenceResult confluence, Direction direction,
                             List<TechnicalPattern> recentPatterns, int snapshotSize) {
        ScannerProperties.Risk config = configRegistry.current().getRisk();
        double confidence = MathUtils.clampConfidence(confluence.getWeightedScore() / 100.0);

        int firstRecentIndex = snapshotSize - config.getRecencyBars();
        boolean recentAgreement = recentPatterns.stream()
                .anyMatch(p -> p.getDirection() == direction && p.getBarIndex() >= firstRecentIndex);
        if (recentAgreement) {
            confidence = Math.min(1.0, confidence + config.getRecencyBonus());
        }
        return confidence;
    }

    private static double stopFor(PatternCandidate candidate, IndicatorSnapshot indicators,
                                  ScannerProperties.Risk config) {
        double sign = candidate.getDirection().sign();
        if (config.getStopPolicy() == StopPolicy.ATR) {
            Double atr = indicators != null ? indicators.getAtr() : null;
            double distance = atr != null && atr > 0 ? atr : candidate.getPatternRange();
            return candidate.getEntryPrice() - sign * distance * config.getAtrStopMultiplier();
        }
        double anchor = candidate.getAnchorPrice();
        return anchor - sign * anchor * config.getStopBuffer();
    }
}
