package com.kotsin.scanner.config;

import com.kotsin.scanner.model.ConfluenceFactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator for scanner properties.
 *
 * Collects every problem rather than stopping at the first one, so a bad
 * configuration is reported in full. Used at startup (fail fast) and on every reload.
 */
@Component
@Slf4j
public class ConfigurationValidator {

    /**
     * Validate and return all errors found. Empty list means the configuration is usable.
     */
    public List<String> validate(ScannerProperties props) {
        List<String> errors = new ArrayList<>();
        if (props == null) {
            errors.add("scanner configuration is missing");
            return errors;
        }

        validateWatchlist(props.getWatchlist(), errors);
        validateHistory(props.getHistory(), props.getHarmonic(), errors);
        validateStrat(props.getStrat(), errors);
        validateHarmonic(props.getHarmonic(), errors);
        validateConfluence(props.getConfluence(), errors);
        validateSessions(props.getSession(), errors);
        validateRisk(props.getRisk(), errors);
        validateThrottle(props.getThrottle(), errors);
        validateIndicator(props.getIndicator(), errors);

        return errors;
    }

    /**
     * Validate and throw if anything is wrong.
     *
     * @throws IllegalStateException listing every error
     */
    public void validateOrThrow(ScannerProperties props) {
        List<String> errors = validate(props);
        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", errors));
        }
    }

    private void validateWatchlist(ScannerProperties.Watchlist watchlist, List<String> errors) {
        if (watchlist.getSymbols() == null || watchlist.getSymbols().isEmpty()) {
            errors.add("scanner.watchlist.symbols must not be empty");
        } else if (watchlist.getSymbols().stream().anyMatch(this::isNullOrEmpty)) {
            errors.add("scanner.watchlist.symbols contains a blank symbol");
        }
        if (isNullOrEmpty(watchlist.getInterval())) {
            errors.add("scanner.watchlist.interval is not configured");
        }
    }

    private void validateHistory(ScannerProperties.History history, ScannerProperties.Harmonic harmonic,
                                 List<String> errors) {
        if (history.getMaxLength() < 3) {
            errors.add("scanner.history.max-length must be at least 3, was " + history.getMaxLength());
        }
        if (history.getMaxLength() < harmonic.getMinHistory()) {
            errors.add("scanner.history.max-length (" + history.getMaxLength()
                    + ") is shorter than scanner.harmonic.min-history (" + harmonic.getMinHistory() + ")");
        }
        if (history.getMinBarRange() < 0) {
            errors.add("scanner.history.min-bar-range must not be negative");
        }
    }

    private void validateStrat(ScannerProperties.Strat strat, List<String> errors) {
        if (strat.getMinStrength() < 0 || strat.getMinStrength() > 100) {
            errors.add("scanner.strat.min-strength must be in [0, 100]");
        }
        if (strat.getRewardMultiplier() <= 0) {
            errors.add("scanner.strat.reward-multiplier must be positive");
        }
        if (strat.getStopRangeFraction() < 0) {
            errors.add("scanner.strat.stop-range-fraction must not be negative");
        }
    }

    private void validateHarmonic(ScannerProperties.Harmonic h, List<String> errors) {
        if (h.getSwingLookback() < 1) {
            errors.add("scanner.harmonic.swing-lookback must be at least 1");
        }
        if (h.getMinHistory() < 2 * h.getSwingLookback() + 1) {
            errors.add("scanner.harmonic.min-history must cover at least one full swing window");
        }
        if (h.getMaxGroups() < 1) {
            errors.add("scanner.harmonic.max-groups must be at least 1");
        }
        if (h.getMinSwingSize() < 0) {
            errors.add("scanner.harmonic.min-swing-size must not be negative");
        }
        if (h.getBcRetracementMin() <= 0 || h.getBcRetracementMin() >= h.getBcRetracementMax()) {
            errors.add("scanner.harmonic bc-retracement bounds must satisfy 0 < min < max");
        }
        if (h.getAbcdRatioMin() <= 0 || h.getAbcdRatioMin() >= h.getAbcdRatioMax()) {
            errors.add("scanner.harmonic abcd-ratio bounds must satisfy 0 < min < max");
        }
        if (h.getMinStrength() < 0 || h.getMinStrength() > h.getStrengthCap() || h.getStrengthCap() > 100) {
            errors.add("scanner.harmonic strength bounds must satisfy 0 <= min-strength <= strength-cap <= 100");
        }
        if (isNotPositive(h.getMaxPatternAge())) {
            errors.add("scanner.harmonic.max-pattern-age must be positive");
        }
        if (isNotPositive(h.getActivePatternTtl())) {
            errors.add("scanner.harmonic.active-pattern-ttl must be positive");
        }
        if (h.getRewardMultiplier() <= 0) {
            errors.add("scanner.harmonic.reward-multiplier must be positive");
        }
    }

    private void validateConfluence(ScannerProperties.Confluence c, List<String> errors) {
        int factorCount = ConfluenceFactor.values().length;
        if (c.getMinConfluence() < 1 || c.getMinConfluence() > factorCount) {
            errors.add("scanner.confluence.min-confluence must be in [1, " + factorCount + "], was "
                    + c.getMinConfluence());
        }
        if (c.getMinWeightedScore() < 0 || c.getMinWeightedScore() > 100) {
            errors.add("scanner.confluence.min-weighted-score must be in [0, 100]");
        }
        ScannerProperties.Weights w = c.getWeights();
        if (w == null) {
            errors.add("scanner.confluence.weights is missing");
        } else {
            for (ConfluenceFactor factor : ConfluenceFactor.values()) {
                if (w.weightOf(factor) < 0) {
                    errors.add("scanner.confluence.weights." + factor.name().toLowerCase() + " must not be negative");
                }
            }
            if (w.total() == 0) {
                errors.add("scanner.confluence.weights must not all be zero");
            }
        }
        if (c.getFibTolerance() <= 0 || c.getFibTolerance() >= 1) {
            errors.add("scanner.confluence.fib-tolerance must be in (0, 1)");
        }
        List<Integer> emas = c.getEmaPeriods();
        if (emas == null || emas.size() < 2) {
            errors.add("scanner.confluence.ema-periods needs at least two periods");
        } else {
            for (int i = 1; i < emas.size(); i++) {
                if (emas.get(i) <= emas.get(i - 1)) {
                    errors.add("scanner.confluence.ema-periods must be strictly increasing");
                    break;
                }
            }
        }
        if (c.getVolumeMultiplier() <= 0) {
            errors.add("scanner.confluence.volume-multiplier must be positive");
        }
        if (!(c.getRsiOversold() < c.getRsiNeutralLow()
                && c.getRsiNeutralLow() < c.getRsiNeutralHigh()
                && c.getRsiNeutralHigh() < c.getRsiOverbought())) {
            errors.add("scanner.confluence RSI bands must satisfy oversold < neutral-low < neutral-high < overbought");
        }
        if (c.getFibSwingLookback() < 2) {
            errors.add("scanner.confluence.fib-swing-lookback must be at least 2");
        }
    }

    private void validateSessions(ScannerProperties.Sessions s, List<String> errors) {
        try {
            ZoneId.of(s.getZone());
        } catch (DateTimeException | NullPointerException e) {
            errors.add("scanner.session.zone is not a valid time zone: " + s.getZone());
        }
        if (s.getPremarketStart() == null || s.getIntradayStart() == null
                || s.getAfterhoursStart() == null || s.getAfterhoursEnd() == null) {
            errors.add("scanner.session boundary times must all be set");
        } else if (!(s.getPremarketStart().isBefore(s.getIntradayStart())
                && s.getIntradayStart().isBefore(s.getAfterhoursStart())
                && s.getAfterhoursStart().isBefore(s.getAfterhoursEnd()))) {
            errors.add("scanner.session boundaries must be ordered premarket < intraday < afterhours < end");
        }
        validateSessionParameters("premarket", s.getPremarket(), errors);
        validateSessionParameters("intraday", s.getIntraday(), errors);
        validateSessionParameters("afterhours", s.getAfterhours(), errors);
        validateSessionParameters("closed", s.getClosed(), errors);

        if (s.getGapThreshold() <= 0) {
            errors.add("scanner.session.gap-threshold must be positive");
        }
        if (s.getMomentumMinBars() < 1 || s.getMomentumMinBars() > s.getMomentumBars()) {
            errors.add("scanner.session momentum bars must satisfy 1 <= min-bars <= bars");
        }
        if (s.getReversalRangeRatio() <= 0) {
            errors.add("scanner.session.reversal-range-ratio must be positive");
        }
        if (s.getFamilyBaseStrength() < 0 || s.getFamilyBaseStrength() > 100) {
            errors.add("scanner.session.family-base-strength must be in [0, 100]");
        }
        if (s.getRewardMultiplier() <= 0) {
            errors.add("scanner.session.reward-multiplier must be positive");
        }
    }

    private void validateSessionParameters(String name, ScannerProperties.SessionParameters p, List<String> errors) {
        String prefix = "scanner.session." + name;
        if (p == null) {
            errors.add(prefix + " is missing");
            return;
        }
        if (isNotPositive(p.getScanInterval())) {
            errors.add(prefix + ".scan-interval must be positive");
        }
        if (p.getRiskMultiplier() < 0 || p.getRiskMultiplier() > 1) {
            errors.add(prefix + ".risk-multiplier must be in [0, 1]");
        }
        if (p.getApiBudgetPerMinute() < 1) {
            errors.add(prefix + ".api-budget-per-minute must be at least 1");
        }
    }

    private void validateRisk(ScannerProperties.Risk r, List<String> errors) {
        if (r.getStopPolicy() == null) {
            errors.add("scanner.risk.stop-policy is not configured");
        }
        if (r.getStopBuffer() < 0 || r.getStopBuffer() >= 1) {
            errors.add("scanner.risk.stop-buffer must be in [0, 1)");
        }
        if (r.getAtrStopMultiplier() <= 0) {
            errors.add("scanner.risk.atr-stop-multiplier must be positive");
        }
        if (r.getRecencyBonus() < 0 || r.getRecencyBonus() > 1) {
            errors.add("scanner.risk.recency-bonus must be in [0, 1]");
        }
        if (r.getRecencyBars() < 0) {
            errors.add("scanner.risk.recency-bars must not be negative");
        }
        ScannerProperties.Account a = r.getAccount();
        if (a.getEquity() <= 0) {
            errors.add("scanner.risk.account.equity must be positive");
        }
        if (a.getMaxRiskFraction() <= 0 || a.getMaxRiskFraction() > 1) {
            errors.add("scanner.risk.account.max-risk-fraction must be in (0, 1]");
        }
        if (a.getMaxPositionFraction() <= 0 || a.getMaxPositionFraction() > 1) {
            errors.add("scanner.risk.account.max-position-fraction must be in (0, 1]");
        }
    }

    private void validateThrottle(ScannerProperties.Throttle t, List<String> errors) {
        if (t.getMaxSignalsPerDay() < 1) {
            errors.add("scanner.throttle.max-signals-per-day must be at least 1");
        }
        if (t.getCooldown() == null || t.getCooldown().isNegative()) {
            errors.add("scanner.throttle.cooldown must not be negative");
        }
    }

    private void validateIndicator(ScannerProperties.Indicator i, List<String> errors) {
        if (i.getRetryAttempts() < 1) {
            errors.add("scanner.indicator.retry-attempts must be at least 1");
        }
        if (i.getCircuitFailureThreshold() < 1 || i.getCircuitHalfOpenCalls() < 1) {
            errors.add("scanner.indicator circuit thresholds must be at least 1");
        }
        if (isNotPositive(i.getCircuitOpenTimeout()) || isNotPositive(i.getPermitTimeout())) {
            errors.add("scanner.indicator timeouts must be positive");
        }
        if (i.getMacdFast() >= i.getMacdSlow()) {
            errors.add("scanner.indicator.macd-fast must be shorter than macd-slow");
        }
        if (i.getRsiPeriod() < 1 || i.getAtrPeriod() < 1 || i.getVolumeSmaPeriod() < 1
                || i.getBollingerPeriod() < 1 || i.getMacdSignal() < 1) {
            errors.add("scanner.indicator periods must be at least 1");
        }
    }

    private boolean isNullOrEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    private boolean isNotPositive(Duration d) {
        return d == null || d.isZero() || d.isNegative();
    }
}
