package com.kotsin.scanner.strat;

import com.kotsin.scanner.config.ProcessingConstants;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.BarType;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.StratPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * StratPatternRecognizer - Matches the last three candles against the Strat transition table.
 *
 * <pre>
 *   2D -&gt; 2U   bullish reversal
 *   2U -&gt; 2D   bearish reversal
 *   1  -&gt; 2U   bullish inside-bar breakout
 *   1  -&gt; 2D   bearish inside-bar breakout
 *   3  -&gt; 2U   bullish outside-bar continuation
 *   3  -&gt; 2D   bearish outside-bar continuation
 * </pre>
 *
 * Strength starts at 50 and collects family-specific bonuses; patterns below the configured
 * minimum strength are discarded. A confidence pass then adds volume, range and momentum
 * bonuses, capped at 100. The recognizer keeps no state, so evaluating an unchanged window
 * twice gives the same result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StratPatternRecognizer {

    private final ScannerConfigRegistry configRegistry;

    public Optional<StratPattern> recognize(List<Candle> snapshot) {
        if (snapshot == null || snapshot.size() < 3) {
            return Optional.empty();
        }
        ScannerProperties.Strat config = configRegistry.current().getStrat();

        int n = snapshot.size();
        Candle bar1 = snapshot.get(n - 3);
        Candle bar2 = snapshot.get(n - 2);
        Candle bar3 = snapshot.get(n - 1);

        BarType type1 = BarTypeClassifier.classify(bar1, bar2, config.isEqualBarAsInside());
        BarType type2 = BarTypeClassifier.classify(bar2, bar3, config.isEqualBarAsInside());

        return recognize(type1, type2, bar1, bar2, bar3, config.getMinStrength());
    }

    /**
     * Match an already classified transition pair.
     */
    public Optional<StratPattern> recognize(BarType type1, BarType type2, Candle bar1, Candle bar2, Candle bar3) {
        return recognize(type1, type2, bar1, bar2, bar3, configRegistry.current().getStrat().getMinStrength());
    }

    private Optional<StratPattern> recognize(BarType type1, BarType type2, Candle bar1, Candle bar2, Candle bar3,
                                             double minStrength) {
        StratPattern.Family family = familyOf(type1, type2);
        if (family == null) {
            return Optional.empty();
        }
        Direction direction = type2 == BarType.UP ? Direction.BULLISH : Direction.BEARISH;

        double strength = ProcessingConstants.STRAT_BASE_STRENGTH + switch (family) {
            case REVERSAL -> reversalBonus(direction, bar2, bar3);
            case INSIDE_BREAKOUT -> breakoutBonus(direction, bar1, bar2, bar3);
            case OUTSIDE_CONTINUATION -> outsideBarBonus(direction, bar1, bar2, bar3);
        };

        String label = type1.getLabel() + "->" + type2.getLabel();
        if (strength < minStrength) {
            log.debug("[STRAT] Pattern {} rejected: strength {} < {}", label, strength, minStrength);
            return Optional.empty();
        }

        return Optional.of(StratPattern.builder()
                .sequenceLabel(label)
                .firstTransition(type1)
                .secondTransition(type2)
                .family(family)
                .direction(direction)
                .strength(strength)
                .confidence(confidence(strength, direction, bar1, bar2, bar3))
                .bar1(bar1)
                .bar2(bar2)
                .bar3(bar3)
                .build());
    }

    /**
     * Convert a recognized pattern into a scoring candidate. Entry is bar3's close; the anchor
     * is the bar2/bar3 extreme pushed out by a fraction of bar3's range.
     */
    public PatternCandidate toCandidate(StratPattern pattern) {
        ScannerProperties.Strat config = configRegistry.current().getStrat();
        Candle bar2 = pattern.getBar2();
        Candle bar3 = pattern.getBar3();
        double offset = bar3.getRange() * config.getStopRangeFraction();
        double anchor = pattern.getDirection() == Direction.BULLISH
                ? Math.min(bar2.getLow(), bar3.getLow()) - offset
                : Math.max(bar2.getHigh(), bar3.getHigh()) + offset;

        return PatternCandidate.builder()
                .symbol(bar3.getSymbol())
                .interval(bar3.getInterval())
                .family(PatternFamily.STRAT)
                .label(pattern.getSequenceLabel())
                .direction(pattern.getDirection())
                .entryPrice(bar3.getClose())
                .anchorPrice(anchor)
                .referencePrice(bar3.getClose())
                .patternRange(Math.max(bar2.getHigh(), bar3.getHigh()) - Math.min(bar2.getLow(), bar3.getLow()))
                .strength(pattern.getConfidence())
                .rewardMultiplier(config.getRewardMultiplier())
                .timestamp(bar3.getTimestamp())
                .stratPattern(pattern)
                .build();
    }

    static StratPattern.Family familyOf(BarType type1, BarType type2) {
        if (type2 != BarType.UP && type2 != BarType.DOWN) {
            return null;
        }
        return switch (type1) {
            case DOWN -> type2 == BarType.UP ? StratPattern.Family.REVERSAL : null;
            case UP -> type2 == BarType.DOWN ? StratPattern.Family.REVERSAL : null;
            case INSIDE -> StratPattern.Family.INSIDE_BREAKOUT;
            case OUTSIDE -> StratPattern.Family.OUTSIDE_CONTINUATION;
        };
    }

    // ======================== FAMILY BONUSES ========================

    private double reversalBonus(Direction direction, Candle bar2, Candle bar3) {
        double bonus = 0;
        if (volumeRatioAbove(bar3, bar2, 1.2)) {
            bonus += 10;
        }
        if (bar3.getRange() > bar2.getRange() * 1.1) {
            bonus += 8;
        }
        if (direction == Direction.BULLISH ? bar3.isBullish() : bar3.isBearish()) {
            bonus += 5;
        }
        if (closesBeyond(direction, bar3, bar2)) {
            bonus += 12;
        }
        return bonus;
    }

    private double breakoutBonus(Direction direction, Candle bar1, Candle bar2, Candle bar3) {
        double bonus = 0;
        // Tight inside bar
        if (bar2.getRange() < bar1.getRange() * 0.8) {
            bonus += 15;
        }
        if (closesBeyond(direction, bar3, bar2)) {
            bonus += 10;
        }
        if (volumeRatioAbove(bar3, bar2, 1.3)) {
            bonus += 8;
        }
        return bonus;
    }

    private double outsideBarBonus(Direction direction, Candle bar1, Candle bar2, Candle bar3) {
        double bonus = 0;
        if (bar2.getHigh() > bar1.getHigh() && bar2.getLow() < bar1.getLow()) {
            bonus += 12;
        }
        if (direction == Direction.BULLISH ? bar2.isBullish() : bar2.isBearish()) {
            bonus += 8;
        }
        if (direction == Direction.BULLISH ? bar3.getClose() > bar2.getClose() : bar3.getClose() < bar2.getClose()) {
            bonus += 10;
        }
        return bonus;
    }

    // ======================== CONFIDENCE ========================

    private double confidence(double strength, Direction direction, Candle bar1, Candle bar2, Candle bar3) {
        double confidence = strength;

        if (bar3.hasVolume() && bar2.hasVolume() && bar2.getVolume() > 0) {
            double volumeRatio = bar3.getVolume() / bar2.getVolume();
            if (volumeRatio > 1.5) {
                confidence += 10;
            } else if (volumeRatio > 1.2) {
                confidence += 5;
            }
        }

        double avgRange = (bar1.getRange() + bar2.getRange() + bar3.getRange()) / 3;
        if (bar3.getRange() > avgRange * 1.2) {
            confidence += 8;
        }

        if (direction == Direction.BULLISH ? bar3.getClose() > bar2.getClose() : bar3.getClose() < bar2.getClose()) {
            confidence += 5;
        }

        double change = bar3.getClose() - bar1.getClose();
        if (Math.signum(change) == direction.sign()) {
            confidence += 3;
        }

        return Math.min(confidence, ProcessingConstants.MAX_SCORE);
    }

    private static boolean volumeRatioAbove(Candle current, Candle previous, double ratio) {
        return current.hasVolume() && previous.hasVolume() && previous.getVolume() > 0
                && current.getVolume() > previous.getVolume() * ratio;
    }

    private static boolean closesBeyond(Direction direction, Candle bar3, Candle bar2) {
        return direction == Direction.BULLISH ? bar3.getClose() > bar2.getHigh() : bar3.getClose() < bar2.getLow();
    }
}
