package com.kotsin.scanner.harmonic;

import com.kotsin.scanner.config.ProcessingConstants;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.AbcdPattern;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.ConfluenceResult;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FibonacciTargets;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.SwingPoint;
import com.kotsin.scanner.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AbcdPatternDetector - Harmonic ABCD detection over extracted swing points.
 *
 * Works in three steps so that confluence scoring can sit in between:
 * <ol>
 *   <li>{@link #findPatterns}: geometric candidates from the most recent 4-swing groups, newest first</li>
 *   <li>{@link #applyConfluence}: strength = min(cap, weighted score) plus confluence flags</li>
 *   <li>{@link #isSignalEligible} and {@link #isTradeable}: strength floor, factor minimum,
 *       pattern age and price proximity to D</li>
 * </ol>
 *
 * Direction is bullish when A &lt; B. Groups must alternate swing kinds, starting from a low for
 * bullish and a high for bearish patterns.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AbcdPatternDetector {

    private final ScannerConfigRegistry configRegistry;
    private final SwingExtractor swingExtractor;

    /**
     * Geometrically valid ABCD patterns, newest group first.
     */
    public List<AbcdPattern> findPatterns(List<Candle> snapshot) {
        List<SwingPoint> swings = swingExtractor.extract(snapshot);
        if (swings.size() < 4) {
            return List.of();
        }
        ScannerProperties.Harmonic config = configRegistry.current().getHarmonic();
        double fibTolerance = configRegistry.current().getConfluence().getFibTolerance();
        String symbol = snapshot.get(snapshot.size() - 1).getSymbol();

        List<AbcdPattern> patterns = new ArrayList<>();
        int oldest = Math.max(0, swings.size() - 3 - config.getMaxGroups());
        for (int i = swings.size() - 4; i >= oldest; i--) {
            validate(symbol, swings.get(i), swings.get(i + 1), swings.get(i + 2), swings.get(i + 3),
                    config, fibTolerance).ifPresent(patterns::add);
        }
        log.debug("[ABCD] {} swings, {} valid geometric patterns for {}", swings.size(), patterns.size(), symbol);
        return patterns;
    }

    /**
     * Validate leg sizes and Fibonacci proportions of one 4-swing group.
     */
    public Optional<AbcdPattern> validate(String symbol, SwingPoint a, SwingPoint b, SwingPoint c, SwingPoint d) {
        return validate(symbol, a, b, c, d, configRegistry.current().getHarmonic(),
                configRegistry.current().getConfluence().getFibTolerance());
    }

    private Optional<AbcdPattern> validate(String symbol, SwingPoint a, SwingPoint b, SwingPoint c, SwingPoint d,
                                           ScannerProperties.Harmonic config, double fibTolerance) {
        Direction direction = a.getPrice() < b.getPrice() ? Direction.BULLISH : Direction.BEARISH;
        if (!alternates(direction, a, b, c, d)) {
            return Optional.empty();
        }

        double abLength = Math.abs(b.getPrice() - a.getPrice());
        double bcLength = Math.abs(c.getPrice() - b.getPrice());
        double cdLength = Math.abs(d.getPrice() - c.getPrice());

        double minSwing = a.getPrice() * config.getMinSwingSize();
        if (abLength < minSwing || cdLength < minSwing) {
            return Optional.empty();
        }

        double bcRetracement = MathUtils.safeDivide(bcLength, abLength, Double.NaN);
        if (Double.isNaN(bcRetracement)
                || bcRetracement < config.getBcRetracementMin() || bcRetracement > config.getBcRetracementMax()) {
            return Optional.empty();
        }

        double abcdRatio = cdLength / abLength;
        if (abcdRatio < config.getAbcdRatioMin() || abcdRatio > config.getAbcdRatioMax()) {
            return Optional.empty();
        }

        double extensionLevel = extensionLevel(bcRetracement);
        if (Double.isNaN(extensionLevel)) {
            return Optional.empty();
        }

        FibonacciTargets targets = projectTargets(c.getPrice(), bcLength, extensionLevel, direction);

        return Optional.of(AbcdPattern.builder()
                .symbol(symbol)
                .a(a)
                .b(b)
                .c(c)
                .d(d)
                .abLength(abLength)
                .bcLength(bcLength)
                .cdLength(cdLength)
                .bcRetracement(bcRetracement)
                .abcdRatio(abcdRatio)
                .extensionLevel(extensionLevel)
                .fibonacciTargets(targets)
                .direction(direction)
                .fibonacciConfluence(nearAnyLevel(d.getPrice(), targets, fibTolerance))
                .build());
    }

    /**
     * 1.618 up to a 61.8% BC retracement, 1.27 up to 78.6%, 1.0 up to 88.6%; NaN beyond.
     */
    static double extensionLevel(double bcRetracement) {
        if (bcRetracement <= 0.618) {
            return 1.618;
        } else if (bcRetracement <= 0.786) {
            return 1.27;
        } else if (bcRetracement <= 0.886) {
            return 1.0;
        }
        return Double.NaN;
    }

    /**
     * Projected D and its extensions, all measured from C along the pattern direction.
     */
    static FibonacciTargets projectTargets(double cPrice, double bcLength, double extensionLevel, Direction direction) {
        double projected = bcLength * extensionLevel * direction.sign();
        double[] k = ProcessingConstants.FIB_EXTENSIONS;
        return new FibonacciTargets(
                cPrice + projected,
                cPrice + projected * k[0],
                cPrice + projected * k[1],
                cPrice + projected * k[2],
                cPrice + projected * k[3]);
    }

    static boolean nearAnyLevel(double price, FibonacciTargets targets, double tolerance) {
        return targets.extensions().stream()
                .anyMatch(level -> MathUtils.withinTolerance(price, level, tolerance, price));
    }

    /**
     * Record confluence flags and strength = min(cap, weighted score) on the pattern.
     */
    public AbcdPattern applyConfluence(AbcdPattern pattern, ConfluenceResult confluence) {
        double cap = configRegistry.current().getHarmonic().getStrengthCap();
        return pattern.toBuilder()
                .fibonacciConfluence(confluence.isSatisfied(ConfluenceFactor.FIBONACCI))
                .trendAlignment(confluence.isSatisfied(ConfluenceFactor.TREND))
                .volumeConfirmation(confluence.isSatisfied(ConfluenceFactor.VOLUME))
                .technicalConfirmation(confluence.isSatisfied(ConfluenceFactor.TECHNICAL_PATTERN))
                .confluenceCount(confluence.getSatisfiedCount())
                .strength(Math.min(cap, confluence.getWeightedScore()))
                .build();
    }

    public boolean isSignalEligible(AbcdPattern scored, ConfluenceResult confluence) {
        double minStrength = configRegistry.current().getHarmonic().getMinStrength();
        return confluence.isEligible() && scored.getStrength() >= minStrength;
    }

    /**
     * The latest candle must be within the maximum pattern age of D and close within
     * Fibonacci tolerance of D's price.
     */
    public boolean isTradeable(AbcdPattern pattern, Candle latest) {
        ScannerProperties props = configRegistry.current();
        long age = latest.getTimestamp() - pattern.getD().getTimestamp();
        if (age < 0 || age > props.getHarmonic().getMaxPatternAge().toMillis()) {
            return false;
        }
        double dPrice = pattern.getD().getPrice();
        return MathUtils.withinTolerance(latest.getClose(), dPrice, props.getConfluence().getFibTolerance(), dPrice);
    }

    /**
     * Scoring candidate for a pattern. Confluence is judged at D; entry is the latest close,
     * the stop anchor is A.
     */
    public PatternCandidate toCandidate(AbcdPattern pattern, Candle latest) {
        return PatternCandidate.builder()
                .symbol(pattern.getSymbol())
                .interval(latest.getInterval())
                .family(PatternFamily.HARMONIC)
                .label(pattern.getLabel())
                .direction(pattern.getDirection())
                .entryPrice(latest.getClose())
                .anchorPrice(pattern.getA().getPrice())
                .referencePrice(pattern.getD().getPrice())
                .priceTargets(new ArrayList<>(pattern.getFibonacciTargets().extensions()))
                .patternRange(pattern.getPatternRange())
                .strength(pattern.getStrength())
                .rewardMultiplier(configRegistry.current().getHarmonic().getRewardMultiplier())
                .timestamp(pattern.getD().getTimestamp())
                .abcdPattern(pattern)
                .build();
    }

    private static boolean alternates(Direction direction, SwingPoint a, SwingPoint b, SwingPoint c, SwingPoint d) {
        SwingPoint.Kind first = direction == Direction.BULLISH ? SwingPoint.Kind.LOW : SwingPoint.Kind.HIGH;
        return a.getKind() == first
                && b.getKind() != first
                && c.getKind() == first
                && d.getKind() != first;
    }
}
