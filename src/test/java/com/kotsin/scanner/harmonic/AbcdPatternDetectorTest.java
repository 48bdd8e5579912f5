package com.kotsin.scanner.harmonic;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.model.AbcdPattern;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.ConfluenceResult;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.FibonacciTargets;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.kotsin.scanner.harmonic.HarmonicTestData.high;
import static com.kotsin.scanner.harmonic.HarmonicTestData.low;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AbcdPatternDetector")
class AbcdPatternDetectorTest {

    private AbcdPatternDetector detector;

    @BeforeEach
    void setUp() {
        ScannerConfigRegistry registry = ScannerTestFixtures.registry();
        detector = new AbcdPatternDetector(registry, new SwingExtractor(registry));
    }

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("Valid bullish ABCD with 61.8% retracement projects 1.618 from C")
        void testValidate_Bullish() {
            AbcdPattern pattern = detector.validate("SPY", low(0, 100), high(1, 110), low(2, 104), high(3, 114))
                    .orElseThrow();

            assertEquals(Direction.BULLISH, pattern.getDirection());
            assertEquals(0.6, pattern.getBcRetracement(), 1e-9);
            assertEquals(1.0, pattern.getAbcdRatio(), 1e-9);
            assertEquals(1.618, pattern.getExtensionLevel(), 1e-9);
            FibonacciTargets targets = pattern.getFibonacciTargets();
            assertEquals(104 + 6 * 1.618, targets.base(), 1e-9);
            assertEquals(104 + 6 * 1.618 * 1.27, targets.ext127(), 1e-9);
            assertEquals(104 + 6 * 1.618 * 2.618, targets.ext261(), 1e-9);
        }

        @Test
        @DisplayName("D near the projected base but no extension has no Fibonacci confluence")
        void testValidate_DNearBaseOnly() {
            AbcdPattern pattern = detector.validate("SPY", low(0, 100), high(1, 110), low(2, 104), high(3, 114))
                    .orElseThrow();

            assertEquals(113.708, pattern.getFibonacciTargets().base(), 1e-9);
            assertFalse(pattern.isFibonacciConfluence());
        }

        @Test
        @DisplayName("D within tolerance of the 127% extension has Fibonacci confluence")
        void testValidate_DNearExtension() {
            AbcdPattern pattern = detector.validate("SPY", low(0, 100), high(1, 110), low(2, 104), high(3, 116.3))
                    .orElseThrow();

            assertEquals(116.32916, pattern.getFibonacciTargets().ext127(), 1e-9);
            assertTrue(pattern.isFibonacciConfluence());
        }

        @Test
        @DisplayName("95% BC retracement is rejected")
        void testValidate_RetracementTooDeep() {
            assertTrue(detector.validate("SPY", low(0, 100), high(1, 110), low(2, 100.5), high(3, 110)).isEmpty());
        }

        @Test
        @DisplayName("Non-alternating swings are rejected")
        void testValidate_NotAlternating() {
            assertTrue(detector.validate("SPY", low(0, 100), high(1, 110), high(2, 104), high(3, 114)).isEmpty());
        }

        @Test
        @DisplayName("CD leg far beyond AB is rejected")
        void testValidate_AbcdRatioTooLarge() {
            assertTrue(detector.validate("SPY", low(0, 100), high(1, 110), low(2, 104), high(3, 125)).isEmpty());
        }

        @Test
        @DisplayName("Bearish ABCD projects downward")
        void testValidate_Bearish() {
            AbcdPattern pattern = detector.validate("SPY", high(0, 110), low(1, 100), high(2, 107), low(3, 97))
                    .orElseThrow();

            assertEquals(Direction.BEARISH, pattern.getDirection());
            assertEquals(1.27, pattern.getExtensionLevel(), 1e-9);
            assertTrue(pattern.getFibonacciTargets().base() < 107);
        }

        @Test
        @DisplayName("Extension level steps with BC retracement")
        void testExtensionLevel() {
            assertEquals(1.618, AbcdPatternDetector.extensionLevel(0.5), 1e-9);
            assertEquals(1.27, AbcdPatternDetector.extensionLevel(0.7), 1e-9);
            assertEquals(1.0, AbcdPatternDetector.extensionLevel(0.85), 1e-9);
            assertTrue(Double.isNaN(AbcdPatternDetector.extensionLevel(0.9)));
        }
    }

    @Nested
    @DisplayName("Detection on history")
    class Detection {

        @Test
        @DisplayName("Finds the bullish pattern in a synthetic series")
        void testFindPatterns() {
            List<AbcdPattern> patterns = detector.findPatterns(HarmonicTestData.bullishAbcdSeries());

            assertEquals(1, patterns.size());
            AbcdPattern pattern = patterns.get(0);
            assertEquals(Direction.BULLISH, pattern.getDirection());
            assertEquals(99.5, pattern.getA().getPrice(), 1e-9);
            assertEquals(114.5, pattern.getD().getPrice(), 1e-9);
            assertEquals(1.27, pattern.getExtensionLevel(), 1e-9);
        }

        @Test
        @DisplayName("Price must still be near D to trade")
        void testIsTradeable() {
            List<Candle> series = HarmonicTestData.bullishAbcdSeries();
            AbcdPattern pattern = detector.findPatterns(series).get(0);
            Candle drifted = series.get(series.size() - 1);
            Candle nearD = series.get(42);

            assertFalse(detector.isTradeable(pattern, drifted));
            assertTrue(detector.isTradeable(pattern, nearD));
        }

        @Test
        @DisplayName("Confluence sets strength, flags and eligibility")
        void testApplyConfluence() {
            AbcdPattern pattern = detector.validate("SPY", low(0, 100), high(1, 110), low(2, 104), high(3, 114))
                    .orElseThrow();
            ConfluenceResult result = ConfluenceResult.builder()
                    .satisfiedCount(4)
                    .weightedScore(100)
                    .breakdown(List.of(
                            passed(ConfluenceFactor.FIBONACCI), passed(ConfluenceFactor.TREND),
                            passed(ConfluenceFactor.VOLUME), passed(ConfluenceFactor.TECHNICAL_PATTERN)))
                    .eligible(true)
                    .build();

            AbcdPattern scored = detector.applyConfluence(pattern, result);

            assertEquals(95, scored.getStrength(), 1e-9);
            assertEquals(4, scored.getConfluenceCount());
            assertTrue(scored.isTrendAlignment());
            assertTrue(scored.isVolumeConfirmation());
            assertTrue(detector.isSignalEligible(scored, result));
        }

        @Test
        @DisplayName("Candidate enters at latest close and anchors on A")
        void testToCandidate() {
            List<Candle> series = HarmonicTestData.bullishAbcdSeries();
            AbcdPattern pattern = detector.findPatterns(series).get(0);
            Candle latest = series.get(42);

            PatternCandidate candidate = detector.toCandidate(pattern, latest);

            assertEquals(PatternFamily.HARMONIC, candidate.getFamily());
            assertEquals(latest.getClose(), candidate.getEntryPrice(), 1e-9);
            assertEquals(99.5, candidate.getAnchorPrice(), 1e-9);
            assertEquals(114.5, candidate.getReferencePrice(), 1e-9);
            assertEquals(pattern.getD().getTimestamp(), candidate.getTimestamp());
            assertEquals(pattern.getFibonacciTargets().extensions(), candidate.getPriceTargets());
        }
    }

    private static FactorResult passed(ConfluenceFactor factor) {
        FactorResult result = FactorResult.pass(factor, "test");
        result.setWeight(factor.getDefaultWeight());
        return result;
    }
}
