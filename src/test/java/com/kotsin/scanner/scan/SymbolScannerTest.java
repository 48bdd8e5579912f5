package com.kotsin.scanner.scan;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.account.ConfiguredAccountContextProvider;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.confluence.ConfluenceContext;
import com.kotsin.scanner.confluence.ConfluenceFactorEvaluator;
import com.kotsin.scanner.confluence.ConfluenceScorer;
import com.kotsin.scanner.harmonic.AbcdPatternDetector;
import com.kotsin.scanner.harmonic.ActivePatternStore;
import com.kotsin.scanner.harmonic.SwingExtractor;
import com.kotsin.scanner.indicator.HistoryIndicatorProvider;
import com.kotsin.scanner.indicator.IndicatorGateway;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.ConfluenceFactor;
import com.kotsin.scanner.model.FactorResult;
import com.kotsin.scanner.model.MarketSession;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.RawCandle;
import com.kotsin.scanner.model.SessionInfo;
import com.kotsin.scanner.model.TradeDirection;
import com.kotsin.scanner.model.TradeSignal;
import com.kotsin.scanner.retry.RetryHandler;
import com.kotsin.scanner.risk.TradeLevelCalculator;
import com.kotsin.scanner.session.SessionPatternDetector;
import com.kotsin.scanner.strat.StratPatternRecognizer;
import com.kotsin.scanner.technical.TechnicalPatternDetector;
import com.kotsin.scanner.throttle.SignalThrottle;
import com.kotsin.scanner.validation.CandleValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full pipeline for one symbol: ingest, detect, score, size, throttle.
 * Confluence factors are stubbed so the outcome depends only on the pattern logic.
 */
@DisplayName("SymbolScanner")
class SymbolScannerTest {

    private static final SessionInfo STRAT_ONLY = SessionInfo.builder()
            .session(MarketSession.INTRADAY)
            .scanInterval(Duration.ofMinutes(1))
            .riskMultiplier(1.0)
            .apiBudgetPerMinute(60)
            .enabledPatternFamilies(EnumSet.of(PatternFamily.STRAT))
            .build();

    private final ScannerConfigRegistry registry = ScannerTestFixtures.registry();
    private final ActivePatternStore activePatterns = new ActivePatternStore(Duration.ofHours(24));
    private SymbolScanState state;

    @BeforeEach
    void setUp() {
        state = new SymbolScanState(ScannerTestFixtures.SYMBOL, ScannerTestFixtures.INTERVAL, 200);
    }

    private static ConfluenceFactorEvaluator stub(ConfluenceFactor factor, boolean pass) {
        return new ConfluenceFactorEvaluator() {
            @Override
            public ConfluenceFactor getFactor() {
                return factor;
            }

            @Override
            public FactorResult evaluate(ConfluenceContext context) {
                return pass ? FactorResult.pass(factor, "stub") : FactorResult.fail(factor, "stub");
            }
        };
    }

    private SymbolScanner scanner(Set<ConfluenceFactor> passing) {
        List<ConfluenceFactorEvaluator> evaluators = new ArrayList<>();
        for (ConfluenceFactor factor : ConfluenceFactor.values()) {
            evaluators.add(stub(factor, passing.contains(factor)));
        }
        Clock clock = Clock.fixed(Instant.parse("2024-03-04T15:25:00Z"), ZoneOffset.UTC);
        return new SymbolScanner(
                new CandleValidator(registry),
                new StratPatternRecognizer(registry),
                new AbcdPatternDetector(registry, new SwingExtractor(registry)),
                new SessionPatternDetector(registry),
                new TechnicalPatternDetector(),
                new IndicatorGateway(new HistoryIndicatorProvider(registry), new RetryHandler(1, 5), registry),
                new ConfluenceScorer(evaluators, registry),
                new TradeLevelCalculator(registry),
                new SignalThrottle(registry, clock),
                new ConfiguredAccountContextProvider(registry));
    }

    private static List<RawCandle> raws(List<Candle> candles) {
        return candles.stream()
                .map(c -> RawCandle.of(c.getSymbol(), c.getInterval(), c.getTimestamp(),
                        c.getOpen(), c.getHigh(), c.getLow(), c.getClose(), c.getVolume()))
                .toList();
    }

    private static final Set<ConfluenceFactor> FOUR_FACTORS = EnumSet.of(ConfluenceFactor.FIBONACCI,
            ConfluenceFactor.TREND, ConfluenceFactor.VOLUME, ConfluenceFactor.TECHNICAL_PATTERN);

    // ==================== END TO END ====================

    @Test
    @DisplayName("2D->2U reversal with four factors emits a sized LONG signal")
    void testScan_StratReversalLong() {
        SymbolScanner scanner = scanner(FOUR_FACTORS);
        assertEquals(5, scanner.ingest(state, raws(ScannerTestFixtures.reversalSequence())));

        List<TradeSignal> signals = scanner.scan(state, STRAT_ONLY, activePatterns);

        assertEquals(1, signals.size());
        TradeSignal signal = signals.get(0);
        assertEquals(TradeDirection.LONG, signal.getDirection());
        assertEquals("2D->2U", signal.getPatternLabel());
        assertEquals(PatternFamily.STRAT, signal.getFamily());
        assertEquals(104.5, signal.getEntryPrice(), 1e-9);
        assertEquals(97.4 * 0.995, signal.getStopLoss(), 1e-9);
        assertTrue(signal.getTakeProfit() > signal.getEntryPrice());
        assertEquals(10_000 / 104.5, signal.getPositionSize(), 1e-9);
        assertEquals(4, signal.getConfluenceCount());
        assertEquals(90.0, signal.getConfluenceScore(), 1e-9);
        assertTrue(signal.getConfidence() >= 0.9 && signal.getConfidence() <= 1.0);
        assertTrue(signal.getReasoning().contains("FIBONACCI"));
        assertEquals(1, state.getThrottleState().getSignalCountToday());
    }

    @Test
    @DisplayName("One factor short of the minimum emits nothing")
    void testScan_ConfluenceShort() {
        SymbolScanner scanner = scanner(EnumSet.of(ConfluenceFactor.FIBONACCI, ConfluenceFactor.TREND,
                ConfluenceFactor.VOLUME));
        scanner.ingest(state, raws(ScannerTestFixtures.reversalSequence()));

        assertTrue(scanner.scan(state, STRAT_ONLY, activePatterns).isEmpty());
        assertEquals(0, state.getThrottleState().getSignalCountToday());
    }

    @Test
    @DisplayName("No new bar since the last scan skips the symbol")
    void testScan_NoNewBar() {
        SymbolScanner scanner = scanner(FOUR_FACTORS);
        scanner.ingest(state, raws(ScannerTestFixtures.reversalSequence()));

        assertEquals(1, scanner.scan(state, STRAT_ONLY, activePatterns).size());
        assertTrue(scanner.scan(state, STRAT_ONLY, activePatterns).isEmpty());
    }

    @Test
    @DisplayName("Session without families scans nothing")
    void testScan_ClosedSession() {
        SymbolScanner scanner = scanner(FOUR_FACTORS);
        scanner.ingest(state, raws(ScannerTestFixtures.reversalSequence()));
        SessionInfo closed = SessionInfo.builder()
                .session(MarketSession.CLOSED)
                .riskMultiplier(0.3)
                .enabledPatternFamilies(EnumSet.noneOf(PatternFamily.class))
                .build();

        assertTrue(scanner.scan(state, closed, activePatterns).isEmpty());
        assertNull(state.getLastScannedTimestamp());
    }

    // ==================== INGEST ====================

    @Test
    @DisplayName("Ingest drops invalid, out-of-order and wrong-interval candles")
    void testIngest_Filters() {
        SymbolScanner scanner = scanner(FOUR_FACTORS);
        long t = ScannerTestFixtures.T0;
        List<RawCandle> raws = List.of(
                RawCandle.of("SPY", "5m", t, 100, 101, 99, 100.5, 1000.0),
                RawCandle.of("SPY", "5m", t + 1, 100, 99, 101, 100.5, 1000.0),      // high < low
                RawCandle.of("SPY", "5m", t - 1, 100, 101, 99, 100.5, 1000.0),      // out of order
                RawCandle.of("SPY", "1m", t + 2, 100, 101, 99, 100.5, 1000.0),      // other interval
                RawCandle.of("SPY", null, t + 3, 100, 101, 99, 100.5, null));

        assertEquals(2, scanner.ingest(state, raws));
        assertEquals(2, state.getHistory().size());
        assertEquals("5m", state.getHistory().snapshot().get(1).getInterval());
    }

    // ==================== REASONING ====================

    @Test
    @DisplayName("Reasoning lists the satisfied factors")
    void testReasoning() {
        SymbolScanner scanner = scanner(FOUR_FACTORS);
        scanner.ingest(state, raws(ScannerTestFixtures.reversalSequence()));

        String reasoning = scanner.scan(state, STRAT_ONLY, activePatterns).get(0).getReasoning();

        assertTrue(reasoning.startsWith("STRAT 2D->2U BULLISH in INTRADAY"));
        assertTrue(reasoning.contains("4/6"));
        assertFalse(reasoning.contains("MACD"));
    }
}
