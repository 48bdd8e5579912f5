package com.kotsin.scanner.session;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.Direction;
import com.kotsin.scanner.model.MarketSession;
import com.kotsin.scanner.model.PatternCandidate;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.SessionInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.kotsin.scanner.ScannerTestFixtures.candle;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionPatternDetector")
class SessionPatternDetectorTest {

    private SessionPatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SessionPatternDetector(ScannerTestFixtures.registry());
    }

    private static SessionInfo session(MarketSession session, PatternFamily... families) {
        EnumSet<PatternFamily> enabled = EnumSet.noneOf(PatternFamily.class);
        enabled.addAll(List.of(families));
        return SessionInfo.builder()
                .session(session)
                .riskMultiplier(1.0)
                .enabledPatternFamilies(enabled)
                .build();
    }

    // ==================== GAP CONTINUATION ====================

    @Test
    @DisplayName("Gap up that holds is a bullish continuation")
    void testGapUp() {
        List<Candle> snapshot = List.of(
                candle(0, 99, 100.5, 98.5, 100, 1000.0),
                candle(1, 103, 104.5, 102.5, 104, 1000.0));

        List<PatternCandidate> candidates = detector.detect(snapshot,
                session(MarketSession.PREMARKET, PatternFamily.GAP_CONTINUATION));

        assertEquals(1, candidates.size());
        PatternCandidate gap = candidates.get(0);
        assertEquals("GAP_UP", gap.getLabel());
        assertEquals(Direction.BULLISH, gap.getDirection());
        assertEquals(104, gap.getEntryPrice(), 1e-9);
        assertEquals(102.5, gap.getAnchorPrice(), 1e-9);
        assertEquals(60, gap.getStrength(), 1e-9);
    }

    @Test
    @DisplayName("Gap down that fills is not a continuation")
    void testGapDown_Filled() {
        List<Candle> snapshot = List.of(
                candle(0, 101, 101.5, 99.5, 100, 1000.0),
                candle(1, 97, 99, 96.5, 98, 1000.0));

        assertTrue(detector.detect(snapshot, session(MarketSession.PREMARKET, PatternFamily.GAP_CONTINUATION))
                .isEmpty());
    }

    @Test
    @DisplayName("Gap below the threshold is ignored")
    void testGap_BelowThreshold() {
        List<Candle> snapshot = List.of(
                candle(0, 99, 100.5, 98.5, 100, 1000.0),
                candle(1, 101, 102.5, 100.5, 102, 1000.0));

        assertTrue(detector.detect(snapshot, session(MarketSession.PREMARKET, PatternFamily.GAP_CONTINUATION))
                .isEmpty());
    }

    // ==================== MOMENTUM ====================

    @Test
    @DisplayName("Three of five bullish closes ending bullish is momentum up")
    void testMomentumUp() {
        List<Candle> snapshot = List.of(
                candle(0, 100, 101.5, 99.5, 101, 1000.0),
                candle(1, 101, 101.5, 99.5, 100, 1000.0),
                candle(2, 100, 102.5, 99.5, 102, 1000.0),
                candle(3, 102, 102.5, 100.5, 101, 1000.0),
                candle(4, 101, 103.5, 100.5, 103, 1000.0));

        List<PatternCandidate> candidates = detector.detect(snapshot,
                session(MarketSession.INTRADAY, PatternFamily.MOMENTUM_CONTINUATION));

        assertEquals(1, candidates.size());
        assertEquals("MOMENTUM_UP", candidates.get(0).getLabel());
        assertEquals(PatternFamily.MOMENTUM_CONTINUATION, candidates.get(0).getFamily());
    }

    @Test
    @DisplayName("Momentum needs the last bar in trend")
    void testMomentum_LastBarAgainst() {
        List<Candle> snapshot = List.of(
                candle(0, 100, 101.5, 99.5, 101, 1000.0),
                candle(1, 101, 102.5, 100.5, 102, 1000.0),
                candle(2, 102, 103.5, 101.5, 103, 1000.0),
                candle(3, 103, 103.5, 101.5, 102, 1000.0),
                candle(4, 102, 102.5, 100.5, 101, 1000.0));

        assertTrue(detector.momentumContinuation(snapshot,
                ScannerTestFixtures.registry().current().getSession()).isEmpty());
    }

    // ==================== THIN VOLUME REVERSAL ====================

    @Test
    @DisplayName("Wide bar on below-average volume is a thin-volume reversal")
    void testThinVolumeReversal() {
        List<Candle> snapshot = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            snapshot.add(candle(i, 100, 101, 99, 100, 1000.0));
        }
        snapshot.add(candle(21, 99, 101.5, 98.5, 101, 500.0));

        List<PatternCandidate> candidates = detector.detect(snapshot,
                session(MarketSession.AFTERHOURS, PatternFamily.THIN_VOLUME_REVERSAL));

        assertEquals(1, candidates.size());
        assertEquals("THIN_VOLUME_REVERSAL_UP", candidates.get(0).getLabel());
        assertEquals(98.5, candidates.get(0).getAnchorPrice(), 1e-9);
    }

    @Test
    @DisplayName("Thin-volume reversal needs enough volume history")
    void testThinVolumeReversal_ShortHistory() {
        List<Candle> snapshot = List.of(
                candle(0, 100, 101, 99, 100, 1000.0),
                candle(1, 99, 101.5, 98.5, 101, 500.0));

        assertTrue(detector.detect(snapshot, session(MarketSession.AFTERHOURS, PatternFamily.THIN_VOLUME_REVERSAL))
                .isEmpty());
    }

    @Test
    @DisplayName("Families not enabled for the session never run")
    void testDisabledFamilies() {
        List<Candle> snapshot = List.of(
                candle(0, 99, 100.5, 98.5, 100, 1000.0),
                candle(1, 103, 104.5, 102.5, 104, 1000.0));

        assertTrue(detector.detect(snapshot, session(MarketSession.CLOSED)).isEmpty());
    }
}
