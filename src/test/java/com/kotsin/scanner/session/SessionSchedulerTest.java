package com.kotsin.scanner.session;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.MarketSession;
import com.kotsin.scanner.model.PatternFamily;
import com.kotsin.scanner.model.SessionInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SessionScheduler")
class SessionSchedulerTest {

    private SessionScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SessionScheduler(ScannerTestFixtures.registry());
    }

    // 2024-07-01 is EDT, UTC-4
    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2024-07-01T07:59:00Z, CLOSED",
            "2024-07-01T08:00:00Z, PREMARKET",
            "2024-07-01T13:29:00Z, PREMARKET",
            "2024-07-01T13:30:00Z, INTRADAY",
            "2024-07-01T19:59:00Z, INTRADAY",
            "2024-07-01T20:00:00Z, AFTERHOURS",
            "2024-07-02T00:00:00Z, CLOSED",
            "2024-07-02T00:01:00Z, CLOSED"
    })
    @DisplayName("Half-open session windows in Eastern time")
    void testClassify_Boundaries(String instant, MarketSession expected) {
        assertEquals(expected, scheduler.classify(Instant.parse(instant)).getSession());
    }

    @Test
    @DisplayName("Winter dates use the standard-time offset")
    void testClassify_StandardTime() {
        // 2024-03-04 is EST, UTC-5: 14:30Z is 09:30 ET
        assertEquals(MarketSession.PREMARKET, scheduler.classify(Instant.parse("2024-03-04T14:29:00Z")).getSession());
        assertEquals(MarketSession.INTRADAY, scheduler.classify(Instant.parse("2024-03-04T14:30:00Z")).getSession());
    }

    @Test
    @DisplayName("Session carries its scan and risk parameters")
    void testClassify_Parameters() {
        SessionInfo intraday = scheduler.classify(Instant.parse("2024-07-01T15:00:00Z"));

        assertEquals(Duration.ofMinutes(1), intraday.getScanInterval());
        assertEquals(1.0, intraday.getRiskMultiplier(), 1e-9);
        assertEquals(60, intraday.getApiBudgetPerMinute());
        assertTrue(intraday.isFamilyEnabled(PatternFamily.HARMONIC));
        assertFalse(intraday.isFamilyEnabled(PatternFamily.GAP_CONTINUATION));

        SessionInfo closed = scheduler.classify(Instant.parse("2024-07-01T03:00:00Z"));
        assertTrue(closed.getEnabledPatternFamilies().isEmpty());
    }

    @Test
    @DisplayName("current() reads the injected clock")
    void testCurrent_UsesClock() {
        ScannerTestFixtures.MutableClock clock = new ScannerTestFixtures.MutableClock(
                Instant.parse("2024-07-01T21:00:00Z"));
        SessionScheduler clocked = new SessionScheduler(ScannerTestFixtures.registry(), clock);

        assertEquals(MarketSession.AFTERHOURS, clocked.current().getSession());

        clock.advance(Duration.ofHours(3));
        assertEquals(MarketSession.CLOSED, clocked.current().getSession());
    }
}
