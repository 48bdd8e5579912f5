package com.kotsin.scanner.harmonic;

import com.github.benmanes.caffeine.cache.Ticker;
import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.AbcdPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static com.kotsin.scanner.harmonic.HarmonicTestData.high;
import static com.kotsin.scanner.harmonic.HarmonicTestData.low;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActivePatternStore")
class ActivePatternStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private ActivePatternStore store;
    private AbcdPatternDetector detector;

    @BeforeEach
    void setUp() {
        Ticker ticker = nanos::get;
        store = new ActivePatternStore(Duration.ofHours(24), ticker);
        com.kotsin.scanner.config.ScannerConfigRegistry registry = ScannerTestFixtures.registry();
        detector = new AbcdPatternDetector(registry, new SwingExtractor(registry));
    }

    private AbcdPattern pattern(int dIndex) {
        return detector.validate("SPY", low(dIndex - 3, 100), high(dIndex - 2, 110), low(dIndex - 1, 104),
                high(dIndex, 114)).orElseThrow();
    }

    @Test
    @DisplayName("Stored pattern is active until the TTL passes")
    void testTtl() {
        AbcdPattern pattern = pattern(10);
        store.put(pattern);

        assertTrue(store.isActive(pattern));

        nanos.addAndGet(Duration.ofHours(25).toNanos());

        assertFalse(store.isActive(pattern));
        assertTrue(store.get("SPY").isEmpty());
    }

    @Test
    @DisplayName("Newer pattern supersedes, older one does not")
    void testSupersede() {
        AbcdPattern older = pattern(10);
        AbcdPattern newer = pattern(20);

        store.put(newer);
        store.put(older);

        assertTrue(store.isActive(newer));
        assertFalse(store.isActive(older));
        assertEquals(1, store.snapshot().size());
    }
}
