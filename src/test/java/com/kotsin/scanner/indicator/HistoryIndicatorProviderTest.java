package com.kotsin.scanner.indicator;

import com.kotsin.scanner.ScannerTestFixtures;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.kotsin.scanner.ScannerTestFixtures.candle;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HistoryIndicatorProvider")
class HistoryIndicatorProviderTest {

    private final HistoryIndicatorProvider provider = new HistoryIndicatorProvider(ScannerTestFixtures.registry());

    private static double[] rising(int n) {
        double[] closes = new double[n];
        for (int i = 0; i < n; i++) {
            closes[i] = 100 + i;
        }
        return closes;
    }

    // ==================== EMA ====================

    @Test
    @DisplayName("EMA is seeded with the SMA of the first period values")
    void testEma_SmaSeed() {
        assertEquals(4.0, HistoryIndicatorProvider.ema(new double[]{1, 2, 3, 4, 5}, 3), 1e-9);
        assertNull(HistoryIndicatorProvider.ema(new double[]{1, 2}, 3));
    }

    // ==================== RSI ====================

    @Test
    @DisplayName("RSI is 100 on gains only and 50 on a flat series")
    void testRsi() {
        assertEquals(100.0, HistoryIndicatorProvider.rsi(rising(20), 14), 1e-9);
        assertEquals(50.0, HistoryIndicatorProvider.rsi(new double[20], 14), 1e-9);
        assertNull(HistoryIndicatorProvider.rsi(rising(14), 14));
    }

    @Test
    @DisplayName("RSI of alternating moves sits in the middle")
    void testRsi_Balanced() {
        double[] closes = new double[30];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = i % 2 == 0 ? 100 : 101;
        }

        double rsi = HistoryIndicatorProvider.rsi(closes, 14);

        assertTrue(rsi > 40 && rsi < 60, "rsi=" + rsi);
    }

    // ==================== MACD / ATR / VOLUME ====================

    @Test
    @DisplayName("MACD needs slow + signal - 1 closes and is positive in an uptrend")
    void testMacd() {
        assertNull(HistoryIndicatorProvider.macd(rising(33), 12, 26, 9));

        IndicatorSnapshot.Macd macd = HistoryIndicatorProvider.macd(rising(60), 12, 26, 9);

        assertNotNull(macd);
        assertTrue(macd.macd() > 0);
        assertEquals(macd.macd() - macd.signal(), macd.histogram(), 1e-9);
    }

    @Test
    @DisplayName("ATR of constant-range bars equals the range")
    void testAtr() {
        double[] flat = new double[20];
        Arrays.fill(flat, 100);
        List<Candle> history = ScannerTestFixtures.path(flat, 1.0, 1000);

        assertEquals(2.0, HistoryIndicatorProvider.atr(history, 14), 1e-9);
        assertNull(HistoryIndicatorProvider.atr(history.subList(0, 14), 14));
    }

    @Test
    @DisplayName("Volume SMA excludes the latest bar")
    void testVolumeSma() {
        List<Candle> history = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            history.add(candle(i, 100, 101, 99, 100, 1000.0));
        }
        history.add(candle(3, 100, 101, 99, 100, 5000.0));

        assertEquals(1000.0, HistoryIndicatorProvider.volumeSma(history, 3), 1e-9);
        assertNull(HistoryIndicatorProvider.volumeSma(history, 4));
    }

    @Test
    @DisplayName("Missing volume in the window leaves the SMA absent")
    void testVolumeSma_MissingVolume() {
        List<Candle> history = List.of(
                candle(0, 100, 101, 99, 100, null),
                candle(1, 100, 101, 99, 100, 1000.0),
                candle(2, 100, 101, 99, 100, 1000.0));

        assertNull(HistoryIndicatorProvider.volumeSma(history, 2));
    }

    // ==================== SNAPSHOT ====================

    @Test
    @DisplayName("Short history leaves long-lookback indicators null")
    void testSnapshot_ShortHistory() {
        List<Candle> history = ScannerTestFixtures.path(rising(30), 0.5, 1000);

        IndicatorSnapshot snapshot = provider.getSnapshot("SPY", "5m", history);

        assertNotNull(snapshot.ema(20));
        assertNull(snapshot.ema(50));
        assertNull(snapshot.ema(100));
        assertNull(snapshot.getMacd());
        assertNotNull(snapshot.getRsi());
        assertNotNull(snapshot.getAtr());
        assertNotNull(snapshot.getBollinger());
        assertEquals(history.get(29).getTimestamp(), snapshot.getTimestamp());
    }
}
