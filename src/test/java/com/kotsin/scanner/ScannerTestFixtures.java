package com.kotsin.scanner;

import com.kotsin.scanner.config.ConfigurationValidator;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.Candle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shared builders for scanner tests.
 */
public final class ScannerTestFixtures {

    public static final String SYMBOL = "SPY";
    public static final String INTERVAL = "5m";
    public static final long T0 = Instant.parse("2024-03-04T15:00:00Z").toEpochMilli();
    public static final long BAR_MS = Duration.ofMinutes(5).toMillis();

    private ScannerTestFixtures() {
    }

    public static ScannerConfigRegistry registry() {
        return new ScannerConfigRegistry(new ScannerProperties(), new ConfigurationValidator());
    }

    public static ScannerConfigRegistry registry(Consumer<ScannerProperties> customizer) {
        ScannerProperties props = new ScannerProperties();
        customizer.accept(props);
        return new ScannerConfigRegistry(props, new ConfigurationValidator());
    }

    public static Candle candle(int index, double open, double high, double low, double close, Double volume) {
        return Candle.builder()
                .symbol(SYMBOL)
                .interval(INTERVAL)
                .timestamp(T0 + index * BAR_MS)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }

    public static Candle candle(double high, double low) {
        double mid = (high + low) / 2;
        return candle(0, mid, high, low, mid, 1000.0);
    }

    /**
     * Bars whose close follows the given path; each bar spans +/- halfRange around its close.
     */
    public static List<Candle> path(double[] closes, double halfRange, double volume) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            double open = i == 0 ? closes[i] : closes[i - 1];
            double high = Math.max(open, closes[i]) + halfRange;
            double low = Math.min(open, closes[i]) - halfRange;
            candles.add(candle(i, open, high, low, closes[i], volume));
        }
        return candles;
    }

    /**
     * The reversal sequence used by the end-to-end tests: bar types [2D, 2U] on the last three
     * bars, bar3 volume 1.5x bar2 and bar3 closing above bar2's high.
     */
    public static List<Candle> reversalSequence() {
        return List.of(
                candle(0, 100.0, 102.0, 98.0, 101.0, 1000.0),
                candle(1, 101.0, 103.0, 99.0, 100.0, 1000.0),
                candle(2, 100.0, 104.0, 99.5, 103.0, 1000.0),
                candle(3, 103.0, 103.5, 98.0, 99.0, 1000.0),
                candle(4, 99.5, 105.0, 99.0, 104.5, 1500.0));
    }

    /**
     * Clock whose instant tests can move.
     */
    public static class MutableClock extends Clock {
        private Instant now;
        private final ZoneId zone;

        public MutableClock(Instant start) {
            this(start, ZoneId.of("UTC"));
        }

        private MutableClock(Instant start, ZoneId zone) {
            this.now = start;
            this.zone = zone;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        public void set(Instant instant) {
            now = instant;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new MutableClock(now, zone);
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
