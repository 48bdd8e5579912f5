package com.kotsin.scanner.indicator;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HistoryIndicatorProvider - Computes indicators from the symbol's own candle history.
 *
 * Calculates:
 * - EMA ladder (SMA-seeded) for the configured periods
 * - RSI and ATR with Wilder smoothing
 * - MACD line, signal line and histogram
 * - Volume SMA over the bars preceding the latest one
 * - Bollinger Bands
 *
 * An indicator whose lookback exceeds the available history is left null.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HistoryIndicatorProvider implements IndicatorSnapshotProvider {

    private final ScannerConfigRegistry configRegistry;

    @Override
    public IndicatorSnapshot getSnapshot(String symbol, String interval, List<Candle> history) {
        ScannerProperties props = configRegistry.current();
        ScannerProperties.Indicator config = props.getIndicator();

        double[] closes = history.stream().mapToDouble(Candle::getClose).toArray();

        Map<Integer, Double> emas = new LinkedHashMap<>();
        for (int period : props.getConfluence().getEmaPeriods()) {
            Double ema = ema(closes, period);
            if (ema != null) {
                emas.put(period, ema);
            }
        }

        IndicatorSnapshot snapshot = IndicatorSnapshot.builder()
                .symbol(symbol)
                .interval(interval)
                .timestamp(history.isEmpty() ? 0 : history.get(history.size() - 1).getTimestamp())
                .emas(emas)
                .rsi(rsi(closes, config.getRsiPeriod()))
                .macd(macd(closes, config.getMacdFast(), config.getMacdSlow(), config.getMacdSignal()))
                .volumeSma(volumeSma(history, config.getVolumeSmaPeriod()))
                .bollinger(bollinger(closes, config.getBollingerPeriod(), config.getBollingerStdDev()))
                .atr(atr(history, config.getAtrPeriod()))
                .build();

        log.debug("[INDICATOR] {} [{}] candles={} emas={} rsi={} atr={}",
                symbol, interval, history.size(), emas, snapshot.getRsi(), snapshot.getAtr());
        return snapshot;
    }

    // ==================== EMA ====================

    /**
     * Last value of the EMA, seeded with the SMA of the first period values.
     */
    static Double ema(double[] values, int period) {
        double[] series = emaSeries(values, period);
        return series.length == 0 ? null : series[series.length - 1];
    }

    /**
     * EMA values starting at index period-1 of the input; empty if the input is too short.
     */
    static double[] emaSeries(double[] values, int period) {
        if (period < 1 || values.length < period) {
            return new double[0];
        }
        double k = 2.0 / (period + 1);
        double[] out = new double[values.length - period + 1];
        double seed = 0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
        }
        out[0] = seed / period;
        for (int i = period; i < values.length; i++) {
            out[i - period + 1] = values[i] * k + out[i - period] * (1 - k);
        }
        return out;
    }

    // ==================== RSI ====================

    static Double rsi(double[] closes, int period) {
        if (closes.length < period + 1) {
            return null;
        }
        double gain = 0;
        double loss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                gain += change;
            } else {
                loss -= change;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }
        if (avgLoss == 0) {
            return avgGain == 0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100 - 100 / (1 + rs);
    }

    // ==================== MACD ====================

    static IndicatorSnapshot.Macd macd(double[] closes, int fast, int slow, int signal) {
        double[] fastSeries = emaSeries(closes, fast);
        double[] slowSeries = emaSeries(closes, slow);
        if (slowSeries.length == 0) {
            return null;
        }
        // Align the fast series to the slow one: both end at the last close
        int offset = fastSeries.length - slowSeries.length;
        double[] macdLine = new double[slowSeries.length];
        for (int i = 0; i < slowSeries.length; i++) {
            macdLine[i] = fastSeries[i + offset] - slowSeries[i];
        }
        double[] signalSeries = emaSeries(macdLine, signal);
        if (signalSeries.length == 0) {
            return null;
        }
        double macd = macdLine[macdLine.length - 1];
        double signalValue = signalSeries[signalSeries.length - 1];
        return new IndicatorSnapshot.Macd(macd, signalValue, macd - signalValue);
    }

    // ==================== VOLUME ====================

    /**
     * Mean volume of the {@code period} bars before the latest one; null if any is missing.
     */
    public static Double volumeSma(List<Candle> history, int period) {
        if (history.size() < period + 1) {
            return null;
        }
        double sum = 0;
        for (int i = history.size() - 1 - period; i < history.size() - 1; i++) {
            Candle c = history.get(i);
            if (!c.hasVolume()) {
                return null;
            }
            sum += c.getVolume();
        }
        return sum / period;
    }

    // ==================== BOLLINGER ====================

    static IndicatorSnapshot.Bollinger bollinger(double[] closes, int period, double stdDevMult) {
        if (closes.length < period) {
            return null;
        }
        double[] window = new double[period];
        System.arraycopy(closes, closes.length - period, window, 0, period);
        double middle = 0;
        for (double v : window) {
            middle += v;
        }
        middle /= period;
        double stdDev = MathUtils.safeStdDev(window);
        return new IndicatorSnapshot.Bollinger(middle + stdDevMult * stdDev, middle, middle - stdDevMult * stdDev);
    }

    // ==================== ATR ====================

    /**
     * Wilder ATR: SMA of the first period true ranges, then smoothed.
     */
    static Double atr(List<Candle> history, int period) {
        if (history.size() < period + 1) {
            return null;
        }
        double atr = 0;
        for (int i = 1; i <= period; i++) {
            atr += trueRange(history.get(i), history.get(i - 1));
        }
        atr /= period;
        for (int i = period + 1; i < history.size(); i++) {
            atr = (atr * (period - 1) + trueRange(history.get(i), history.get(i - 1))) / period;
        }
        return atr;
    }

    private static double trueRange(Candle current, Candle previous) {
        double prevClose = previous.getClose();
        return Math.max(current.getHigh() - current.getLow(),
                Math.max(Math.abs(current.getHigh() - prevClose), Math.abs(current.getLow() - prevClose)));
    }
}
