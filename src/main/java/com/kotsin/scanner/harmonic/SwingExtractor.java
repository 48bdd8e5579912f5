package com.kotsin.scanner.harmonic;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.SwingPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SwingExtractor - Finds confirmed swing highs and lows in a history snapshot.
 *
 * A swing high is a high strictly greater than every other high within lookback bars
 * on both sides (lows analogous). Only bars with a full window on each side qualify, so
 * the newest lookback bars are never swings. A bar that is both keeps the high.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SwingExtractor {

    private final ScannerConfigRegistry configRegistry;

    /**
     * @return swings in chronological order; empty when the snapshot is shorter than min-history
     */
    public List<SwingPoint> extract(List<Candle> snapshot) {
        ScannerProperties.Harmonic config = configRegistry.current().getHarmonic();
        if (snapshot == null || snapshot.size() < config.getMinHistory()) {
            log.debug("[SWING] Not enough candles: {} (need {})",
                    snapshot == null ? 0 : snapshot.size(), config.getMinHistory());
            return Collections.emptyList();
        }
        return extract(snapshot, config.getSwingLookback());
    }

    static List<SwingPoint> extract(List<Candle> data, int lookback) {
        List<SwingPoint> swings = new ArrayList<>();
        for (int i = lookback; i < data.size() - lookback; i++) {
            Candle current = data.get(i);
            if (isSwingHigh(data, i, lookback)) {
                swings.add(SwingPoint.builder()
                        .index(i)
                        .price(current.getHigh())
                        .timestamp(current.getTimestamp())
                        .kind(SwingPoint.Kind.HIGH)
                        .build());
            } else if (isSwingLow(data, i, lookback)) {
                swings.add(SwingPoint.builder()
                        .index(i)
                        .price(current.getLow())
                        .timestamp(current.getTimestamp())
                        .kind(SwingPoint.Kind.LOW)
                        .build());
            }
        }
        return swings;
    }

    private static boolean isSwingHigh(List<Candle> data, int index, int lookback) {
        double currentHigh = data.get(index).getHigh();
        for (int i = index - lookback; i <= index + lookback; i++) {
            if (i != index && data.get(i).getHigh() >= currentHigh) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSwingLow(List<Candle> data, int index, int lookback) {
        double currentLow = data.get(index).getLow();
        for (int i = index - lookback; i <= index + lookback; i++) {
            if (i != index && data.get(i).getLow() <= currentLow) {
                return false;
            }
        }
        return true;
    }
}
