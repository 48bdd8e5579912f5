package com.kotsin.scanner.indicator;

import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;

import java.util.List;

/**
 * Source of technical indicator values for the latest bar of a symbol's history.
 *
 * Implementations may call out to a remote service; callers go through
 * {@link IndicatorGateway}, which rate-limits, retries and circuit-breaks the call.
 */
public interface IndicatorSnapshotProvider {

    /**
     * @param history the scan snapshot, oldest first; the snapshot describes its last bar
     * @return indicator values; individual values are null when they cannot be computed
     */
    IndicatorSnapshot getSnapshot(String symbol, String interval, List<Candle> history);
}
