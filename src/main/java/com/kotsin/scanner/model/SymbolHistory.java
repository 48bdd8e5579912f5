package com.kotsin.scanner.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * SymbolHistory - Bounded sliding window of candles for one (symbol, interval).
 *
 * Insertion order is significant: candles must arrive with strictly increasing
 * timestamps. Once maxLength is exceeded the oldest candle is evicted.
 *
 * Not thread-safe. A history is owned by exactly one SymbolScanState and only
 * mutated from the scan worker currently processing that symbol.
 */
public class SymbolHistory {

    private final String symbol;
    private final String interval;
    private final int maxLength;
    private final Deque<Candle> candles;

    public SymbolHistory(String symbol, String interval, int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.symbol = symbol;
        this.interval = interval;
        this.maxLength = maxLength;
        this.candles = new ArrayDeque<>(Math.min(maxLength, 1024));
    }

    /**
     * Append a validated candle, evicting the oldest entry when full.
     *
     * @throws IllegalArgumentException if the candle belongs to another series or is not newer than the last one
     */
    public void append(Candle candle) {
        if (!symbol.equals(candle.getSymbol())) {
            throw new IllegalArgumentException("Candle for " + candle.getSymbol() + " appended to history of " + symbol);
        }
        Candle last = candles.peekLast();
        if (last != null && candle.getTimestamp() <= last.getTimestamp()) {
            throw new IllegalArgumentException("Out-of-order candle " + candle.getTimestamp()
                    + " after " + last.getTimestamp() + " for " + symbol);
        }
        candles.addLast(candle);
        while (candles.size() > maxLength) {
            candles.pollFirst();
        }
    }

    /**
     * Immutable copy of the current window, oldest first.
     */
    public List<Candle> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(candles));
    }

    public Candle last() {
        return candles.peekLast();
    }

    public Long lastTimestamp() {
        Candle last = candles.peekLast();
        return last != null ? last.getTimestamp() : null;
    }

    public int size() {
        return candles.size();
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }

    public String getSymbol() {
        return symbol;
    }

    public String getInterval() {
        return interval;
    }

    public int getMaxLength() {
        return maxLength;
    }
}
