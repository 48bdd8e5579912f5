package com.kotsin.scanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * TradeSignal - Risk-bounded trade proposal emitted for one qualifying detection.
 *
 * Immutable. Handed to the TradeSignalDispatcher and from there to every registered sink;
 * the scanner does not wait for, or expect, an acknowledgement.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeSignal {

    private final String signalId;
    private final String symbol;
    private final String interval;
    private final TradeDirection direction;
    private final double confidence;        // 0-1

    private final double entryPrice;
    private final double stopLoss;
    private final double takeProfit;
    private final double positionSize;      // units
    private final double riskRewardRatio;

    private final String patternLabel;
    private final PatternFamily family;
    private final MarketSession session;
    private final int confluenceCount;
    private final double confluenceScore;
    private final String reasoning;
    private final Instant timestamp;
}
