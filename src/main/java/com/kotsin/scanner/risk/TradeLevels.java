package com.kotsin.scanner.risk;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Entry, protective stop, target and size for one candidate.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeLevels {

    private final double entryPrice;
    private final double stopLoss;
    private final double takeProfit;
    private final double positionSize;      // units
    private final double riskPerUnit;       // |entry - stop|
    private final double riskRewardRatio;
    private final StopPolicy stopPolicy;
}
