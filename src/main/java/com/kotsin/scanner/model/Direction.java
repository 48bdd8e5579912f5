package com.kotsin.scanner.model;

/**
 * Direction of a detected pattern.
 */
public enum Direction {

    BULLISH,
    BEARISH;

    /**
     * +1 for bullish, -1 for bearish. Used to project price levels.
     */
    public int sign() {
        return this == BULLISH ? 1 : -1;
    }

    public TradeDirection toTradeDirection() {
        return this == BULLISH ? TradeDirection.LONG : TradeDirection.SHORT;
    }

    public Direction opposite() {
        return this == BULLISH ? BEARISH : BULLISH;
    }
}
