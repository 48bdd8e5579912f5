package com.kotsin.scanner.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * CandleValidationResult - Accepted candle or a rejection with its reason.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CandleValidationResult {

    private final Candle candle;
    private final CandleRejection rejection;
    private final String detail;

    public static CandleValidationResult accept(Candle candle) {
        return new CandleValidationResult(candle, null, null);
    }

    public static CandleValidationResult reject(CandleRejection rejection, String detail) {
        return new CandleValidationResult(null, rejection, detail);
    }

    public boolean isAccepted() {
        return candle != null;
    }

    public String toLogString() {
        if (isAccepted()) {
            return "ACCEPTED | " + candle.getSymbol() + " @" + candle.getTimestamp();
        }
        return "REJECTED | reason=" + rejection.getCode() + (detail != null ? " | detail=" + detail : "");
    }
}
