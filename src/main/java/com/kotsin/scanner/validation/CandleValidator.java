package com.kotsin.scanner.validation;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.CandleRejection;
import com.kotsin.scanner.model.CandleValidationResult;
import com.kotsin.scanner.model.RawCandle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * CandleValidator - Turns raw feed bars into validated candles or reason-coded rejections.
 *
 * Never throws for bad data. Checks run in a fixed order and the first failure wins:
 * <ol>
 *   <li>NON_NUMERIC: a missing symbol or timestamp, an OHLC field that is missing or does not
 *       parse to a finite number, or a volume that is present but negative or not finite</li>
 *   <li>INVALID_OHLC: non-positive price, high below low, or open/close outside [low, high]</li>
 *   <li>SUB_MINIMUM_RANGE: high - low below the configured minimum bar range</li>
 *   <li>OUT_OF_ORDER: timestamp not strictly after the last accepted candle of the series</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class CandleValidator {

    private final ScannerConfigRegistry configRegistry;

    /**
     * @param raw           bar as received
     * @param lastTimestamp timestamp of the last candle appended for this series, null if none
     */
    public CandleValidationResult validate(RawCandle raw, Long lastTimestamp) {
        if (Objects.isNull(raw)) {
            return CandleValidationResult.reject(CandleRejection.NON_NUMERIC, "null candle");
        }
        if (raw.getSymbol() == null || raw.getSymbol().trim().isEmpty()) {
            return CandleValidationResult.reject(CandleRejection.NON_NUMERIC, "missing symbol");
        }
        if (raw.getTimestamp() == null || raw.getTimestamp() <= 0) {
            return CandleValidationResult.reject(CandleRejection.NON_NUMERIC, "missing timestamp");
        }

        Double open = parseFinite(raw.getOpen());
        Double high = parseFinite(raw.getHigh());
        Double low = parseFinite(raw.getLow());
        Double close = parseFinite(raw.getClose());
        if (open == null || high == null || low == null || close == null) {
            return CandleValidationResult.reject(CandleRejection.NON_NUMERIC,
                    String.format("o=%s h=%s l=%s c=%s", raw.getOpen(), raw.getHigh(), raw.getLow(), raw.getClose()));
        }

        Double volume = null;
        if (raw.getVolume() != null && !raw.getVolume().trim().isEmpty()) {
            volume = parseFinite(raw.getVolume());
            if (volume == null || volume < 0) {
                return CandleValidationResult.reject(CandleRejection.NON_NUMERIC, "volume=" + raw.getVolume());
            }
        }

        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            return CandleValidationResult.reject(CandleRejection.INVALID_OHLC, "non-positive price");
        }
        if (high <= low) {
            return CandleValidationResult.reject(CandleRejection.INVALID_OHLC, "high " + high + " <= low " + low);
        }
        if (high < Math.max(open, close) || low > Math.min(open, close)) {
            return CandleValidationResult.reject(CandleRejection.INVALID_OHLC, "open/close outside [low, high]");
        }

        double minBarRange = configRegistry.current().getHistory().getMinBarRange();
        if (high - low < minBarRange) {
            return CandleValidationResult.reject(CandleRejection.SUB_MINIMUM_RANGE,
                    String.format("range %.6f < %.6f", high - low, minBarRange));
        }

        if (lastTimestamp != null && raw.getTimestamp() <= lastTimestamp) {
            return CandleValidationResult.reject(CandleRejection.OUT_OF_ORDER,
                    raw.getTimestamp() + " <= last " + lastTimestamp);
        }

        return CandleValidationResult.accept(Candle.builder()
                .symbol(raw.getSymbol().trim())
                .interval(raw.getInterval())
                .timestamp(raw.getTimestamp())
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build());
    }

    private static Double parseFinite(String text) {
        if (text == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(text.trim());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
