package com.kotsin.scanner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RawCandle - Unvalidated bar as received from the candle feed.
 *
 * Price and volume fields are kept as text so that the validator can tell
 * an unparseable value apart from a structurally wrong bar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawCandle {

    private String symbol;
    private String interval;
    private Long timestamp;
    private String open;
    private String high;
    private String low;
    private String close;
    private String volume;

    public static RawCandle of(String symbol, String interval, long timestamp,
                               double open, double high, double low, double close, Double volume) {
        return RawCandle.builder()
                .symbol(symbol)
                .interval(interval)
                .timestamp(timestamp)
                .open(Double.toString(open))
                .high(Double.toString(high))
                .low(Double.toString(low))
                .close(Double.toString(close))
                .volume(volume != null ? Double.toString(volume) : null)
                .build();
    }
}
