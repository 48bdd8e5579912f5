package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TechnicalPattern - Candlestick or chart pattern found on a history snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TechnicalPattern {

    private TechnicalPatternType type;
    private String name;
    private Direction direction;
    private int barIndex;           // index of the completing bar in the snapshot
    private long timestamp;
    private double confidence;      // 0-1
    private String description;
}
