package com.kotsin.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SwingPoint - Confirmed local extremum of a history snapshot.
 *
 * Derived data: recomputed from the snapshot on every scan and never stored on its own.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwingPoint {

    public enum Kind {
        HIGH,
        LOW
    }

    private int index;          // position in the snapshot the swing was extracted from
    private double price;
    private long timestamp;
    private Kind kind;

    public boolean isHigh() {
        return kind == Kind.HIGH;
    }
}
