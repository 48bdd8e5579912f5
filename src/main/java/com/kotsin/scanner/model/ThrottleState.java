package com.kotsin.scanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * ThrottleState - Per-symbol signal rate state. Only mutated by SignalThrottle.
 */
@Data
@NoArgsConstructor
public class ThrottleState {

    private Instant lastSignalTimestamp;
    private int signalCountToday;
    private Instant dayBoundary;    // next local midnight; count resets once passed
}
