package com.kotsin.scanner.scan;

import com.kotsin.scanner.model.SymbolHistory;
import com.kotsin.scanner.model.TechnicalPattern;
import com.kotsin.scanner.model.ThrottleState;
import lombok.Getter;
import lombok.Setter;

/**
 * Everything the scan loop keeps for one symbol. Only one worker touches a given
 * state at a time; ticks never overlap.
 */
@Getter
public class SymbolScanState {

    private final String symbol;
    private final SymbolHistory history;
    private final ThrottleState throttleState = new ThrottleState();

    @Setter
    private TechnicalPattern lastTechnicalPattern;

    /** Timestamp of the newest bar already scanned, null before the first scan */
    @Setter
    private Long lastScannedTimestamp;

    public SymbolScanState(String symbol, String interval, int maxHistory) {
        this.symbol = symbol;
        this.history = new SymbolHistory(symbol, interval, maxHistory);
    }
}
