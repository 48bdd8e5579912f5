package com.kotsin.scanner.signal;

import com.kotsin.scanner.model.TradeSignal;

/**
 * Receiver of emitted trade signals. Every Spring bean implementing this is registered
 * with the TradeSignalDispatcher.
 */
public interface TradeSignalSink {

    String getName();

    /**
     * Deliver one signal. Exceptions are logged by the dispatcher and never reach the scan loop.
     */
    void onSignal(TradeSignal signal);
}
