package com.kotsin.scanner.signal;

import com.kotsin.scanner.model.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TradeSignalDispatcher - Fire-and-forget delivery of signals to every registered sink.
 *
 * Each sink call runs on the dispatch executor, so a slow or failing sink never blocks a scan.
 * Failures are logged and counted.
 */
@Component
@Slf4j
public class TradeSignalDispatcher {

    private final List<TradeSignalSink> sinks;
    private final Executor dispatchExecutor;

    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public TradeSignalDispatcher(List<TradeSignalSink> sinks,
                                 @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        this.sinks = List.copyOf(sinks);
        this.dispatchExecutor = dispatchExecutor;
        log.info("[DISPATCH] Registered sinks: {}", this.sinks.stream().map(TradeSignalSink::getName).toList());
    }

    public void dispatch(TradeSignal signal) {
        for (TradeSignalSink sink : sinks) {
            try {
                dispatchExecutor.execute(() -> deliver(sink, signal));
            } catch (RejectedExecutionException e) {
                failed.incrementAndGet();
                log.error("[DISPATCH] Signal {} for {} rejected by executor for sink {}: {}",
                        signal.getSignalId(), signal.getSymbol(), sink.getName(), e.getMessage());
            }
        }
    }

    private void deliver(TradeSignalSink sink, TradeSignal signal) {
        try {
            sink.onSignal(signal);
            dispatched.incrementAndGet();
        } catch (Exception e) {
            failed.incrementAndGet();
            log.error("[DISPATCH] Sink {} failed for signal {} ({}): {}",
                    sink.getName(), signal.getSignalId(), signal.getSymbol(), e.getMessage(), e);
        }
    }

    public long getDispatchedCount() {
        return dispatched.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
