package com.kotsin.scanner.feed;

import com.kotsin.scanner.config.ProcessingConstants;
import com.kotsin.scanner.model.RawCandle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CandleInbox - Per-symbol arrival-ordered queues between the feed and the scan loop.
 *
 * Any thread may offer; only the scan loop drains. A full queue drops the new candle.
 */
@Component
@Slf4j
public class CandleInbox {

    private final Map<String, BlockingQueue<RawCandle>> queues = new ConcurrentHashMap<>();
    private final int capacityPerSymbol;
    private final AtomicLong dropped = new AtomicLong();

    public CandleInbox() {
        this(ProcessingConstants.INBOX_CAPACITY_PER_SYMBOL);
    }

    public CandleInbox(int capacityPerSymbol) {
        this.capacityPerSymbol = capacityPerSymbol;
    }

    public boolean offer(RawCandle candle) {
        if (candle == null || candle.getSymbol() == null || candle.getSymbol().isBlank()) {
            dropped.incrementAndGet();
            log.debug("[FEED] Dropping candle without symbol: {}", candle);
            return false;
        }
        String symbol = candle.getSymbol().trim();
        boolean accepted = queues.computeIfAbsent(symbol, s -> new LinkedBlockingQueue<>(capacityPerSymbol))
                .offer(candle);
        if (!accepted) {
            dropped.incrementAndGet();
            log.warn("[FEED] Inbox for {} full ({}), dropping candle @{}", symbol, capacityPerSymbol,
                    candle.getTimestamp());
        }
        return accepted;
    }

    /**
     * Remove and return everything queued for the symbol, oldest first.
     */
    public List<RawCandle> drain(String symbol) {
        BlockingQueue<RawCandle> queue = queues.get(symbol);
        List<RawCandle> drained = new ArrayList<>();
        if (queue != null) {
            queue.drainTo(drained);
        }
        return drained;
    }

    public int pending(String symbol) {
        BlockingQueue<RawCandle> queue = queues.get(symbol);
        return queue == null ? 0 : queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
