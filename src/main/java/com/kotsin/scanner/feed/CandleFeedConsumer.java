package com.kotsin.scanner.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.config.KafkaTopics;
import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.model.RawCandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * CandleFeedConsumer - Kafka entry point for raw candles.
 *
 * Parses JSON into RawCandle and queues it for the scan loop. Symbols outside the
 * watchlist are ignored. Validation happens later on the scan thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CandleFeedConsumer {

    private final ObjectMapper objectMapper;
    private final CandleInbox inbox;
    private final ScannerConfigRegistry configRegistry;

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong unparseable = new AtomicLong();

    @KafkaListener(
            topics = KafkaTopics.SCANNER_CANDLES,
            containerFactory = "candleListenerContainerFactory"
    )
    public void onCandle(String payload) {
        received.incrementAndGet();
        RawCandle candle;
        try {
            candle = objectMapper.readValue(payload, RawCandle.class);
        } catch (JsonProcessingException e) {
            unparseable.incrementAndGet();
            log.warn("[FEED] Unparseable candle payload: {}", e.getOriginalMessage());
            return;
        }

        if (candle.getSymbol() == null
                || !configRegistry.current().getWatchlist().getSymbols().contains(candle.getSymbol().trim())) {
            log.debug("[FEED] Ignoring candle for {} (not on watchlist)", candle.getSymbol());
            return;
        }
        inbox.offer(candle);
    }

    public long getReceivedCount() {
        return received.get();
    }

    public long getUnparseableCount() {
        return unparseable.get();
    }
}
