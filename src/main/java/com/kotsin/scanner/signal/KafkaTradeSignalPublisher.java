package com.kotsin.scanner.signal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.scanner.config.KafkaTopics;
import com.kotsin.scanner.model.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * KafkaTradeSignalPublisher - Publishes trade signals as JSON to the trade-signals topic,
 * keyed by symbol.
 */
@Slf4j
@Component
public class KafkaTradeSignalPublisher implements TradeSignalSink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    private final AtomicLong publishSuccess = new AtomicLong(0);
    private final AtomicLong publishFailed = new AtomicLong(0);

    public KafkaTradeSignalPublisher(
            @Qualifier("signalKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "kafka:" + KafkaTopics.TRADE_SIGNALS;
    }

    @Override
    public void onSignal(TradeSignal signal) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(signal);
        } catch (JsonProcessingException e) {
            publishFailed.incrementAndGet();
            throw new IllegalStateException("Failed to serialize signal " + signal.getSignalId(), e);
        }

        CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(KafkaTopics.TRADE_SIGNALS, signal.getSymbol(), payload);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                publishSuccess.incrementAndGet();
                log.debug("[SIGNAL_PUB] Published {} to {} partition {} offset {}",
                        signal.getSignalId(), KafkaTopics.TRADE_SIGNALS,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                publishFailed.incrementAndGet();
                log.error("[SIGNAL_PUB] Failed to publish {} to {}: {}",
                        signal.getSignalId(), KafkaTopics.TRADE_SIGNALS, ex.getMessage());
            }
        });
    }

    public long getPublishSuccessCount() {
        return publishSuccess.get();
    }

    public long getPublishFailedCount() {
        return publishFailed.get();
    }
}
