package com.kotsin.scanner.indicator;

import com.kotsin.scanner.config.ScannerConfigRegistry;
import com.kotsin.scanner.config.ScannerProperties;
import com.kotsin.scanner.model.Candle;
import com.kotsin.scanner.model.IndicatorSnapshot;
import com.kotsin.scanner.retry.RetryHandler;
import com.kotsin.scanner.util.CircuitBreaker;
import com.kotsin.scanner.util.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * IndicatorGateway - The only path from the scan workers to the indicator provider.
 *
 * Each fetch takes a permit from the shared per-minute budget, then runs through the
 * circuit breaker with retries inside it. Any failure ends as an empty result; the
 * confluence factors that need indicators then fail for this tick.
 */
@Component
@Slf4j
public class IndicatorGateway {

    private final IndicatorSnapshotProvider provider;
    private final RetryHandler retryHandler;
    private final ScannerConfigRegistry configRegistry;
    private final TokenBucketRateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;

    public IndicatorGateway(IndicatorSnapshotProvider provider, RetryHandler retryHandler,
                            ScannerConfigRegistry configRegistry) {
        this.provider = provider;
        this.retryHandler = retryHandler;
        this.configRegistry = configRegistry;

        ScannerProperties props = configRegistry.current();
        ScannerProperties.Indicator config = props.getIndicator();
        this.rateLimiter = new TokenBucketRateLimiter(props.getSession().getIntraday().getApiBudgetPerMinute());
        this.circuitBreaker = new CircuitBreaker("indicator-provider", config.getCircuitFailureThreshold(),
                config.getCircuitOpenTimeout(), config.getCircuitHalfOpenCalls());
    }

    /**
     * Fetch indicators for the last bar of {@code history}.
     */
    public Optional<IndicatorSnapshot> fetch(String symbol, String interval, List<Candle> history) {
        ScannerProperties.Indicator config = configRegistry.current().getIndicator();

        if (!rateLimiter.tryAcquire(config.getPermitTimeout())) {
            log.debug("[INDICATOR] {} skipped: API budget of {}/min exhausted",
                    symbol, rateLimiter.getPermitsPerMinute());
            return Optional.empty();
        }

        IndicatorSnapshot snapshot = circuitBreaker.execute(
                () -> retryHandler.executeWithRetry(
                        () -> provider.getSnapshot(symbol, interval, history),
                        "indicators:" + symbol,
                        config.getRetryAttempts()),
                () -> null);

        if (snapshot == null) {
            log.warn("[INDICATOR] {} no indicator snapshot this tick ({})", symbol, circuitBreaker.getStats());
        }
        return Optional.ofNullable(snapshot);
    }

    /**
     * Apply the active session's API budget.
     */
    public void updateBudget(int permitsPerMinute) {
        rateLimiter.updateBudget(permitsPerMinute);
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    TokenBucketRateLimiter getRateLimiter() {
        return rateLimiter;
    }
}
