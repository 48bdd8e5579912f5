package com.kotsin.scanner.retry;

import com.kotsin.scanner.config.ProcessingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff for calls to external collaborators.
 */
@Component
@Slf4j
public class RetryHandler {

    private final long initialDelayMs;
    private final long maxDelayMs;

    public RetryHandler() {
        this(ProcessingConstants.INITIAL_RETRY_DELAY_MS, ProcessingConstants.MAX_RETRY_DELAY_MS);
    }

    public RetryHandler(long initialDelayMs, long maxDelayMs) {
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Execute operation with retry logic
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, ProcessingConstants.MAX_RETRY_ATTEMPTS);
    }

    /**
     * Execute operation with custom retry count. Non-retryable failures are rethrown at once.
     *
     * @throws RetryExhaustedException when every attempt failed
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts) {
        int attempt = 0;
        Exception lastException = null;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (Exception e) {
                lastException = e;
                attempt++;

                if (!isRetryable(e)) {
                    log.warn("[RETRY] Operation '{}' failed with non-retryable error: {}", operationName, e.getMessage());
                    break;
                }
                if (attempt >= maxAttempts) {
                    log.error("[RETRY] Operation '{}' failed after {} attempts", operationName, maxAttempts);
                    break;
                }

                long delayMs = calculateBackoffDelay(attempt);
                log.warn("[RETRY] Operation '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                        operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException("Retry of '" + operationName + "' interrupted", ie);
                }
            }
        }

        throw new RetryExhaustedException(
                String.format("Operation '%s' failed after %d attempts", operationName, attempt),
                lastException);
    }

    long calculateBackoffDelay(int attempt) {
        long delay = (long) (initialDelayMs * Math.pow(ProcessingConstants.RETRY_BACKOFF_MULTIPLIER, attempt - 1));
        return Math.min(delay, maxDelayMs);
    }

    /**
     * Programming errors are not worth retrying; everything else is treated as transient.
     */
    public boolean isRetryable(Exception e) {
        return !(e instanceof IllegalArgumentException
                || e instanceof NullPointerException
                || e instanceof UnsupportedOperationException);
    }
}
