package com.kotsin.scanner.retry;

/**
 * Thrown by RetryHandler when an operation did not succeed within its attempts.
 */
public class RetryExhaustedException extends RuntimeException {

    public RetryExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
