package com.baykanat.insider.insights.domain.exception;

/** Event kaynağı eşzamanlılık sınırına takıldı veya circuit breaker açık; istemci tekrar deneyebilir. */
public class ConcurrencyLimitExceededException extends RuntimeException {

    private final int retryAfterSeconds;

    public ConcurrencyLimitExceededException(String message, int retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
