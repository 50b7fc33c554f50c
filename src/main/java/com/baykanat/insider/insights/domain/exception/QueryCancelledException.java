package com.baykanat.insider.insights.domain.exception;

/** Sorgu iptal edildi veya deadline aşıldı; kısmi sonuçlar atılır. */
public class QueryCancelledException extends RuntimeException {

    public QueryCancelledException(String message) {
        super(message);
    }

    public QueryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
