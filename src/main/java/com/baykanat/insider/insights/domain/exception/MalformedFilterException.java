package com.baykanat.insider.insights.domain.exception;

/** Property filter ağacı veya expression ifadesi çözümlenemedi. */
public class MalformedFilterException extends InsightValidationException {

    public MalformedFilterException(String message) {
        super(message);
    }

    public MalformedFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
