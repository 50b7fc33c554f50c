package com.baykanat.insider.insights.domain.exception;

import java.util.List;

/** Sorgu yapısal olarak geçersiz; herhangi bir actor işlenmeden fırlatılır. GlobalExceptionHandler 400 döner. */
public class InsightValidationException extends RuntimeException {

    private final List<String> details;

    public InsightValidationException(String message) {
        this(message, List.of());
    }

    public InsightValidationException(String message, List<String> details) {
        super(message);
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public InsightValidationException(String message, Throwable cause) {
        super(message, cause);
        this.details = List.of();
    }

    public List<String> getDetails() {
        return details;
    }
}
