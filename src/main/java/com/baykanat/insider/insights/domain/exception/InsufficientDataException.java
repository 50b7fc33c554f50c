package com.baykanat.insider.insights.domain.exception;

/** Sorgu kapsamında hiç veri yok (ör. all-time aralık için en erken timestamp bulunamadı). */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
