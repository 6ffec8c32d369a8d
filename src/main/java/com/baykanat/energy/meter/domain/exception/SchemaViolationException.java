package com.baykanat.energy.meter.domain.exception;

/** Kaynak payload'ı beklenen şekilde değil; döngü için ölümcül, yutulmaz. */
public class SchemaViolationException extends RuntimeException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
