package com.baykanat.energy.meter.domain.exception;

/** Veritabanı yazma/okuma hatası; sync döngüsü bir sonraki tetiklemede dener, sorgular 503 + Retry-After alır. */
public class StoreUnavailableException extends RuntimeException {

    private static final int DEFAULT_RETRY_AFTER_SECONDS = 30;

    private final int retryAfterSeconds;

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.retryAfterSeconds = DEFAULT_RETRY_AFTER_SECONDS;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
