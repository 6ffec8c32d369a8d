package com.baykanat.energy.meter.domain.exception;

/** İstemciden gelen hatalı tarih, sayfa veya seçim değeri; GlobalExceptionHandler 400 döner. */
public class MalformedInputException extends RuntimeException {

    private final String parameter;

    public MalformedInputException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public MalformedInputException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
