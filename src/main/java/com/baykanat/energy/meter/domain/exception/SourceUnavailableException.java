package com.baykanat.energy.meter.domain.exception;

import com.baykanat.energy.meter.domain.model.MeasurementKind;

/** Kaynak çekimi başarısız (ağ, timeout, 2xx dışı yanıt, açık circuit breaker). O tür bu döngüde atlanır. */
public class SourceUnavailableException extends RuntimeException {

    private final MeasurementKind measurementKind;

    public SourceUnavailableException(MeasurementKind measurementKind, String message, Throwable cause) {
        super(message, cause);
        this.measurementKind = measurementKind;
    }

    public MeasurementKind getMeasurementKind() {
        return measurementKind;
    }
}
