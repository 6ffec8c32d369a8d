package com.baykanat.energy.meter.domain.exception;

import com.baykanat.energy.meter.domain.model.MeasurementKind;

/** Circuit breaker açıkken çekim hiç denenmedi; retry bu durumu tekrar denemez. */
public class SourceCircuitOpenException extends SourceUnavailableException {

    public SourceCircuitOpenException(MeasurementKind measurementKind, String message, Throwable cause) {
        super(measurementKind, message, cause);
    }
}
