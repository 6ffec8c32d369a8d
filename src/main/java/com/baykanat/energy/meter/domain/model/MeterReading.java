package com.baykanat.energy.meter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** meter_readings tablosu satırı için domain model (JDBC, JPA değil). Anahtar: muid + timestamp + measurement_type. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeterReading {

    private Instant timestamp;
    private String meterId;
    private MeasurementKind measurementKind;
    private double value; // kWh
    private String quality;
}
