package com.baykanat.energy.meter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** (saat, haftanın günü, ölçüm türü) hücresi için toplam, ortalama ve adet. dayOfWeek: 0=Pazar … 6=Cumartesi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourDayCell {

    private MeasurementKind measurementKind;
    private int hour;
    private int dayOfWeek;
    private double sum;
    private double average;
    private long count;
}
