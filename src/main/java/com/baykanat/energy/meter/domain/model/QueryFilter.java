package com.baykanat.energy.meter.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Bir isteğin normalize edilmiş kısıtları. İstek başına bir kez kurulur ve tüm alt sorgulara
 * aynen geçirilir; böylece yanıtın her bölümü aynı veri dilimi üzerinden hesaplanır.
 */
@Value
@Builder(toBuilder = true)
public class QueryFilter {

    /** Dahil; null ise alt sınır yok. */
    LocalDate startDate;

    /** Dahil; null ise üst sınır yok. */
    LocalDate endDate;

    Set<MeasurementKind> measurementKinds;

    @Builder.Default
    DayPeriod dayPeriod = DayPeriod.ALL;

    /** Ölçüm türü kısıtını verilen kümeyle değiştirir (heatmap ve maliyet hesabı için). */
    public QueryFilter withMeasurementKinds(Set<MeasurementKind> kinds) {
        return toBuilder().measurementKinds(kinds).build();
    }
}
