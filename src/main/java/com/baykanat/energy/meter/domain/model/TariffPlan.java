package com.baykanat.energy.meter.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Süreç boyunca değişmeyen çift tarife planı. Peak yalnızca hafta içi [peakStartHour, peakEndHour)
 * aralığında geçerlidir; geri kalan her şey off-peak.
 */
@Value
@Builder
public class TariffPlan {

    String currency;
    String currencySymbol;
    double averageRate;

    int peakStartHour;
    int peakEndHour;

    TariffPeriod peak;
    TariffPeriod offPeak;

    @Singular
    List<SavingsTip> savingsTips;

    /** kWh başına peak ile off-peak arasındaki fark. */
    public double rateDifference() {
        return peak.getRate() - offPeak.getRate();
    }
}
