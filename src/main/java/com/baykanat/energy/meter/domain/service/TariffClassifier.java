package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.domain.model.TariffPeriod;
import com.baykanat.energy.meter.domain.model.TariffPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * (günün saati, hafta sonu mu) → tarife. Hafta sonu her saat off-peak; hafta içi
 * [peakStartHour, peakEndHour) peak, geri kalan off-peak. Saf fonksiyon, durum tutmaz.
 */
@Component
@RequiredArgsConstructor
public class TariffClassifier {

    public static final int HOURS_IN_DAY = 24;

    private final TariffPlan tariffPlan;

    public TariffPeriod classify(int hour, boolean weekend) {
        if (hour < 0 || hour >= HOURS_IN_DAY) {
            throw new IllegalArgumentException("hour must be 0..23, got " + hour);
        }
        if (weekend) {
            return tariffPlan.getOffPeak();
        }
        boolean peakHour = hour >= tariffPlan.getPeakStartHour() && hour < tariffPlan.getPeakEndHour();
        return peakHour ? tariffPlan.getPeak() : tariffPlan.getOffPeak();
    }

    public TariffPlan getTariffPlan() {
        return tariffPlan;
    }
}
