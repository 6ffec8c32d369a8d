package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.CostBreakdownResponse;
import com.baykanat.energy.meter.domain.model.HourDayCell;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.domain.model.TariffClass;
import com.baykanat.energy.meter.domain.model.TariffPeriod;
import com.baykanat.energy.meter.domain.model.TariffPlan;
import com.baykanat.energy.meter.domain.model.WeekDays;
import com.baykanat.energy.meter.infrastructure.persistence.ReadingAnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;

/**
 * Aktif enerjinin (saat, gün) hücre toplamlarını tarifeye göre sınıflayıp maliyet dökümü üretir.
 * Reaktif enerji fiyatlandırılmaz. peak kWh + off-peak kWh her zaman toplam kWh'e eşittir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CostBreakdownService {

    private static final double PERCENT = 100.0;

    private final ReadingAnalyticsJdbcRepository analyticsRepository;
    private final TariffClassifier tariffClassifier;

    public CostBreakdownResponse costBreakdown(QueryFilter filter) {
        QueryFilter activeOnly = filter.withMeasurementKinds(EnumSet.of(MeasurementKind.ACTIVE));
        return breakdown(analyticsRepository.findHourDayCells(activeOnly));
    }

    CostBreakdownResponse breakdown(List<HourDayCell> cells) {
        double peakKwh = 0;
        double offPeakKwh = 0;
        for (HourDayCell cell : cells) {
            if (cell.getMeasurementKind() != MeasurementKind.ACTIVE) {
                continue;
            }
            TariffPeriod period = tariffClassifier.classify(cell.getHour(), WeekDays.isWeekend(cell.getDayOfWeek()));
            if (period.getTariffClass() == TariffClass.PEAK) {
                peakKwh += cell.getSum();
            } else {
                offPeakKwh += cell.getSum();
            }
        }

        TariffPlan plan = tariffClassifier.getTariffPlan();
        double peakRate = plan.getPeak().getRate();
        double offPeakRate = plan.getOffPeak().getRate();
        double totalKwh = peakKwh + offPeakKwh;
        double peakCost = peakKwh * peakRate;
        double offPeakCost = offPeakKwh * offPeakRate;
        double totalCost = peakCost + offPeakCost;

        log.debug("Cost breakdown: peak={} kWh, off-peak={} kWh, total cost={} {}",
                peakKwh, offPeakKwh, totalCost, plan.getCurrency());

        return CostBreakdownResponse.builder()
                .currency(plan.getCurrency())
                .totalKwh(totalKwh)
                .totalCost(totalCost)
                .effectiveRate(ratio(totalCost, totalKwh))
                .highTariff(share(plan.getPeak(), peakKwh, peakCost, totalKwh))
                .lowTariff(share(plan.getOffPeak(), offPeakKwh, offPeakCost, totalKwh))
                .comparison(CostBreakdownResponse.Comparison.builder()
                        .allPeakCost(totalKwh * peakRate)
                        .allOffPeakCost(totalKwh * offPeakRate)
                        .potentialSavings(peakKwh * plan.rateDifference())
                        .build())
                .build();
    }

    private static CostBreakdownResponse.TariffShare share(TariffPeriod period, double kwh, double cost,
                                                           double totalKwh) {
        return CostBreakdownResponse.TariffShare.builder()
                .name(period.getName())
                .kwh(kwh)
                .cost(cost)
                .rate(period.getRate())
                .percentOfTotal(ratio(kwh, totalKwh) * PERCENT)
                .build();
    }

    /** Toplam 0 ise bölme yapılmaz, 0 döner. */
    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }
}
