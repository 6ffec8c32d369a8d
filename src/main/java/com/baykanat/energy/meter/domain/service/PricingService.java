package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.PricingResponse;
import com.baykanat.energy.meter.domain.model.TariffPeriod;
import com.baykanat.energy.meter.domain.model.TariffPlan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.IntStream;

/** Statik tarife yapılandırmasını ve 24 saatlik oran tablosunu PricingResponse'a çevirir. */
@Service
@RequiredArgsConstructor
public class PricingService {

    private static final String TARIFF_TYPE = "dual";

    private final TariffClassifier tariffClassifier;

    public PricingResponse pricing() {
        TariffPlan plan = tariffClassifier.getTariffPlan();
        return PricingResponse.builder()
                .currency(plan.getCurrency())
                .currencySymbol(plan.getCurrencySymbol())
                .tariffType(TARIFF_TYPE)
                .averageRate(plan.getAverageRate())
                .highTariffRate(plan.getPeak().getRate())
                .lowTariffRate(plan.getOffPeak().getRate())
                .peakStartHour(plan.getPeakStartHour())
                .peakEndHour(plan.getPeakEndHour())
                .highTariff(toInfo(plan.getPeak()))
                .lowTariff(toInfo(plan.getOffPeak()))
                .hourlyRates(hourlyRates())
                .savingsTips(plan.getSavingsTips().stream()
                        .map(tip -> PricingResponse.Tip.builder()
                                .title(tip.getTitle())
                                .description(tip.getDescription())
                                .potentialSavings(tip.getPotentialSavings())
                                .build())
                        .toList())
                .build();
    }

    /** Her saat için hafta içi ve hafta sonu geçerli oran. */
    public List<PricingResponse.HourlyRate> hourlyRates() {
        return IntStream.range(0, TariffClassifier.HOURS_IN_DAY)
                .mapToObj(hour -> {
                    TariffPeriod weekday = tariffClassifier.classify(hour, false);
                    TariffPeriod weekend = tariffClassifier.classify(hour, true);
                    return PricingResponse.HourlyRate.builder()
                            .hour(hour)
                            .hourLabel(String.format("%02d:00", hour))
                            .weekdayRate(weekday.getRate())
                            .weekdayTariff(weekday.getTariffClass().getLabel())
                            .weekendRate(weekend.getRate())
                            .weekendTariff(weekend.getTariffClass().getLabel())
                            .build();
                })
                .toList();
    }

    private static PricingResponse.TariffInfo toInfo(TariffPeriod period) {
        return PricingResponse.TariffInfo.builder()
                .name(period.getName())
                .description(period.getDescription())
                .rate(period.getRate())
                .build();
    }
}
