package com.baykanat.energy.meter.config;

import com.baykanat.energy.meter.domain.model.SavingsTip;
import com.baykanat.energy.meter.domain.model.TariffClass;
import com.baykanat.energy.meter.domain.model.TariffPeriod;
import com.baykanat.energy.meter.domain.model.TariffPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** app.tariff değerlerinden açılışta bir kez değişmez TariffPlan üretir. */
@Slf4j
@Configuration
public class TariffConfig {

    @Bean
    public TariffPlan tariffPlan(AppProperties appProperties) {
        return toPlan(appProperties.getTariff());
    }

    /** Saat aralığı geçersizse (start >= end) açılışı durdurur. */
    public static TariffPlan toPlan(AppProperties.TariffProperties tariff) {
        if (tariff.getPeakStartHour() >= tariff.getPeakEndHour()) {
            throw new IllegalStateException("app.tariff.peak-start-hour (" + tariff.getPeakStartHour()
                    + ") must be before app.tariff.peak-end-hour (" + tariff.getPeakEndHour() + ")");
        }

        TariffPlan.TariffPlanBuilder builder = TariffPlan.builder()
                .currency(tariff.getCurrency())
                .currencySymbol(tariff.getCurrencySymbol())
                .averageRate(tariff.getAverageRate())
                .peakStartHour(tariff.getPeakStartHour())
                .peakEndHour(tariff.getPeakEndHour())
                .peak(toPeriod(TariffClass.PEAK, tariff.getPeak()))
                .offPeak(toPeriod(TariffClass.OFF_PEAK, tariff.getOffPeak()));

        tariff.getSavingsTips().forEach(tip -> builder.savingsTip(SavingsTip.builder()
                .title(tip.getTitle())
                .description(tip.getDescription())
                .potentialSavings(tip.getPotentialSavings())
                .build()));

        TariffPlan plan = builder.build();
        log.info("Tariff plan loaded: peak {} {}/kWh weekdays {}:00-{}:00, off-peak {} {}/kWh",
                plan.getPeak().getRate(), plan.getCurrency(), plan.getPeakStartHour(), plan.getPeakEndHour(),
                plan.getOffPeak().getRate(), plan.getCurrency());
        return plan;
    }

    private static TariffPeriod toPeriod(TariffClass tariffClass, AppProperties.PeriodProperties period) {
        return TariffPeriod.builder()
                .tariffClass(tariffClass)
                .name(period.getName())
                .description(period.getDescription())
                .rate(period.getRate())
                .build();
    }
}
