package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Statik tarife yapılandırması: oranlar, peak saatleri, saatlik oran tablosu, tasarruf önerileri. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dual tariff pricing configuration")
public class PricingResponse {

    @JsonProperty("currency")
    @Schema(example = "CHF")
    private String currency;

    @JsonProperty("currency_symbol")
    @Schema(example = "Fr.")
    private String currencySymbol;

    @JsonProperty("tariff_type")
    @Schema(example = "dual")
    private String tariffType;

    @JsonProperty("average_rate_chf_per_kwh")
    private double averageRate;

    @JsonProperty("high_tariff_chf_per_kwh")
    private double highTariffRate;

    @JsonProperty("low_tariff_chf_per_kwh")
    private double lowTariffRate;

    @JsonProperty("peak_start_hour")
    @Schema(description = "Weekday peak start, inclusive", example = "7")
    private int peakStartHour;

    @JsonProperty("peak_end_hour")
    @Schema(description = "Weekday peak end, exclusive", example = "20")
    private int peakEndHour;

    @JsonProperty("high_tariff")
    private TariffInfo highTariff;

    @JsonProperty("low_tariff")
    private TariffInfo lowTariff;

    @JsonProperty("hourly_rates")
    private List<HourlyRate> hourlyRates;

    @JsonProperty("savings_tips")
    private List<Tip> savingsTips;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TariffInfo {

        @JsonProperty("name")
        private String name;

        @JsonProperty("description")
        private String description;

        @JsonProperty("rate_chf_per_kwh")
        private double rate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Applicable rate for one hour of day on weekdays and weekends")
    public static class HourlyRate {

        @JsonProperty("hour")
        private int hour;

        @JsonProperty("hour_label")
        @Schema(example = "07:00")
        private String hourLabel;

        @JsonProperty("weekday_rate")
        private double weekdayRate;

        @JsonProperty("weekday_tariff")
        @Schema(example = "high")
        private String weekdayTariff;

        @JsonProperty("weekend_rate")
        private double weekendRate;

        @JsonProperty("weekend_tariff")
        @Schema(example = "low")
        private String weekendTariff;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tip {

        @JsonProperty("title")
        private String title;

        @JsonProperty("description")
        private String description;

        @JsonProperty("potential_savings")
        private String potentialSavings;
    }
}
