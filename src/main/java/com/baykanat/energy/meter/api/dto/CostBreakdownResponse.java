package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aktif enerji için peak / off-peak maliyet dökümü ve karşı senaryolar. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Time-of-use cost breakdown of active energy")
public class CostBreakdownResponse {

    @JsonProperty("currency")
    @Schema(example = "CHF")
    private String currency;

    @JsonProperty("total_kwh")
    private double totalKwh;

    @JsonProperty("total_cost_chf")
    private double totalCost;

    @JsonProperty("effective_rate_chf_per_kwh")
    @Schema(description = "total cost / total kWh, 0 when nothing was consumed")
    private double effectiveRate;

    @JsonProperty("high_tariff")
    private TariffShare highTariff;

    @JsonProperty("low_tariff")
    private TariffShare lowTariff;

    @JsonProperty("comparison")
    private Comparison comparison;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Consumption and cost for one tariff")
    public static class TariffShare {

        @JsonProperty("name")
        @Schema(example = "Hochtarif (HT)")
        private String name;

        @JsonProperty("kwh")
        private double kwh;

        @JsonProperty("cost_chf")
        private double cost;

        @JsonProperty("rate_chf_per_kwh")
        @Schema(example = "0.32")
        private double rate;

        @JsonProperty("percent_of_total")
        private double percentOfTotal;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Counterfactual scenarios")
    public static class Comparison {

        @JsonProperty("all_high_tariff_cost_chf")
        @Schema(description = "Cost if all consumption had been billed at the peak rate")
        private double allPeakCost;

        @JsonProperty("all_low_tariff_cost_chf")
        @Schema(description = "Cost if all consumption had been billed at the off-peak rate")
        private double allOffPeakCost;

        @JsonProperty("potential_savings_chf")
        @Schema(description = "Savings from shifting all peak consumption to off-peak")
        private double potentialSavings;
    }
}
