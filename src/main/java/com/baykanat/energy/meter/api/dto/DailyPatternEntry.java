package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ölçüm türü ve haftanın günü (0=Pazar … 6=Cumartesi) başına toplam, adet ve ortalama. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Day-of-week usage statistics")
public class DailyPatternEntry {

    @JsonProperty("measurement_type")
    private String measurementType;

    @JsonProperty("day_of_week")
    @Schema(description = "0=Sunday ... 6=Saturday", example = "1")
    private int dayOfWeek;

    @JsonProperty("day_name")
    @Schema(example = "Monday")
    private String dayName;

    @JsonProperty("total_reading")
    private double sum;

    @JsonProperty("count")
    private long count;

    @JsonProperty("avg_reading")
    private double mean;
}
