package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Ölçüm türü ve günün saati başına ortalama / std / min / max. Tek örnekli grupta std 0. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Hour-of-day usage statistics")
public class HourlyPatternEntry {

    @JsonProperty("measurement_type")
    private String measurementType;

    @JsonProperty("hour")
    @Schema(example = "18")
    private int hour;

    @JsonProperty("avg_reading")
    private double mean;

    @JsonProperty("std_reading")
    private double stdDev;

    @JsonProperty("min_reading")
    private double min;

    @JsonProperty("max_reading")
    private double max;

    @JsonProperty("count")
    private long count;
}
