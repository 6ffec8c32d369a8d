package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/** Her ölçüm türü için 24 satır (saat) x 7 kolon (0=Pazar … 6=Cumartesi) ortalama matrisi; boş hücre 0.0. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Average reading per hour of day and day of week")
public class HeatmapResponse {

    @JsonProperty("hours")
    private List<Integer> hours;

    @JsonProperty("days")
    @Schema(description = "Column labels, Sunday first")
    private List<String> days;

    @JsonProperty("values")
    @Schema(description = "measurement_type -> [hour][day_of_week] average reading")
    private Map<String, List<List<Double>>> values;
}
