package com.baykanat.energy.meter.infrastructure.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Feed dosyasının kökü: {"data": [...]}; kaynak filtre/sayfalama desteklemez, her seferinde tüm seri gelir. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourcePayload {

    @JsonProperty("data")
    private List<SourceRecord> data;
}
