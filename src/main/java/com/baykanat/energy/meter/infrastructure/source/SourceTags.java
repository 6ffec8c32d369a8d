package com.baykanat.energy.meter.infrastructure.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Kayıttaki iç içe tags yapısı: sayaç kimliği (muid) ve kalite etiketi. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SourceTags {

    @JsonProperty("muid")
    private String muid;

    @JsonProperty("quality")
    private String quality;
}
