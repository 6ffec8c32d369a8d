package com.baykanat.energy.meter.infrastructure.source;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Kaynaktan gelen ham kayıt. Bilinen kolonlar measurement, timestamp ve tags; geri kalan her kolon
 * (ör. OBIS kodu "0100011D00FF") readingColumns içine düşer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecord {

    @JsonProperty("measurement")
    private String measurement;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("tags")
    private SourceTags tags;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> readingColumns = new LinkedHashMap<>();

    @JsonAnySetter
    public void putReadingColumn(String column, Object value) {
        readingColumns.put(column, value);
    }
}
