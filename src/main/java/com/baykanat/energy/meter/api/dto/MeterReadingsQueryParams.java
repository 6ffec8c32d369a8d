package com.baykanat.energy.meter.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** GET /meter_readings ham sorgu parametreleri; doğrulama QueryFilterBuilder ve ReadingAggregationService'te. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query parameters for the meter readings endpoint")
public class MeterReadingsQueryParams {

    @Schema(description = "Inclusive start date (ISO)", example = "2023-02-01")
    private String start;

    @Schema(description = "Inclusive end date (ISO)", example = "2023-02-28")
    private String end;

    @Schema(description = "active, reactive or both. Default: both", example = "both")
    private String meter;

    @Schema(description = "raw, hourly, daily or weekly. Default: raw", example = "hourly")
    private String aggregation;

    @Schema(description = "Only Monday-Friday readings")
    private Boolean weekdayOnly;

    @Schema(description = "Only Saturday-Sunday readings")
    private Boolean weekendOnly;

    @Schema(description = "Comma separated sections: stats, patterns, heatmap, cost", example = "stats,cost")
    private String include;

    @Schema(description = "1-based page number. Default: 1", example = "1")
    private Integer page;

    @Schema(description = "Page size. Default from app.analytics.default-per-page", example = "10000")
    private Integer perPage;
}
