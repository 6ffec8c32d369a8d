package com.baykanat.energy.meter.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/** GET /meter_readings yanıt zarfı: data + sayfalama + fiyat bilgisi; include ile istenen bölümler. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Meter readings envelope with optional analytics sections")
public class MeterReadingsResponse {

    @JsonProperty("data")
    @Schema(description = "Raw readings (aggregation=raw) or aggregated buckets")
    private List<?> data;

    @JsonProperty("pagination")
    private Pagination pagination;

    @JsonProperty("pricing")
    @Schema(description = "Static tariff configuration, always present")
    private PricingResponse pricing;

    @JsonProperty("stats")
    @Schema(description = "Summary statistics per measurement type (include=stats)")
    private List<ReadingStats> stats;

    @JsonProperty("hourly_pattern")
    @Schema(description = "Per hour-of-day statistics (include=patterns)")
    private List<HourlyPatternEntry> hourlyPattern;

    @JsonProperty("daily_pattern")
    @Schema(description = "Per day-of-week statistics (include=patterns)")
    private List<DailyPatternEntry> dailyPattern;

    @JsonProperty("heatmap")
    @Schema(description = "24x7 average matrix per measurement type (include=heatmap)")
    private HeatmapResponse heatmap;

    @JsonProperty("cost_breakdown")
    @Schema(description = "Peak / off-peak cost breakdown of active energy (include=cost)")
    private CostBreakdownResponse costBreakdown;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Pagination metadata")
    public static class Pagination {

        @JsonProperty("page")
        @Schema(example = "1")
        private int page;

        @JsonProperty("per_page")
        @Schema(example = "10000")
        private int perPage;

        @JsonProperty("total_count")
        @Schema(example = "8640")
        private long totalCount;

        @JsonProperty("total_pages")
        @Schema(example = "1")
        private long totalPages;

        @JsonProperty("has_next")
        private boolean hasNext;

        @JsonProperty("has_prev")
        private boolean hasPrev;

        /** total_pages = ceil(total_count / per_page); kayıt yoksa 0. */
        public static Pagination of(int page, int perPage, long totalCount) {
            long totalPages = (totalCount + perPage - 1) / perPage;
            return Pagination.builder()
                    .page(page)
                    .perPage(perPage)
                    .totalCount(totalCount)
                    .totalPages(totalPages)
                    .hasNext(page < totalPages)
                    .hasPrev(page > 1)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Single stored reading with derived hour and day of week")
    public static class ReadingRow {

        @JsonProperty("timestamp")
        @Schema(example = "2023-02-28T23:45:00Z")
        private Instant timestamp;

        @JsonProperty("muid")
        @Schema(description = "Meter identifier")
        private String meterId;

        @JsonProperty("measurement_type")
        @Schema(example = "active")
        private String measurementType;

        @JsonProperty("reading")
        @Schema(description = "Reading in kWh", example = "0.0117")
        private double reading;

        @JsonProperty("quality")
        @Schema(example = "measured")
        private String quality;

        @JsonProperty("hour")
        @Schema(example = "23")
        private int hour;

        @JsonProperty("day_of_week")
        @Schema(description = "0=Sunday ... 6=Saturday", example = "2")
        private int dayOfWeek;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Aggregation for a time bucket and measurement type")
    public static class AggregatedBucket {

        @JsonProperty("timestamp")
        @Schema(description = "Bucket start", example = "2023-02-28T23:00:00Z")
        private Instant bucketStart;

        @JsonProperty("measurement_type")
        private String measurementType;

        @JsonProperty("total_reading")
        private double sum;

        @JsonProperty("count")
        private long count;

        @JsonProperty("avg_reading")
        private double mean;

        @JsonProperty("min_reading")
        private double min;

        @JsonProperty("max_reading")
        private double max;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Summary statistics for one measurement type")
    public static class ReadingStats {

        @JsonProperty("measurement_type")
        private String measurementType;

        @JsonProperty("count")
        private long count;

        @JsonProperty("total_reading")
        private double total;

        @JsonProperty("avg_reading")
        private double mean;

        @JsonProperty("min_reading")
        private double min;

        @JsonProperty("max_reading")
        private double max;

        @JsonProperty("std_reading")
        private double stdDev;

        @JsonProperty("first_timestamp")
        private Instant firstTimestamp;

        @JsonProperty("last_timestamp")
        private Instant lastTimestamp;
    }
}
