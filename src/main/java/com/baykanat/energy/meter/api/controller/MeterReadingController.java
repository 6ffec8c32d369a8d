package com.baykanat.energy.meter.api.controller;

import com.baykanat.energy.meter.api.dto.MeterReadingsQueryParams;
import com.baykanat.energy.meter.api.dto.MeterReadingsResponse;
import com.baykanat.energy.meter.api.dto.PricingResponse;
import com.baykanat.energy.meter.domain.service.MeterReadingQueryService;
import com.baykanat.energy.meter.domain.service.PricingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /meter_readings ve GET /pricing; doğrulama ve hesaplama servis katmanında. */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Meter readings", description = "Stored meter readings with aggregation, patterns and tariff costs")
public class MeterReadingController {

    private final MeterReadingQueryService queryService;
    private final PricingService pricingService;

    @GetMapping("/meter_readings")
    @Operation(summary = "Query meter readings",
            description = "Returns raw or bucketed readings for a date window plus optional stats, patterns, heatmap and cost breakdown")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Readings retrieved successfully"),
            @ApiResponse(responseCode = "400", description = "Malformed date, selector or pagination parameter"),
            @ApiResponse(responseCode = "503", description = "Reading store unavailable")
    })
    public ResponseEntity<MeterReadingsResponse> getMeterReadings(
            @Parameter(description = "Inclusive start date (ISO)", example = "2023-02-01")
            @RequestParam(value = "start", required = false) String start,

            @Parameter(description = "Inclusive end date (ISO)", example = "2023-02-28")
            @RequestParam(value = "end", required = false) String end,

            @Parameter(description = "active, reactive or both", example = "both")
            @RequestParam(value = "meter", required = false) String meter,

            @Parameter(description = "raw, hourly, daily or weekly", example = "hourly")
            @RequestParam(value = "aggregation", required = false) String aggregation,

            @Parameter(description = "Only Monday-Friday readings")
            @RequestParam(value = "weekday_only", required = false) Boolean weekdayOnly,

            @Parameter(description = "Only Saturday-Sunday readings")
            @RequestParam(value = "weekend_only", required = false) Boolean weekendOnly,

            @Parameter(description = "Comma separated: stats, patterns, heatmap, cost", example = "stats,cost")
            @RequestParam(value = "include", required = false) String include,

            @Parameter(description = "1-based page number", example = "1")
            @RequestParam(value = "page", required = false) Integer page,

            @Parameter(description = "Page size", example = "10000")
            @RequestParam(value = "per_page", required = false) Integer perPage
    ) {
        MeterReadingsQueryParams params = MeterReadingsQueryParams.builder()
                .start(start)
                .end(end)
                .meter(meter)
                .aggregation(aggregation)
                .weekdayOnly(weekdayOnly)
                .weekendOnly(weekendOnly)
                .include(include)
                .page(page)
                .perPage(perPage)
                .build();

        return ResponseEntity.ok(queryService.query(params));
    }

    @GetMapping("/pricing")
    @Operation(summary = "Get tariff configuration", description = "Returns rates, peak hours, the hourly rate table and savings tips")
    @ApiResponse(responseCode = "200", description = "Pricing retrieved successfully")
    public ResponseEntity<PricingResponse> getPricing() {
        return ResponseEntity.ok(pricingService.pricing());
    }
}
