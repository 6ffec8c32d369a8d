package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.MeterReadingsQueryParams;
import com.baykanat.energy.meter.api.dto.MeterReadingsResponse;
import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.exception.StoreUnavailableException;
import com.baykanat.energy.meter.domain.model.Granularity;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.domain.model.ReadingPage;
import com.baykanat.energy.meter.domain.model.ResponseSection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * GET /meter_readings: parametreleri bir kez QueryFilter'a çevirir, data + sayfalama + pricing'i
 * ve include ile istenen bölümleri aynı filtre üzerinden hesaplayıp tek zarfta birleştirir.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeterReadingQueryService {

    private final QueryFilterBuilder filterBuilder;
    private final ReadingAggregationService aggregationService;
    private final UsagePatternService patternService;
    private final CostBreakdownService costBreakdownService;
    private final PricingService pricingService;
    private final AppProperties appProperties;

    public MeterReadingsResponse query(MeterReadingsQueryParams params) {
        QueryFilter filter = filterBuilder.build(params.getStart(), params.getEnd(), params.getMeter(),
                params.getWeekdayOnly(), params.getWeekendOnly());
        Granularity granularity = Granularity.parse(params.getAggregation());
        Set<ResponseSection> sections = ResponseSection.parseInclude(params.getInclude());
        int page = params.getPage() != null ? params.getPage() : 1;
        int perPage = params.getPerPage() != null ? params.getPerPage()
                : appProperties.getAnalytics().getDefaultPerPage();

        log.debug("Meter readings query: filter={}, aggregation={}, include={}, page={}, per_page={}",
                filter, granularity.getValue(), sections, page, perPage);

        try {
            ReadingPage<?> result = aggregationService.fetch(filter, granularity, page, perPage);

            MeterReadingsResponse.MeterReadingsResponseBuilder response = MeterReadingsResponse.builder()
                    .data(result.getItems())
                    .pagination(MeterReadingsResponse.Pagination.of(page, perPage, result.getTotalCount()))
                    .pricing(pricingService.pricing());

            if (sections.contains(ResponseSection.STATS)) {
                response.stats(aggregationService.stats(filter));
            }
            if (sections.contains(ResponseSection.PATTERNS)) {
                response.hourlyPattern(patternService.hourlyPattern(filter));
                response.dailyPattern(patternService.dailyPattern(filter));
            }
            if (sections.contains(ResponseSection.HEATMAP)) {
                response.heatmap(patternService.heatmap(filter));
            }
            if (sections.contains(ResponseSection.COST)) {
                response.costBreakdown(costBreakdownService.costBreakdown(filter));
            }
            return response.build();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Meter reading store unavailable: "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
