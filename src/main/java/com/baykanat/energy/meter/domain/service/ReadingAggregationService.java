package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.MeterReadingsResponse;
import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.exception.MalformedInputException;
import com.baykanat.energy.meter.domain.model.Granularity;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.domain.model.ReadingPage;
import com.baykanat.energy.meter.infrastructure.persistence.ReadingAnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ham okumaları veya takvim bucket'larını sayfalı döner. Raw modda totalCount satır sayısı,
 * bucket modunda (bucket, tür) grubu sayısıdır; sayfalama da buna göre yapılır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingAggregationService {

    private final ReadingAnalyticsJdbcRepository analyticsRepository;
    private final AppProperties appProperties;

    public ReadingPage<?> fetch(QueryFilter filter, Granularity granularity, int page, int perPage) {
        validatePage(page, perPage);
        long offset = (long) (page - 1) * perPage;
        log.debug("Fetching {} page {} (per_page={}, offset={}) for {}", granularity.getValue(), page, perPage,
                offset, filter);

        if (!granularity.isBucketed()) {
            return new ReadingPage<>(
                    analyticsRepository.findReadings(filter, perPage, offset),
                    analyticsRepository.countReadings(filter));
        }
        return new ReadingPage<>(
                analyticsRepository.findBuckets(filter, granularity, perPage, offset),
                analyticsRepository.countBuckets(filter, granularity));
    }

    /** Ölçüm türü başına count/total/mean/min/max/std ve ilk-son zaman damgası. */
    public List<MeterReadingsResponse.ReadingStats> stats(QueryFilter filter) {
        return analyticsRepository.findStats(filter);
    }

    /** page >= 1 ve min <= per_page <= max; sınır dışı değer kırpılmaz, reddedilir. */
    void validatePage(int page, int perPage) {
        if (page < 1) {
            throw new MalformedInputException("page", "page must be >= 1, got " + page);
        }
        AppProperties.AnalyticsProperties limits = appProperties.getAnalytics();
        if (perPage < limits.getMinPerPage() || perPage > limits.getMaxPerPage()) {
            throw new MalformedInputException("per_page", "per_page must be between " + limits.getMinPerPage()
                    + " and " + limits.getMaxPerPage() + ", got " + perPage);
        }
    }
}
