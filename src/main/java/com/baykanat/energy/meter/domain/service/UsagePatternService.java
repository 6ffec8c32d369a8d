package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.DailyPatternEntry;
import com.baykanat.energy.meter.api.dto.HeatmapResponse;
import com.baykanat.energy.meter.api.dto.HourlyPatternEntry;
import com.baykanat.energy.meter.domain.model.HourDayCell;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.domain.model.WeekDays;
import com.baykanat.energy.meter.infrastructure.persistence.ReadingAnalyticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/** Saatlik / günlük kullanım desenleri ve ölçüm türü başına 24x7 ortalama heatmap'i. */
@Service
@RequiredArgsConstructor
public class UsagePatternService {

    private final ReadingAnalyticsJdbcRepository analyticsRepository;

    public List<HourlyPatternEntry> hourlyPattern(QueryFilter filter) {
        return analyticsRepository.findHourlyPattern(filter);
    }

    public List<DailyPatternEntry> dailyPattern(QueryFilter filter) {
        return analyticsRepository.findDailyPattern(filter);
    }

    /** Filtredeki tür kısıtı yok sayılır; her tür için matris üretilir. */
    public HeatmapResponse heatmap(QueryFilter filter) {
        QueryFilter allKinds = filter.withMeasurementKinds(EnumSet.allOf(MeasurementKind.class));
        return toHeatmap(analyticsRepository.findHourDayCells(allKinds));
    }

    /** Hücreleri tam dolu [saat][gün] matrislerine yerleştirir; gözlenmeyen hücre 0.0. */
    HeatmapResponse toHeatmap(List<HourDayCell> cells) {
        Map<MeasurementKind, double[][]> matrices = new LinkedHashMap<>();
        for (MeasurementKind kind : MeasurementKind.values()) {
            matrices.put(kind, new double[TariffClassifier.HOURS_IN_DAY][WeekDays.DAYS_IN_WEEK]);
        }
        for (HourDayCell cell : cells) {
            matrices.get(cell.getMeasurementKind())[cell.getHour()][cell.getDayOfWeek()] = cell.getAverage();
        }

        Map<String, List<List<Double>>> values = new LinkedHashMap<>();
        matrices.forEach((kind, matrix) -> {
            List<List<Double>> rows = new ArrayList<>(TariffClassifier.HOURS_IN_DAY);
            for (double[] row : matrix) {
                rows.add(Arrays.stream(row).boxed().toList());
            }
            values.put(kind.getValue(), rows);
        });

        return HeatmapResponse.builder()
                .hours(IntStream.range(0, TariffClassifier.HOURS_IN_DAY).boxed().toList())
                .days(WeekDays.labels())
                .values(values)
                .build();
    }
}
