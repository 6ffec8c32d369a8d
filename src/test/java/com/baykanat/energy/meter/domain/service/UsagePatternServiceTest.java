package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.HeatmapResponse;
import com.baykanat.energy.meter.domain.model.HourDayCell;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.infrastructure.persistence.ReadingAnalyticsJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for UsagePatternService heatmap construction.
 */
@ExtendWith(MockitoExtension.class)
class UsagePatternServiceTest {

    @Mock
    private ReadingAnalyticsJdbcRepository analyticsRepository;

    private UsagePatternService service;

    @BeforeEach
    void setUp() {
        service = new UsagePatternService(analyticsRepository);
    }

    @Test
    @DisplayName("Heatmap is a full 24x7 matrix per kind with unobserved cells at 0.0")
    void heatmapIsAlwaysComplete() {
        HeatmapResponse heatmap = service.toHeatmap(List.of(
                HourDayCell.builder().measurementKind(MeasurementKind.ACTIVE)
                        .hour(18).dayOfWeek(1).sum(2.0).average(0.5).count(4).build()));

        assertThat(heatmap.getHours()).hasSize(24);
        assertThat(heatmap.getDays()).containsExactly(
                "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday");
        assertThat(heatmap.getValues()).containsOnlyKeys("active", "reactive");

        List<List<Double>> active = heatmap.getValues().get("active");
        assertThat(active).hasSize(24).allSatisfy(row -> assertThat(row).hasSize(7));
        assertThat(active.get(18).get(1)).isEqualTo(0.5);
        assertThat(active.get(0).get(0)).isEqualTo(0.0);

        List<List<Double>> reactive = heatmap.getValues().get("reactive");
        assertThat(reactive).hasSize(24);
        assertThat(reactive.stream().flatMap(List::stream)).hasSize(24 * 7).containsOnly(0.0);
    }

    @Test
    @DisplayName("Heatmap ignores the meter restriction of the filter")
    void heatmapQueriesAllKinds() {
        when(analyticsRepository.findHourDayCells(any())).thenReturn(List.of());
        QueryFilter activeOnly = QueryFilter.builder()
                .measurementKinds(EnumSet.of(MeasurementKind.ACTIVE))
                .build();

        HeatmapResponse heatmap = service.heatmap(activeOnly);

        ArgumentCaptor<QueryFilter> captor = ArgumentCaptor.forClass(QueryFilter.class);
        verify(analyticsRepository).findHourDayCells(captor.capture());
        assertThat(captor.getValue().getMeasurementKinds())
                .containsExactlyInAnyOrder(MeasurementKind.ACTIVE, MeasurementKind.REACTIVE);
        assertThat(heatmap.getValues()).containsOnlyKeys("active", "reactive");
    }
}
