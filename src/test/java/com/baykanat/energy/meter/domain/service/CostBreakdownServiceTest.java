package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.api.dto.CostBreakdownResponse;
import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.config.TariffConfig;
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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CostBreakdownService.
 *
 * <p>The main property: peak kWh + off-peak kWh equals total kWh for any set of cells,
 * and the all-peak / all-off-peak scenarios bound the actual cost.
 */
@ExtendWith(MockitoExtension.class)
class CostBreakdownServiceTest {

    private static final double TOLERANCE = 1e-9;

    @Mock
    private ReadingAnalyticsJdbcRepository analyticsRepository;

    private CostBreakdownService service;

    @BeforeEach
    void setUp() {
        TariffClassifier classifier = new TariffClassifier(TariffConfig.toPlan(new AppProperties().getTariff()));
        service = new CostBreakdownService(analyticsRepository, classifier);
    }

    @Test
    @DisplayName("Weekday 10:00 is billed at peak, Sunday 10:00 and Monday 22:00 at off-peak")
    void classifiesCellsByTariff() {
        List<HourDayCell> cells = List.of(
                cell(MeasurementKind.ACTIVE, 10, 1, 2.0),
                cell(MeasurementKind.ACTIVE, 10, 0, 1.0),
                cell(MeasurementKind.ACTIVE, 22, 1, 1.0));

        CostBreakdownResponse report = service.breakdown(cells);

        assertThat(report.getTotalKwh()).isCloseTo(4.0, within(TOLERANCE));
        assertThat(report.getHighTariff().getKwh()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(report.getLowTariff().getKwh()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(report.getTotalCost()).isCloseTo(2.0 * 0.32 + 2.0 * 0.22, within(TOLERANCE));
        assertThat(report.getHighTariff().getPercentOfTotal()).isCloseTo(50.0, within(TOLERANCE));
        assertThat(report.getEffectiveRate()).isCloseTo(0.27, within(TOLERANCE));
        assertThat(report.getComparison().getPotentialSavings()).isCloseTo(2.0 * 0.10, within(TOLERANCE));
    }

    @Test
    @DisplayName("Peak + off-peak kWh reconciles with total and scenarios bound the real cost")
    void reconcilesForRandomWindow() {
        Random random = new Random(42);
        List<HourDayCell> cells = new ArrayList<>();
        for (int hour = 0; hour < 24; hour++) {
            for (int day = 0; day < 7; day++) {
                cells.add(cell(MeasurementKind.ACTIVE, hour, day, random.nextDouble() * 5));
            }
        }

        CostBreakdownResponse report = service.breakdown(cells);

        double cellTotal = cells.stream().mapToDouble(HourDayCell::getSum).sum();
        assertThat(report.getHighTariff().getKwh() + report.getLowTariff().getKwh())
                .isCloseTo(report.getTotalKwh(), within(TOLERANCE));
        assertThat(report.getTotalKwh()).isCloseTo(cellTotal, within(TOLERANCE));
        assertThat(report.getComparison().getAllPeakCost()).isGreaterThanOrEqualTo(report.getTotalCost());
        assertThat(report.getTotalCost()).isGreaterThanOrEqualTo(report.getComparison().getAllOffPeakCost());
        assertThat(report.getHighTariff().getPercentOfTotal() + report.getLowTariff().getPercentOfTotal())
                .isCloseTo(100.0, within(1e-6));
    }

    @Test
    @DisplayName("Zero consumption yields zero rates and percentages instead of a division fault")
    void zeroTotalIsGuarded() {
        CostBreakdownResponse report = service.breakdown(List.of());

        assertThat(report.getTotalKwh()).isZero();
        assertThat(report.getTotalCost()).isZero();
        assertThat(report.getEffectiveRate()).isZero();
        assertThat(report.getHighTariff().getPercentOfTotal()).isZero();
        assertThat(report.getLowTariff().getPercentOfTotal()).isZero();
        assertThat(report.getCurrency()).isEqualTo("CHF");
    }

    @Test
    @DisplayName("Reactive cells are never priced")
    void reactiveCellsAreIgnored() {
        CostBreakdownResponse report = service.breakdown(List.of(
                cell(MeasurementKind.REACTIVE, 10, 1, 100.0),
                cell(MeasurementKind.ACTIVE, 10, 1, 1.0)));

        assertThat(report.getTotalKwh()).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    @DisplayName("Query restricts to active energy regardless of the meter selection")
    void queriesActiveOnly() {
        when(analyticsRepository.findHourDayCells(any())).thenReturn(List.of());
        QueryFilter reactiveOnly = QueryFilter.builder()
                .measurementKinds(EnumSet.of(MeasurementKind.REACTIVE))
                .build();

        service.costBreakdown(reactiveOnly);

        ArgumentCaptor<QueryFilter> captor = ArgumentCaptor.forClass(QueryFilter.class);
        verify(analyticsRepository).findHourDayCells(captor.capture());
        assertThat(captor.getValue().getMeasurementKinds()).containsExactly(MeasurementKind.ACTIVE);
    }

    private static HourDayCell cell(MeasurementKind kind, int hour, int dayOfWeek, double sum) {
        return HourDayCell.builder()
                .measurementKind(kind)
                .hour(hour)
                .dayOfWeek(dayOfWeek)
                .sum(sum)
                .average(sum)
                .count(1)
                .build();
    }
}
