package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.domain.exception.MalformedInputException;
import com.baykanat.energy.meter.domain.model.DayPeriod;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for QueryFilterBuilder.
 */
class QueryFilterBuilderTest {

    private final QueryFilterBuilder builder = new QueryFilterBuilder();

    @Test
    @DisplayName("Absent or blank inputs mean no constraint")
    void blankInputsAreUnconstrained() {
        QueryFilter filter = builder.build(null, "  ", null, null, null);

        assertThat(filter.getStartDate()).isNull();
        assertThat(filter.getEndDate()).isNull();
        assertThat(filter.getMeasurementKinds()).containsExactlyInAnyOrder(MeasurementKind.values());
        assertThat(filter.getDayPeriod()).isEqualTo(DayPeriod.ALL);
    }

    @Test
    @DisplayName("ISO dates and a single meter kind are parsed")
    void parsesDatesAndKind() {
        QueryFilter filter = builder.build("2023-02-01", "2023-02-28", "reactive", false, true);

        assertThat(filter.getStartDate()).isEqualTo(LocalDate.of(2023, 2, 1));
        assertThat(filter.getEndDate()).isEqualTo(LocalDate.of(2023, 2, 28));
        assertThat(filter.getMeasurementKinds()).containsExactly(MeasurementKind.REACTIVE);
        assertThat(filter.getDayPeriod()).isEqualTo(DayPeriod.WEEKEND);
    }

    @Test
    @DisplayName("meter=both selects both kinds")
    void bothSelectsAllKinds() {
        QueryFilter filter = builder.build(null, null, "BOTH", null, null);

        assertThat(filter.getMeasurementKinds()).containsExactlyInAnyOrder(MeasurementKind.ACTIVE, MeasurementKind.REACTIVE);
    }

    @Test
    @DisplayName("Weekday-only wins when both restrictions are set")
    void weekdayOnlyTakesPrecedence() {
        QueryFilter filter = builder.build(null, null, null, true, true);

        assertThat(filter.getDayPeriod()).isEqualTo(DayPeriod.WEEKDAY);
    }

    @Test
    @DisplayName("Unparseable start date is malformed input")
    void unparseableStartIsRejected() {
        assertThatThrownBy(() -> builder.build("2023-13-45", null, null, null, null))
                .isInstanceOf(MalformedInputException.class)
                .satisfies(ex -> assertThat(((MalformedInputException) ex).getParameter()).isEqualTo("start"));
    }

    @Test
    @DisplayName("End before start is malformed input")
    void endBeforeStartIsRejected() {
        assertThatThrownBy(() -> builder.build("2023-03-01", "2023-02-01", null, null, null))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("before start");
    }

    @Test
    @DisplayName("Unknown meter selector is malformed input")
    void unknownMeterIsRejected() {
        assertThatThrownBy(() -> builder.build(null, null, "apparent", null, null))
                .isInstanceOf(MalformedInputException.class)
                .satisfies(ex -> assertThat(((MalformedInputException) ex).getParameter()).isEqualTo("meter"));
    }

    @Test
    @DisplayName("Same inputs build equal filters")
    void buildIsDeterministic() {
        QueryFilter first = builder.build("2023-02-01", "2023-02-02", "active", true, false);
        QueryFilter second = builder.build("2023-02-01", "2023-02-02", "active", true, false);

        assertThat(first).isEqualTo(second);
    }
}
