package com.baykanat.energy.meter.api.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for MeterReadingsResponse.Pagination metadata.
 */
class PaginationTest {

    @Test
    @DisplayName("8640 rows at 10000 per page fit on one page")
    void singlePage() {
        MeterReadingsResponse.Pagination pagination = MeterReadingsResponse.Pagination.of(1, 10000, 8640);

        assertThat(pagination.getTotalPages()).isEqualTo(1);
        assertThat(pagination.isHasNext()).isFalse();
        assertThat(pagination.isHasPrev()).isFalse();
    }

    @Test
    @DisplayName("Middle page of 25000 rows has both next and previous")
    void middlePage() {
        MeterReadingsResponse.Pagination pagination = MeterReadingsResponse.Pagination.of(2, 10000, 25000);

        assertThat(pagination.getTotalPages()).isEqualTo(3);
        assertThat(pagination.isHasNext()).isTrue();
        assertThat(pagination.isHasPrev()).isTrue();
    }

    @Test
    @DisplayName("No rows means zero pages")
    void emptyResult() {
        MeterReadingsResponse.Pagination pagination = MeterReadingsResponse.Pagination.of(1, 100, 0);

        assertThat(pagination.getTotalPages()).isZero();
        assertThat(pagination.isHasNext()).isFalse();
    }
}
