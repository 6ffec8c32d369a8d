package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.exception.SchemaViolationException;
import com.baykanat.energy.meter.domain.exception.SourceUnavailableException;
import com.baykanat.energy.meter.domain.exception.StoreUnavailableException;
import com.baykanat.energy.meter.domain.mapper.MeterReadingMapper;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.MeterReading;
import com.baykanat.energy.meter.domain.model.SyncReport;
import com.baykanat.energy.meter.infrastructure.persistence.MeterReadingJdbcRepository;
import com.baykanat.energy.meter.infrastructure.source.MeterSourceClient;
import com.baykanat.energy.meter.infrastructure.source.SourceRecord;
import com.baykanat.energy.meter.infrastructure.source.SourceTags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MeterSyncService.
 *
 * <p>Source client and repository are mocked; the real MapStruct mapper is used. Covers:
 * <ul>
 *   <li>Watermark filtering (only strictly newer readings are persisted)</li>
 *   <li>First sync and idempotent re-run</li>
 *   <li>Per-kind fetch failure isolation</li>
 *   <li>Fatal schema and store failures</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class MeterSyncServiceTest {

    private static final Instant T0 = Instant.parse("2023-02-27T00:00:00Z");

    @Mock
    private MeterSourceClient sourceClient;

    @Mock
    private MeterReadingJdbcRepository readingRepository;

    private MeterSyncService service;

    @BeforeEach
    void setUp() {
        MeterReadingMapper mapper = Mappers.getMapper(MeterReadingMapper.class);
        service = new MeterSyncService(sourceClient, mapper, readingRepository, new AppProperties());
    }

    @Test
    @DisplayName("First sync persists every reading")
    void firstSyncPersistsEverything() {
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(records("M1", 0, 4));
        when(sourceClient.fetch(MeasurementKind.REACTIVE)).thenReturn(List.of());
        when(readingRepository.findMaxTimestamp("M1", MeasurementKind.ACTIVE)).thenReturn(Optional.empty());
        when(readingRepository.upsert(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        SyncReport report = service.syncAll();

        assertThat(report.persistedFor(MeasurementKind.ACTIVE)).isEqualTo(4);
        assertThat(report.persistedFor(MeasurementKind.REACTIVE)).isZero();
        assertThat(report.getSkippedKinds()).isEmpty();
    }

    @Test
    @DisplayName("Only readings strictly after the watermark are persisted")
    @SuppressWarnings("unchecked")
    void watermarkFiltersAlreadySeenReadings() {
        // 8 readings at 15 min steps; watermark on the 4th (index 3)
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(records("M1", 0, 8));
        when(sourceClient.fetch(MeasurementKind.REACTIVE)).thenReturn(List.of());
        when(readingRepository.findMaxTimestamp("M1", MeasurementKind.ACTIVE))
                .thenReturn(Optional.of(T0.plusSeconds(3 * 900)));
        when(readingRepository.upsert(anyList())).thenAnswer(inv -> ((List<?>) inv.getArgument(0)).size());

        SyncReport report = service.syncAll();

        ArgumentCaptor<List<MeterReading>> captor = ArgumentCaptor.forClass(List.class);
        verify(readingRepository).upsert(captor.capture());
        assertThat(captor.getValue()).hasSize(4);
        assertThat(captor.getValue()).allSatisfy(reading ->
                assertThat(reading.getTimestamp()).isAfter(T0.plusSeconds(3 * 900)));
        assertThat(report.persistedFor(MeasurementKind.ACTIVE)).isEqualTo(4);
    }

    @Test
    @DisplayName("Second run with unchanged source persists nothing")
    void secondRunIsNoOp() {
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(records("M1", 0, 4));
        when(sourceClient.fetch(MeasurementKind.REACTIVE)).thenReturn(List.of());
        when(readingRepository.findMaxTimestamp("M1", MeasurementKind.ACTIVE))
                .thenReturn(Optional.of(T0.plusSeconds(3 * 900)));

        SyncReport report = service.syncAll();

        assertThat(report.totalPersisted()).isZero();
        verify(readingRepository, never()).upsert(anyList());
    }

    @Test
    @DisplayName("Fetch failure for one kind skips it while the other kind still syncs")
    void fetchFailureSkipsOnlyThatKind() {
        when(sourceClient.fetch(MeasurementKind.ACTIVE))
                .thenThrow(new SourceUnavailableException(MeasurementKind.ACTIVE, "timeout", null));
        when(sourceClient.fetch(MeasurementKind.REACTIVE)).thenReturn(records("M1", 0, 2));
        when(readingRepository.findMaxTimestamp("M1", MeasurementKind.REACTIVE)).thenReturn(Optional.empty());
        when(readingRepository.upsert(anyList())).thenReturn(2);

        SyncReport report = service.syncAll();

        assertThat(report.getSkippedKinds()).containsExactly(MeasurementKind.ACTIVE);
        assertThat(report.persistedFor(MeasurementKind.REACTIVE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Malformed record aborts the cycle")
    void schemaViolationIsFatal() {
        SourceRecord broken = SourceRecord.builder()
                .timestamp(T0.toString())
                .tags(SourceTags.builder().muid("M1").build())
                .build();
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(List.of(broken));

        assertThatThrownBy(() -> service.syncAll())
                .isInstanceOf(SchemaViolationException.class);
        verify(readingRepository, never()).upsert(anyList());
    }

    @Test
    @DisplayName("Null record in a feed with an expected OBIS code is a schema violation")
    void nullRecordWithObisCheckIsSchemaViolation() {
        AppProperties properties = new AppProperties();
        properties.getSource().getFeeds().getActive().setObisCode("0100011D00FF");
        MeterSyncService obisAwareService = new MeterSyncService(sourceClient,
                Mappers.getMapper(MeterReadingMapper.class), readingRepository, properties);

        assertThatThrownBy(() -> obisAwareService.syncKind(MeasurementKind.ACTIVE,
                Collections.singletonList((SourceRecord) null)))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("Null record");
        verify(readingRepository, never()).upsert(anyList());
    }

    @Test
    @DisplayName("Store failure during upsert aborts the cycle as StoreUnavailable")
    void storeFailureIsFatal() {
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(records("M1", 0, 2));
        when(readingRepository.findMaxTimestamp("M1", MeasurementKind.ACTIVE)).thenReturn(Optional.empty());
        when(readingRepository.upsert(anyList())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> service.syncAll())
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("active");
    }

    @Test
    @DisplayName("Multiple meter ids in one feed are tolerated; watermark uses the first one")
    void multipleMeterIdsDoNotAbort() {
        List<SourceRecord> mixed = new ArrayList<>(records("M1", 0, 2));
        mixed.addAll(records("M2", 2, 2));
        when(sourceClient.fetch(MeasurementKind.ACTIVE)).thenReturn(mixed);
        when(sourceClient.fetch(MeasurementKind.REACTIVE)).thenReturn(List.of());
        when(readingRepository.findMaxTimestamp(eq("M1"), any())).thenReturn(Optional.empty());
        when(readingRepository.upsert(anyList())).thenReturn(4);

        SyncReport report = service.syncAll();

        assertThat(report.persistedFor(MeasurementKind.ACTIVE)).isEqualTo(4);
        verify(readingRepository, never()).findMaxTimestamp(eq("M2"), any());
    }

    /** count readings at 15 minute steps starting at T0 + offset steps. */
    private static List<SourceRecord> records(String muid, int offset, int count) {
        return IntStream.range(offset, offset + count)
                .mapToObj(i -> {
                    Map<String, Object> columns = new LinkedHashMap<>();
                    columns.put("0100011D00FF", 0.01 * (i + 1));
                    return SourceRecord.builder()
                            .measurement("energy")
                            .timestamp(T0.plusSeconds(i * 900L).toString())
                            .tags(SourceTags.builder().muid(muid).quality("measured").build())
                            .readingColumns(columns)
                            .build();
                })
                .toList();
    }
}
