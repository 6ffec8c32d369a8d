package com.baykanat.energy.meter.domain.service;

import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.exception.SourceUnavailableException;
import com.baykanat.energy.meter.domain.exception.StoreUnavailableException;
import com.baykanat.energy.meter.domain.mapper.MeterReadingMapper;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.MeterReading;
import com.baykanat.energy.meter.domain.model.SyncReport;
import com.baykanat.energy.meter.infrastructure.persistence.MeterReadingJdbcRepository;
import com.baykanat.energy.meter.infrastructure.source.MeterSourceClient;
import com.baykanat.energy.meter.infrastructure.source.SourceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bir sync döngüsü: her ölçüm türü için tüm feed'i çek, normalize et, watermark'tan eski kayıtları at,
 * kalanları upsert et. Çekim hatası sadece o türü atlatır; normalize ve yazma hataları döngüyü durdurur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeterSyncService {

    private final MeterSourceClient sourceClient;
    private final MeterReadingMapper readingMapper;
    private final MeterReadingJdbcRepository readingRepository;
    private final AppProperties appProperties;

    public SyncReport syncAll() {
        Instant startedAt = Instant.now();
        log.info("Sync cycle started");

        SyncReport.SyncReportBuilder report = SyncReport.builder().startedAt(startedAt);
        for (MeasurementKind kind : MeasurementKind.values()) {
            List<SourceRecord> records;
            try {
                records = sourceClient.fetch(kind);
            } catch (SourceUnavailableException e) {
                log.error("Skipping {} readings this cycle: {}", kind.getValue(), e.getMessage());
                report.skippedKind(kind);
                continue;
            }
            report.persisted(kind, syncKind(kind, records));
        }

        SyncReport result = report
                .durationMs(Duration.between(startedAt, Instant.now()).toMillis())
                .build();
        log.info("Sync cycle finished in {} ms: persisted={}, skipped={}",
                result.getDurationMs(), result.getPersistedByKind(), result.getSkippedKinds());
        return result;
    }

    /** Tek türün kayıtlarını işler, yazılan satır sayısını döner. */
    int syncKind(MeasurementKind kind, List<SourceRecord> records) {
        if (records.isEmpty()) {
            log.info("{} feed is empty, nothing to persist", kind.getValue());
            return 0;
        }

        List<MeterReading> readings = records.stream()
                .map(sourceRecord -> readingMapper.normalize(sourceRecord, kind))
                .toList();
        checkReadingColumn(kind, records.get(0));

        String meterId = readings.get(0).getMeterId();
        Set<String> meterIds = readings.stream()
                .map(MeterReading::getMeterId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (meterIds.size() > 1) {
            log.warn("{} feed contains {} meter ids {}; watermark taken from {}",
                    kind.getValue(), meterIds.size(), meterIds, meterId);
        }

        Optional<Instant> watermark = findWatermark(meterId, kind);
        List<MeterReading> fresh = watermark
                .map(latest -> readings.stream()
                        .filter(reading -> reading.getTimestamp().isAfter(latest))
                        .toList())
                .orElse(readings);

        if (fresh.isEmpty()) {
            log.info("{}: no readings newer than {} for meter {}", kind.getValue(), watermark.orElse(null), meterId);
            return 0;
        }

        int affected;
        try {
            affected = readingRepository.upsert(fresh);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to persist " + kind.getValue() + " readings: "
                    + e.getMostSpecificCause().getMessage(), e);
        }

        log.info("{}: persisted {} of {} readings for meter {} (watermark {})",
                kind.getValue(), affected, readings.size(), meterId, watermark.map(Instant::toString).orElse("none"));
        return affected;
    }

    private Optional<Instant> findWatermark(String meterId, MeasurementKind kind) {
        try {
            return readingRepository.findMaxTimestamp(meterId, kind);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read watermark for " + meterId + "/" + kind.getValue()
                    + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /** Beklenen OBIS kodundan farklı kolon sadece uyarıdır. */
    private void checkReadingColumn(MeasurementKind kind, SourceRecord first) {
        String expected = appProperties.getSource().feedFor(kind).getObisCode();
        if (expected == null || expected.isBlank()) {
            return;
        }
        String column = readingMapper.readingColumn(first);
        if (!expected.equals(column)) {
            log.warn("{} feed reading column is {}, expected OBIS code {}", kind.getValue(), column, expected);
        }
    }
}
