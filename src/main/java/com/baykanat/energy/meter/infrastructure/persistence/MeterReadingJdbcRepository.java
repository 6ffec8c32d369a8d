package com.baykanat.energy.meter.infrastructure.persistence;

import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.MeterReading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** meter_readings tablosuna JDBC batch upsert ve watermark sorgusu. ON CONFLICT DO UPDATE ile idempotency. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MeterReadingJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;

    private static final String UPSERT_SQL = """
            INSERT INTO meter_readings (timestamp, muid, measurement_type, reading, quality)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (muid, timestamp, measurement_type)
            DO UPDATE SET reading = EXCLUDED.reading,
                          quality = EXCLUDED.quality
            """;

    /** Okumaları batch'ler halinde upsert eder; etkilenen satır sayısını döner. Batch'ler arası transaction yok. */
    public int upsert(List<MeterReading> readings) {
        if (readings.isEmpty()) {
            return 0;
        }

        int[][] results = jdbcTemplate.batchUpdate(UPSERT_SQL, readings, appProperties.getSync().getBatchSize(),
                (ps, reading) -> {
                    ps.setTimestamp(1, Timestamp.from(reading.getTimestamp()));
                    ps.setString(2, reading.getMeterId());
                    ps.setString(3, reading.getMeasurementKind().getValue());
                    ps.setDouble(4, reading.getValue());
                    if (reading.getQuality() != null) {
                        ps.setString(5, reading.getQuality());
                    } else {
                        ps.setNull(5, Types.VARCHAR);
                    }
                });

        // Sürücü batch'te satır sayısı vermezse (SUCCESS_NO_INFO) statement başına 1 say
        return Arrays.stream(results)
                .flatMapToInt(Arrays::stream)
                .map(count -> count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0))
                .sum();
    }

    /** (muid, measurement_type) için saklanan en son timestamp; hiç kayıt yoksa boş. */
    public Optional<Instant> findMaxTimestamp(String meterId, MeasurementKind kind) {
        Timestamp latest = jdbcTemplate.queryForObject(
                "SELECT MAX(timestamp) FROM meter_readings WHERE muid = ? AND measurement_type = ?",
                Timestamp.class, meterId, kind.getValue());
        return Optional.ofNullable(latest).map(Timestamp::toInstant);
    }
}
