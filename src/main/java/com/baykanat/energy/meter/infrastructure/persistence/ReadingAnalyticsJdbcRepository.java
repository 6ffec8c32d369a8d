package com.baykanat.energy.meter.infrastructure.persistence;

import com.baykanat.energy.meter.api.dto.DailyPatternEntry;
import com.baykanat.energy.meter.api.dto.HourlyPatternEntry;
import com.baykanat.energy.meter.api.dto.MeterReadingsResponse;
import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.model.DayPeriod;
import com.baykanat.energy.meter.domain.model.Granularity;
import com.baykanat.energy.meter.domain.model.HourDayCell;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.QueryFilter;
import com.baykanat.energy.meter.domain.model.WeekDays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * meter_readings üzerinden salt okunur analitik sorgular: ham satırlar, zaman dilimi bucket'ları,
 * saat / gün desenleri ve (saat, gün) hücreleri. Saat ve gün app.analytics.time-zone'a göre hesaplanır.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ReadingAnalyticsJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;

    /** Filtreye uyan ham okumalar; timestamp, measurement_type sıralı, LIMIT/OFFSET ile. */
    public List<MeterReadingsResponse.ReadingRow> findReadings(QueryFilter filter, int limit, long offset) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
                SELECT timestamp, muid, measurement_type, reading, quality,
                       EXTRACT(HOUR FROM timestamp AT TIME ZONE ?)::int AS hour,
                       EXTRACT(DOW FROM timestamp AT TIME ZONE ?)::int AS day_of_week
                FROM meter_readings
                """);
        params.add(zone.getId());
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(" ORDER BY timestamp, measurement_type LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        log.debug("Raw readings query params: {}", params);

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> MeterReadingsResponse.ReadingRow.builder()
                .timestamp(instant(rs, "timestamp"))
                .meterId(rs.getString("muid"))
                .measurementType(rs.getString("measurement_type"))
                .reading(rs.getDouble("reading"))
                .quality(rs.getString("quality"))
                .hour(rs.getInt("hour"))
                .dayOfWeek(rs.getInt("day_of_week"))
                .build(), params.toArray());
    }

    /** Filtreye uyan ham satır sayısı. */
    public long countReadings(QueryFilter filter) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM meter_readings");
        appendFilter(sql, params, filter, zone());

        Long count = jdbcTemplate.queryForObject(Objects.requireNonNull(sql.toString()), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    /**
     * Takvim sınırlarına hizalı bucket'lar; (bucket, measurement_type) grupları üzerinde sayfalanır.
     * Üç argümanlı DATE_TRUNC timestamptz döner, saat geri alındığında iki gerçek saat ayrı bucket kalır.
     */
    public List<MeterReadingsResponse.AggregatedBucket> findBuckets(QueryFilter filter, Granularity granularity,
                                                                    int limit, long offset) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(String.format("""
                SELECT bucket, measurement_type,
                       SUM(reading) AS total_reading,
                       COUNT(*) AS reading_count,
                       AVG(reading) AS avg_reading,
                       MIN(reading) AS min_reading,
                       MAX(reading) AS max_reading
                FROM (SELECT DATE_TRUNC('%s', timestamp, ?) AS bucket, measurement_type, reading
                      FROM meter_readings
                """, granularity.getTruncUnit()));
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(") b GROUP BY bucket, measurement_type ORDER BY bucket, measurement_type LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        log.debug("Bucket query ({}) params: {}", granularity.getValue(), params);

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> MeterReadingsResponse.AggregatedBucket.builder()
                .bucketStart(instant(rs, "bucket"))
                .measurementType(rs.getString("measurement_type"))
                .sum(rs.getDouble("total_reading"))
                .count(rs.getLong("reading_count"))
                .mean(rs.getDouble("avg_reading"))
                .min(rs.getDouble("min_reading"))
                .max(rs.getDouble("max_reading"))
                .build(), params.toArray());
    }

    /** Farklı (bucket, measurement_type) grubu sayısı; ham satır sayısı değil. */
    public long countBuckets(QueryFilter filter, Granularity granularity) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(String.format("""
                SELECT COUNT(*) FROM (
                    SELECT DISTINCT DATE_TRUNC('%s', timestamp, ?), measurement_type
                    FROM meter_readings
                """, granularity.getTruncUnit()));
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(") g");

        Long count = jdbcTemplate.queryForObject(Objects.requireNonNull(sql.toString()), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    /** Ölçüm türü başına özet istatistikler. */
    public List<MeterReadingsResponse.ReadingStats> findStats(QueryFilter filter) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
                SELECT measurement_type,
                       COUNT(*) AS reading_count,
                       SUM(reading) AS total_reading,
                       AVG(reading) AS avg_reading,
                       MIN(reading) AS min_reading,
                       MAX(reading) AS max_reading,
                       COALESCE(STDDEV_SAMP(reading), 0) AS std_reading,
                       MIN(timestamp) AS first_timestamp,
                       MAX(timestamp) AS last_timestamp
                FROM meter_readings
                """);
        appendFilter(sql, params, filter, zone());
        sql.append(" GROUP BY measurement_type ORDER BY measurement_type");

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> MeterReadingsResponse.ReadingStats.builder()
                .measurementType(rs.getString("measurement_type"))
                .count(rs.getLong("reading_count"))
                .total(rs.getDouble("total_reading"))
                .mean(rs.getDouble("avg_reading"))
                .min(rs.getDouble("min_reading"))
                .max(rs.getDouble("max_reading"))
                .stdDev(rs.getDouble("std_reading"))
                .firstTimestamp(instant(rs, "first_timestamp"))
                .lastTimestamp(instant(rs, "last_timestamp"))
                .build(), params.toArray());
    }

    /** Ölçüm türü ve günün saati (0-23) başına ortalama, örneklem std (tek örnekte 0), min, max. */
    public List<HourlyPatternEntry> findHourlyPattern(QueryFilter filter) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
                SELECT measurement_type, hour,
                       AVG(reading) AS avg_reading,
                       COALESCE(STDDEV_SAMP(reading), 0) AS std_reading,
                       MIN(reading) AS min_reading,
                       MAX(reading) AS max_reading,
                       COUNT(*) AS reading_count
                FROM (SELECT measurement_type, reading,
                             EXTRACT(HOUR FROM timestamp AT TIME ZONE ?)::int AS hour
                      FROM meter_readings
                """);
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(") h GROUP BY measurement_type, hour ORDER BY measurement_type, hour");

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> HourlyPatternEntry.builder()
                .measurementType(rs.getString("measurement_type"))
                .hour(rs.getInt("hour"))
                .mean(rs.getDouble("avg_reading"))
                .stdDev(rs.getDouble("std_reading"))
                .min(rs.getDouble("min_reading"))
                .max(rs.getDouble("max_reading"))
                .count(rs.getLong("reading_count"))
                .build(), params.toArray());
    }

    /** Ölçüm türü ve haftanın günü (0=Pazar … 6=Cumartesi) başına toplam, adet, ortalama. */
    public List<DailyPatternEntry> findDailyPattern(QueryFilter filter) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
                SELECT measurement_type, day_of_week,
                       SUM(reading) AS total_reading,
                       COUNT(*) AS reading_count,
                       AVG(reading) AS avg_reading
                FROM (SELECT measurement_type, reading,
                             EXTRACT(DOW FROM timestamp AT TIME ZONE ?)::int AS day_of_week
                      FROM meter_readings
                """);
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(") d GROUP BY measurement_type, day_of_week ORDER BY measurement_type, day_of_week");

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> {
            int dayOfWeek = rs.getInt("day_of_week");
            return DailyPatternEntry.builder()
                    .measurementType(rs.getString("measurement_type"))
                    .dayOfWeek(dayOfWeek)
                    .dayName(WeekDays.name(dayOfWeek))
                    .sum(rs.getDouble("total_reading"))
                    .count(rs.getLong("reading_count"))
                    .mean(rs.getDouble("avg_reading"))
                    .build();
        }, params.toArray());
    }

    /** (ölçüm türü, saat, gün) hücreleri; heatmap ortalamayı, maliyet hesabı toplamı kullanır. */
    public List<HourDayCell> findHourDayCells(QueryFilter filter) {
        ZoneId zone = zone();
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
                SELECT measurement_type, hour, day_of_week,
                       SUM(reading) AS total_reading,
                       AVG(reading) AS avg_reading,
                       COUNT(*) AS reading_count
                FROM (SELECT measurement_type, reading,
                             EXTRACT(HOUR FROM timestamp AT TIME ZONE ?)::int AS hour,
                             EXTRACT(DOW FROM timestamp AT TIME ZONE ?)::int AS day_of_week
                      FROM meter_readings
                """);
        params.add(zone.getId());
        params.add(zone.getId());
        appendFilter(sql, params, filter, zone);
        sql.append(") c GROUP BY measurement_type, hour, day_of_week ORDER BY measurement_type, hour, day_of_week");

        String sqlStr = Objects.requireNonNull(sql.toString());
        return jdbcTemplate.query(sqlStr, (rs, rowNum) -> HourDayCell.builder()
                .measurementKind(MeasurementKind.fromValue(rs.getString("measurement_type")))
                .hour(rs.getInt("hour"))
                .dayOfWeek(rs.getInt("day_of_week"))
                .sum(rs.getDouble("total_reading"))
                .average(rs.getDouble("avg_reading"))
                .count(rs.getLong("reading_count"))
                .build(), params.toArray());
    }

    /** QueryFilter → WHERE; tarih sınırları bölgenin gün başlangıcına çevrilir, bitiş günü dahil. */
    private void appendFilter(StringBuilder sql, List<Object> params, QueryFilter filter, ZoneId zone) {
        sql.append(" WHERE 1 = 1");

        if (filter.getMeasurementKinds() != null && !filter.getMeasurementKinds().isEmpty()) {
            List<String> kinds = filter.getMeasurementKinds().stream()
                    .map(MeasurementKind::getValue)
                    .sorted()
                    .toList();
            sql.append(" AND measurement_type IN (")
                    .append(String.join(",", kinds.stream().map(k -> "?").toList()))
                    .append(")");
            params.addAll(kinds);
        }

        if (filter.getStartDate() != null) {
            sql.append(" AND timestamp >= ?");
            params.add(Timestamp.from(filter.getStartDate().atStartOfDay(zone).toInstant()));
        }

        if (filter.getEndDate() != null) {
            sql.append(" AND timestamp < ?");
            params.add(Timestamp.from(filter.getEndDate().plusDays(1).atStartOfDay(zone).toInstant()));
        }

        if (filter.getDayPeriod() == DayPeriod.WEEKDAY) {
            sql.append(" AND EXTRACT(ISODOW FROM timestamp AT TIME ZONE ?) < 6");
            params.add(zone.getId());
        } else if (filter.getDayPeriod() == DayPeriod.WEEKEND) {
            sql.append(" AND EXTRACT(ISODOW FROM timestamp AT TIME ZONE ?) >= 6");
            params.add(zone.getId());
        }
        sql.append('\n');
    }

    private ZoneId zone() {
        return ZoneId.of(appProperties.getAnalytics().getTimeZone());
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
