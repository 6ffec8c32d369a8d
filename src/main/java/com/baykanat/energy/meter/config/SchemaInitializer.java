package com.baykanat.energy.meter.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Açılışta meter_readings tablosunu idempotent oluşturur; timescaledb varsa hypertable'a çevirir. */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SchemaInitializer implements ApplicationRunner {

    private final JdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS meter_readings (
                timestamp        TIMESTAMPTZ      NOT NULL,
                muid             TEXT             NOT NULL,
                measurement_type TEXT             NOT NULL,
                reading          DOUBLE PRECISION NOT NULL,
                quality          TEXT,
                CONSTRAINT uq_meter_readings UNIQUE (muid, timestamp, measurement_type)
            )
            """;

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_meter_readings_type_ts
                ON meter_readings (measurement_type, timestamp)
            """;

    @Override
    public void run(ApplicationArguments args) {
        jdbcTemplate.execute(CREATE_TABLE_SQL);
        jdbcTemplate.execute(CREATE_INDEX_SQL);
        log.info("Schema ready: meter_readings");

        if (appProperties.getSchema().isHypertableEnabled() && timescaleInstalled()) {
            jdbcTemplate.queryForList(
                    "SELECT create_hypertable('meter_readings', 'timestamp', if_not_exists => TRUE, migrate_data => TRUE)");
            log.info("meter_readings is a TimescaleDB hypertable");
        } else {
            log.debug("Hypertable conversion skipped (enabled={})", appProperties.getSchema().isHypertableEnabled());
        }
    }

    private boolean timescaleInstalled() {
        Boolean installed = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'timescaledb')", Boolean.class);
        return Boolean.TRUE.equals(installed);
    }
}
