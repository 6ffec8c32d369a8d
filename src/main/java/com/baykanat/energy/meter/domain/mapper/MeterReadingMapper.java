package com.baykanat.energy.meter.domain.mapper;

import com.baykanat.energy.meter.domain.exception.SchemaViolationException;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import com.baykanat.energy.meter.domain.model.MeterReading;
import com.baykanat.energy.meter.infrastructure.source.SourceRecord;
import com.baykanat.energy.meter.infrastructure.source.SourceTags;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/** SourceRecord → MeterReading. MapStruct + değer kolonunu bulan / zaman damgasını çözen yardımcılar. */
@Mapper(componentModel = "spring")
public interface MeterReadingMapper {

    String UNKNOWN_QUALITY = "unknown";

    /** Şekil kontrolü yapıp eşler; eksik tags/muid/timestamp → SchemaViolationException. */
    default MeterReading normalize(SourceRecord record, MeasurementKind kind) {
        if (record == null) {
            throw new SchemaViolationException("Null record in " + kind.getValue() + " feed");
        }
        if (record.getTags() == null || record.getTags().getMuid() == null || record.getTags().getMuid().isBlank()) {
            throw new SchemaViolationException("Record without tags.muid in " + kind.getValue()
                    + " feed at timestamp " + record.getTimestamp());
        }
        if (record.getTimestamp() == null || record.getTimestamp().isBlank()) {
            throw new SchemaViolationException("Record without timestamp in " + kind.getValue() + " feed");
        }
        return toReading(record, kind);
    }

    @Mapping(target = "timestamp", source = "record.timestamp", qualifiedByName = "parseTimestamp")
    @Mapping(target = "meterId", source = "record.tags", qualifiedByName = "meterId")
    @Mapping(target = "quality", source = "record.tags", qualifiedByName = "quality")
    @Mapping(target = "value", source = "record", qualifiedByName = "readingValue")
    @Mapping(target = "measurementKind", source = "kind")
    MeterReading toReading(SourceRecord record, MeasurementKind kind);

    /** Ofsetli ISO-8601 (ör. 2023-02-28T23:45:00.000Z) → Instant. */
    @Named("parseTimestamp")
    default Instant parseTimestamp(String timestamp) {
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            throw new SchemaViolationException("Unparseable timestamp '" + timestamp + "'", e);
        }
    }

    @Named("meterId")
    default String meterId(SourceTags tags) {
        return tags.getMuid();
    }

    /** quality etiketi yoksa "unknown". */
    @Named("quality")
    default String quality(SourceTags tags) {
        return tags.getQuality() != null ? tags.getQuality() : UNKNOWN_QUALITY;
    }

    /** Metadata dışındaki tek kolonu okuma değeri olarak alır; sıfır veya birden fazla kolon şema ihlalidir. */
    @Named("readingValue")
    default double readingValue(SourceRecord record) {
        String column = readingColumn(record);
        Object raw = record.getReadingColumns().get(column);
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new SchemaViolationException("Non-numeric reading '" + text + "' in column " + column, e);
            }
        } else {
            throw new SchemaViolationException("Non-numeric reading " + raw + " in column " + column
                    + " at " + record.getTimestamp());
        }

        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new SchemaViolationException("Reading " + value + " in column " + column + " at "
                    + record.getTimestamp() + " is not a non-negative kWh value");
        }
        return value;
    }

    /** Kayıttaki tek okuma kolonunun adı (OBIS kodu). */
    @Named("readingColumn")
    default String readingColumn(SourceRecord record) {
        Map<String, Object> columns = record.getReadingColumns();
        if (columns == null || columns.isEmpty()) {
            throw new SchemaViolationException("No reading column found in record at " + record.getTimestamp());
        }
        if (columns.size() > 1) {
            throw new SchemaViolationException("Expected exactly one reading column at " + record.getTimestamp()
                    + ", found " + columns.keySet());
        }
        return columns.keySet().iterator().next();
    }
}
