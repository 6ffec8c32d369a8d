package com.baykanat.energy.meter.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/** Bir senkronizasyon döngüsünün özeti: tür başına yazılan satır ve çekilemeyen türler. */
@Value
@Builder
public class SyncReport {

    Instant startedAt;
    long durationMs;

    @Singular("persisted")
    Map<MeasurementKind, Integer> persistedByKind;

    @Singular
    Set<MeasurementKind> skippedKinds;

    public int totalPersisted() {
        return persistedByKind.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int persistedFor(MeasurementKind kind) {
        return persistedByKind.getOrDefault(kind, 0);
    }
}
