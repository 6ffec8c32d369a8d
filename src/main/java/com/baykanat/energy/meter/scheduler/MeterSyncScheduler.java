package com.baykanat.energy.meter.scheduler;

import com.baykanat.energy.meter.domain.model.SyncReport;
import com.baykanat.energy.meter.domain.service.MeterSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** Sync döngüsünü periyodik çalıştırır (varsayılan 15 dk). Önceki döngü sürüyorsa tetikleme atlanır. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MeterSyncScheduler {

    private final MeterSyncService syncService;
    private final AtomicBoolean busy = new AtomicBoolean(false);

    /** Tek seferde bir döngü; meşgulse boş döner. Döngü hataları çağırana iletilir. */
    public Optional<SyncReport> runSync() {
        if (!busy.compareAndSet(false, true)) {
            log.warn("Previous sync cycle still running, deferring this one");
            return Optional.empty();
        }
        try {
            return Optional.of(syncService.syncAll());
        } finally {
            busy.set(false);
        }
    }

    /** Önceki döngünün bitişinden interval-ms sonra tetiklenir; hata olursa sadece log, sonraki döngü tekrar dener. */
    @Scheduled(
            fixedDelayString = "${app.sync.interval-ms:900000}",
            initialDelayString = "${app.sync.interval-ms:900000}"
    )
    public void scheduledSync() {
        try {
            runSync();
        } catch (Exception e) {
            log.error("Sync cycle failed: {}", e.getMessage(), e);
        }
    }

    public boolean isBusy() {
        return busy.get();
    }
}
