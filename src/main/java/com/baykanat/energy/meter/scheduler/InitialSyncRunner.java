package com.baykanat.energy.meter.scheduler;

import com.baykanat.energy.meter.infrastructure.readiness.ReadinessMarker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Şema hazır olduktan sonra açılışta bir sync döngüsü çalıştırır, ardından hazır dosyasını yazar. */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InitialSyncRunner implements ApplicationRunner {

    private final MeterSyncScheduler syncScheduler;
    private final ReadinessMarker readinessMarker;

    @Override
    public void run(ApplicationArguments args) {
        try {
            syncScheduler.runSync();
        } catch (Exception e) {
            // Kısmi veya başarısız ilk döngü de hazır sayılır; sonraki döngü tekrar dener
            log.error("Initial sync cycle failed: {}", e.getMessage(), e);
        }
        readinessMarker.markReady();
    }
}
