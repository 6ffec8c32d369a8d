package com.baykanat.energy.meter.infrastructure.readiness;

import com.baykanat.energy.meter.config.AppProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/** İlk sync döngüsünden sonra bağımlı süreçler için tek seferlik hazır dosyası yazar. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadinessMarker {

    private final AppProperties appProperties;
    private final AtomicBoolean written = new AtomicBoolean(false);

    /** Dosyayı yalnızca ilk çağrıda yazar; sonraki çağrılar no-op. true → bu çağrı yazdı. */
    public boolean markReady() {
        if (!written.compareAndSet(false, true)) {
            return false;
        }

        Path marker = Path.of(appProperties.getSync().getReadyMarker());
        try {
            Path parent = marker.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(marker, Instant.now().toString(), StandardCharsets.UTF_8);
            log.info("Readiness marker written: {}", marker);
            return true;
        } catch (IOException e) {
            written.set(false);
            log.error("Failed to write readiness marker {}: {}", marker, e.getMessage(), e);
            throw new IllegalStateException("Could not write readiness marker " + marker, e);
        }
    }

    public boolean isReady() {
        return written.get();
    }
}
