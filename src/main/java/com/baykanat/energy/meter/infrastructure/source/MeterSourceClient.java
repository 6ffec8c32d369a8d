package com.baykanat.energy.meter.infrastructure.source;

import com.baykanat.energy.meter.config.AppProperties;
import com.baykanat.energy.meter.domain.exception.SchemaViolationException;
import com.baykanat.energy.meter.domain.exception.SourceCircuitOpenException;
import com.baykanat.energy.meter.domain.exception.SourceUnavailableException;
import com.baykanat.energy.meter.domain.model.MeasurementKind;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/** Ölçüm türü başına feed'in tamamını çeker; Retry + Circuit Breaker. Kaynak filtre desteklemez. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeterSourceClient {

    private static final int URL_LOG_LENGTH = 80;

    private final RestClient meterSourceRestClient;
    private final AppProperties appProperties;

    /** Türün feed'indeki tüm kayıtları döner. Ağ/timeout/2xx dışı → SourceUnavailableException. */
    @Retry(name = "meterSource")
    @CircuitBreaker(name = "meterSource", fallbackMethod = "handleCircuitBreakerOpen")
    public List<SourceRecord> fetch(MeasurementKind kind) {
        AppProperties.FeedProperties feed = appProperties.getSource().feedFor(kind);
        if (!feed.isConfigured()) {
            throw new SourceUnavailableException(kind, "No source URL configured for " + kind.getValue(), null);
        }

        String url = feed.getUrl();
        log.info("Fetching {} readings from {}...", kind.getValue(),
                url.substring(0, Math.min(url.length(), URL_LOG_LENGTH)));

        SourcePayload payload;
        try {
            payload = meterSourceRestClient.get()
                    .uri(url)
                    .retrieve()
                    .body(SourcePayload.class);
        } catch (HttpMessageNotReadableException e) {
            throw new SchemaViolationException("Unreadable " + kind.getValue() + " payload: " + e.getMessage(), e);
        } catch (RestClientException e) {
            if (e.getCause() instanceof HttpMessageNotReadableException unreadable) {
                throw new SchemaViolationException(
                        "Unreadable " + kind.getValue() + " payload: " + unreadable.getMessage(), e);
            }
            throw new SourceUnavailableException(kind,
                    "Failed to fetch " + kind.getValue() + " readings: " + e.getMessage(), e);
        }

        if (payload == null || payload.getData() == null) {
            throw new SchemaViolationException("Source payload for " + kind.getValue() + " has no 'data' array");
        }
        return payload.getData();
    }

    /** Circuit breaker açıkken çekim denenmez; tür bu döngüde atlanır, retry de devreye girmez. */
    List<SourceRecord> handleCircuitBreakerOpen(MeasurementKind kind, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for meter source. Skipping fetch for {}", kind.getValue());
        throw new SourceCircuitOpenException(kind,
                "Meter source circuit breaker is open for " + kind.getValue(), ex);
    }
}
