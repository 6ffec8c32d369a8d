package com.baykanat.energy.meter.config;

import com.baykanat.energy.meter.domain.model.MeasurementKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** app.* için tip güvenli configuration (kaynak URL'leri, sync aralığı, sayfalama sınırları, tarife planı). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private SourceProperties source = new SourceProperties();
    @Valid
    private SyncProperties sync = new SyncProperties();
    @Valid
    private AnalyticsProperties analytics = new AnalyticsProperties();
    @Valid
    private TariffProperties tariff = new TariffProperties();
    private SchemaProperties schema = new SchemaProperties();

    @Getter
    @Setter
    public static class SourceProperties {
        /** Bağlantı ve okuma timeout'u; aşılırsa çekim başarısız sayılır. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @Valid
        private Feeds feeds = new Feeds();

        public FeedProperties feedFor(MeasurementKind kind) {
            return kind == MeasurementKind.ACTIVE ? feeds.getActive() : feeds.getReactive();
        }

        @Getter
        @Setter
        public static class Feeds {
            @Valid
            private FeedProperties active = new FeedProperties();
            @Valid
            private FeedProperties reactive = new FeedProperties();
        }
    }

    @Getter
    @Setter
    public static class FeedProperties {
        private String url;
        /** Beklenen OBIS kolon kodu; farklı kolon gelirse sadece uyarı loglanır. */
        private String obisCode;

        public boolean isConfigured() {
            return url != null && !url.isBlank();
        }
    }

    @Getter
    @Setter
    public static class SyncProperties {
        private boolean enabled = true;
        /** İki döngü arasındaki bekleme (ms); önceki döngünün bitişinden itibaren. */
        private long intervalMs = 900000;
        @NotBlank
        private String readyMarker = "/tmp/data_loader_ready";
        @Min(1)
        private int batchSize = 1000;
    }

    @Getter
    @Setter
    public static class AnalyticsProperties {
        /** Saat, gün ve tarih sınırları bu bölgeye göre hesaplanır. */
        @NotBlank
        private String timeZone = "Europe/Zurich";
        @Min(1)
        private int defaultPerPage = 1000;
        @Min(1)
        private int minPerPage = 1;
        @Min(1)
        private int maxPerPage = 50000;
    }

    @Getter
    @Setter
    public static class TariffProperties {
        @NotBlank
        private String currency = "CHF";
        private String currencySymbol = "Fr.";
        @PositiveOrZero
        private double averageRate = 0.27;
        @Valid
        private PeriodProperties peak = new PeriodProperties("Hochtarif (HT)", "Peak hours rate", 0.32);
        @Valid
        private PeriodProperties offPeak = new PeriodProperties("Niedertarif (NT)", "Off-peak hours rate", 0.22);
        @Min(0)
        @Max(23)
        private int peakStartHour = 7;
        @Min(1)
        @Max(24)
        private int peakEndHour = 20;
        private List<SavingsTipProperties> savingsTips = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class PeriodProperties {
        @NotBlank
        private String name;
        private String description;
        @PositiveOrZero
        private double rate;

        public PeriodProperties() {
        }

        public PeriodProperties(String name, String description, double rate) {
            this.name = name;
            this.description = description;
            this.rate = rate;
        }
    }

    @Getter
    @Setter
    public static class SavingsTipProperties {
        private String title;
        private String description;
        private String potentialSavings;
    }

    @Getter
    @Setter
    public static class SchemaProperties {
        /** timescaledb eklentisi kuruluysa meter_readings hypertable'a çevrilir. */
        private boolean hypertableEnabled = true;
    }
}
