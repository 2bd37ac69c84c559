package com.trade.signalengine.common.constants;

import com.trade.signalengine.enums.SourceMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the engine reads from {@code application.yml}. Unknown keys fail the startup.
 * Only {@link SignalTuning} is hot-reloadable; the rest is fixed for the life of the process.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "signal-engine", ignoreUnknownFields = false)
public class SignalEngineProperties {

    @NotEmpty
    private List<String> instruments = new ArrayList<>(List.of("EURUSD"));

    @Valid
    private Schedule schedule = new Schedule();
    @Valid
    private Acquisition data = new Acquisition();
    @Valid
    private Sources sources = new Sources();
    @Valid
    private Indicators indicators = new Indicators();
    @Valid
    private Advisory advisory = new Advisory();
    @Valid
    private TradingHours tradingHours = new TradingHours();
    @Valid
    private Pacing pacing = new Pacing();
    @Valid
    private Health health = new Health();
    @Valid
    private SignalTuning tuning = new SignalTuning();

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(2);
    }

    @Data
    public static class Acquisition {
        @NotNull
        private SourceMode mode = SourceMode.SEQUENTIAL;
        @NotEmpty
        private List<String> sourceOrder = new ArrayList<>(List.of("twelvedata", "alphavantage", "binance"));
        @NotBlank
        private String interval = "1min";
        @Min(20)
        private int lookbackWindow = 100;
        @NotNull
        private Duration sourceTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration raceTimeout = Duration.ofSeconds(12);
        @Min(1)
        @Max(5)
        private int maxFetchAttempts = 3;
        @NotNull
        private Duration retryBackoff = Duration.ofSeconds(1);
        @NotNull
        private Duration cacheBaseTtl = Duration.ofSeconds(90);
        @NotNull
        private Duration cacheMinTtl = Duration.ofSeconds(30);
        @NotNull
        private Duration cacheMaxTtl = Duration.ofSeconds(180);
        @Min(1)
        private int cacheMaxEntries = 10;
        @NotNull
        private Duration quotaCooldown = Duration.ofMinutes(5);
    }

    @Data
    public static class Sources {
        @Valid
        private Provider twelvedata = new Provider("https://api.twelvedata.com", 800);
        @Valid
        private Provider alphavantage = new Provider("https://www.alphavantage.co", 25);
        @Valid
        private Provider binance = new Provider("https://api.binance.com", 0);
    }

    @Data
    @NoArgsConstructor
    public static class Provider {
        private boolean enabled = true;
        @NotBlank
        private String baseUrl;
        private String apiKey;
        /** Calls allowed per UTC day; 0 means unlimited. */
        @Min(0)
        private int dailyQuota;

        public Provider(String baseUrl, int dailyQuota) {
            this.baseUrl = baseUrl;
            this.dailyQuota = dailyQuota;
        }
    }

    @Data
    public static class Indicators {
        @Min(2)
        private int rsiPeriod = 14;
        @Min(2)
        private int macdFast = 12;
        @Min(3)
        private int macdSlow = 26;
        @Min(2)
        private int macdSignal = 9;
        @Min(2)
        private int bollingerPeriod = 20;
        @DecimalMin("0.5")
        private double bollingerK = 2.0;
        @Min(2)
        private int atrPeriod = 14;
        @Min(2)
        private int adxPeriod = 14;
        @Min(2)
        private int stochasticPeriod = 14;
        @Min(1)
        private int stochasticSmoothing = 3;
        @Min(2)
        private int volumeAveragePeriod = 20;
        @Min(1)
        private int momentumPeriods = 3;
        /** Percent change inside which momentum counts as NEUTRAL. */
        @DecimalMin("0.0")
        private double momentumDeadBandPct = 0.01;
        /** MACD diff inside which the trend detector ignores direction. */
        @DecimalMin("0.0")
        private double macdNeutralBand = 0.0001;
        @NotNull
        private Duration cacheTtl = Duration.ofSeconds(30);
        @Min(1)
        private int cacheMaxEntries = 5;
    }

    @Data
    public static class Advisory {
        private boolean enabled = false;
        @NotBlank
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        @NotBlank
        private String model = "gpt-4o-mini";
        @NotNull
        private Duration requestTimeout = Duration.ofSeconds(3);
        @NotNull
        private Duration waitTimeout = Duration.ofMillis(500);
    }

    @Data
    public static class TradingHours {
        private boolean enabled = true;
        @Min(0)
        @Max(23)
        private int startHour = 0;
        @Min(1)
        @Max(24)
        private int endHour = 24;
        /** FX closes from Friday 22:00 UTC to Sunday 22:00 UTC. */
        private boolean weekendClosed = true;
    }

    @Data
    public static class Pacing {
        @Min(1)
        private int maxUserRequestsPerMinute = 10;
        @NotNull
        private Duration userWindow = Duration.ofMinutes(1);
        @NotNull
        private Duration idleUserEviction = Duration.ofHours(1);
    }

    @Data
    public static class Health {
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double apiErrorRatePct = 10.0;
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double advisoryErrorRatePct = 20.0;
        @DecimalMin("0.0")
        private double noSignalHours = 2.0;
        @NotNull
        private Duration alertCooldown = Duration.ofHours(1);
        @NotNull
        private Duration checkInterval = Duration.ofMinutes(5);
    }
}
