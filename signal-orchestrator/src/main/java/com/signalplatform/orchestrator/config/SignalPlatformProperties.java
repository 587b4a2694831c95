package com.signalplatform.orchestrator.config;

import com.signalplatform.analysis.predictor.AdvisorySettings;
import com.signalplatform.common.ensemble.EnsembleSettings;
import com.signalplatform.common.feature.FeatureSettings;
import com.signalplatform.common.regime.RegimeSettings;
import com.signalplatform.common.risk.RiskLimits;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Startup configuration of the decision core. Loaded once; the only runtime change is the
 * model registry reload, which re-reads {@code registry.location} and nothing else.
 */
@Validated
@ConfigurationProperties(prefix = "signal")
public record SignalPlatformProperties(
    @Valid Features features,
    @Valid Regime regime,
    @Valid Ensemble ensemble,
    @Valid Risk risk,
    @Valid Cycle cycle,
    @Valid Registry registry,
    @Valid Advisory advisory,
    @Valid Backtest backtest,
    @Valid Checkpoint checkpoint
) {

    public SignalPlatformProperties {
        if (features == null)   features   = new Features(null, null, null, null);
        if (regime == null)     regime     = new Regime(null, null, null, null, null, null);
        if (ensemble == null)   ensemble   = new Ensemble(null, null, null, null, null);
        if (risk == null)       risk       = new Risk(null, null, null, null, null);
        if (cycle == null)      cycle      = new Cycle(null, null);
        if (registry == null)   registry   = new Registry(null);
        if (advisory == null)   advisory   = new Advisory(null, null, null, null);
        if (backtest == null)   backtest   = new Backtest(null, null, null, null);
        if (checkpoint == null) checkpoint = new Checkpoint(null, null, null);

        int lookback = features.toSettings().minLookback();
        if (cycle.historyCapacity() < lookback) {
            throw new IllegalArgumentException("signal.cycle.history-capacity=" + cycle.historyCapacity()
                + " is below the feature lookback of " + lookback + " snapshots");
        }
    }

    public record Features(
        String schemaId,
        @Min(2) Integer fastWindow,
        @Min(3) Integer slowWindow,
        @Min(2) Integer rsiPeriod
    ) {
        public Features {
            if (schemaId == null || schemaId.isBlank()) schemaId = FeatureSettings.DEFAULT_SCHEMA_ID;
            if (fastWindow == null) fastWindow = 5;
            if (slowWindow == null) slowWindow = 20;
            if (rsiPeriod == null)  rsiPeriod  = 14;
        }

        public FeatureSettings toSettings() {
            return new FeatureSettings(schemaId, fastWindow, slowWindow, rsiPeriod);
        }
    }

    public record Regime(
        @Min(2) Integer windowSize,
        @Min(1) Integer hysteresis,
        @DecimalMin(value = "0.0", inclusive = false) Double highVolatilityThreshold,
        @DecimalMin(value = "0.0", inclusive = false) Double trendSlopeThreshold,
        @DecimalMin(value = "0.0", inclusive = false) Double illiquidSpreadThreshold,
        @DecimalMin("0.0") Double minVolume
    ) {
        public Regime {
            if (windowSize == null)              windowSize = 20;
            if (hysteresis == null)              hysteresis = 3;
            if (highVolatilityThreshold == null) highVolatilityThreshold = 0.02;
            if (trendSlopeThreshold == null)     trendSlopeThreshold = 0.001;
            if (illiquidSpreadThreshold == null) illiquidSpreadThreshold = 0.005;
            if (minVolume == null)               minVolume = 0.0;
        }

        public RegimeSettings toSettings() {
            return new RegimeSettings(windowSize, hysteresis, highVolatilityThreshold,
                                      trendSlopeThreshold, illiquidSpreadThreshold, minVolume);
        }
    }

    public record Ensemble(
        @DecimalMin(value = "0.0", inclusive = false) Double reliabilityHalfLife,
        @DecimalMin("0.0") @DecimalMax("1.0") Double initialReliability,
        @DecimalMin("0.0") @DecimalMax("1.0") Double lowConfidenceFactor,
        @DecimalMin("0.0") @DecimalMax("1.0") Double maxPositionFraction,
        @DecimalMin("0.0") Double flatTolerance
    ) {
        public Ensemble {
            if (reliabilityHalfLife == null) reliabilityHalfLife = 20.0;
            if (initialReliability == null)  initialReliability = 1.0;
            if (lowConfidenceFactor == null) lowConfidenceFactor = 0.5;
            if (maxPositionFraction == null) maxPositionFraction = 0.10;
            if (flatTolerance == null)       flatTolerance = 0.0;
        }

        public EnsembleSettings toSettings() {
            return new EnsembleSettings(reliabilityHalfLife, initialReliability, lowConfidenceFactor,
                                        maxPositionFraction, flatTolerance);
        }
    }

    public record Risk(
        @DecimalMin(value = "0.0", inclusive = false) Double maxPositionSize,
        @DecimalMin(value = "0.0", inclusive = false) Double perInstrumentLimit,
        @DecimalMin(value = "0.0", inclusive = false) Double aggregateLimit,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") Double maxDrawdown,
        @DecimalMin(value = "0.0", inclusive = false) Double initialEquity
    ) {
        public Risk {
            if (maxPositionSize == null)    maxPositionSize = 0.10;
            if (perInstrumentLimit == null) perInstrumentLimit = 0.50;
            if (aggregateLimit == null)     aggregateLimit = 1.00;
            if (maxDrawdown == null)        maxDrawdown = 0.20;
            if (initialEquity == null)      initialEquity = 100_000.0;
        }

        public RiskLimits toLimits() {
            return new RiskLimits(maxPositionSize, perInstrumentLimit, aggregateLimit, maxDrawdown);
        }
    }

    /**
     * @param deadline        global per-cycle deadline; a live cycle still running past it is a missed tick
     * @param historyCapacity snapshots of history kept per instrument; at least the feature lookback
     */
    public record Cycle(Duration deadline, @Min(2) Integer historyCapacity) {
        public Cycle {
            if (deadline == null)        deadline = Duration.ofSeconds(2);
            if (historyCapacity == null) historyCapacity = 500;
        }
    }

    public record Registry(String location) {
        public Registry {
            if (location == null || location.isBlank()) location = "classpath:model-registry.json";
        }
    }

    public record Advisory(String baseUrl, String apiKey, String model, @Min(1) Integer maxTokens) {
        public Advisory {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.anthropic.com";
            if (apiKey == null)                       apiKey = "";
            if (model == null || model.isBlank())     model = "claude-3-5-haiku-latest";
            if (maxTokens == null)                    maxTokens = 100;
        }

        public AdvisorySettings toSettings() {
            return new AdvisorySettings(baseUrl, apiKey, model, maxTokens, null);
        }
    }

    /**
     * @param dataDirectory     directory of {@code <instrument>.json} snapshot files
     * @param reportDirectory   where backtest reports are written; blank disables writing
     * @param seedFromLive      seed replays with copies of live state instead of fresh state
     * @param verifyDeterminism run each replay twice and compare serialized results
     */
    public record Backtest(String dataDirectory, String reportDirectory, Boolean seedFromLive,
                           Boolean verifyDeterminism) {
        public Backtest {
            if (dataDirectory == null || dataDirectory.isBlank()) dataDirectory = "data/history";
            if (reportDirectory == null)                           reportDirectory = "data/reports";
            if (seedFromLive == null)                              seedFromLive = false;
            if (verifyDeterminism == null)                         verifyDeterminism = false;
        }
    }

    public record Checkpoint(Boolean enabled, String path, Duration interval) {
        public Checkpoint {
            if (enabled == null)                  enabled = false;
            if (path == null || path.isBlank())   path = "data/checkpoint/state.json";
            if (interval == null)                 interval = Duration.ofSeconds(60);
        }
    }
}
