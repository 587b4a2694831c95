package com.signalplatform.common.feature;

import com.signalplatform.common.exception.InsufficientHistoryException;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.MarketSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a snapshot plus its history window into the fixed-shape {@code market-v1} vector.
 *
 * <h3>Features (in order)</h3>
 * <pre>
 *   0  return_1          last / previous last − 1
 *   1  return_fast       last / last[fast steps ago] − 1
 *   2  sma_fast_ratio    last / SMA(fast) − 1
 *   3  sma_slow_ratio    last / SMA(slow) − 1
 *   4  sma_cross         SMA(fast) / SMA(slow) − 1
 *   5  trend_slope       least-squares slope over slow window, relative to mean
 *   6  volatility        supplied volatility, else realized stdev of log returns (slow)
 *   7  rsi_centered      RSI(period) / 100 − 0.5
 *   8  spread_ratio      effective spread / mid
 *   9  volume_ratio      volume / mean volume over slow window − 1
 * </pre>
 *
 * <p>Pure and deterministic: no clock, no randomness, no state. History must be
 * oldest-first and must not contain snapshots later than {@code snapshot}.
 */
public final class FeatureBuilder {

    public static final List<String> FEATURE_NAMES = List.of(
        "return_1", "return_fast", "sma_fast_ratio", "sma_slow_ratio", "sma_cross",
        "trend_slope", "volatility", "rsi_centered", "spread_ratio", "volume_ratio");

    public static final int FEATURE_COUNT = FEATURE_NAMES.size();

    private final FeatureSettings settings;

    public FeatureBuilder(FeatureSettings settings) {
        this.settings = settings;
    }

    public FeatureSettings settings() {
        return settings;
    }

    public String schemaId() {
        return settings.schemaId();
    }

    /**
     * @param snapshot current observation
     * @param history  prior observations of the same instrument, oldest-first
     * @throws InsufficientHistoryException if {@code history} is shorter than
     *         {@link FeatureSettings#minLookback()}
     * @throws IllegalArgumentException if history contains a snapshot after {@code snapshot}
     */
    public FeatureVector build(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        int required = settings.minLookback();
        if (history.size() < required) {
            throw new InsufficientHistoryException(snapshot.instrument(), history.size(), required);
        }

        // only the trailing window is read; older entries cannot change the vector
        List<MarketSnapshot> window = history.subList(history.size() - required, history.size());
        List<Double> closes  = new ArrayList<>(required + 1);
        List<Double> volumes = new ArrayList<>(required + 1);
        for (MarketSnapshot s : window) {
            if (s.timestamp().isAfter(snapshot.timestamp())) {
                throw new IllegalArgumentException("history entry at " + s.timestamp()
                    + " is later than snapshot at " + snapshot.timestamp());
            }
            closes.add(s.last());
            volumes.add(s.volume());
        }
        closes.add(snapshot.last());
        volumes.add(snapshot.volume());

        int fast = settings.fastWindow();
        int slow = settings.slowWindow();
        int n    = closes.size();
        double last = snapshot.last();

        double smaFast = Indicators.sma(closes, fast);
        double smaSlow = Indicators.sma(closes, slow);

        double volatility = snapshot.volatility() > 0.0
            ? snapshot.volatility()
            : Indicators.realizedVolatility(closes, slow);

        double rsi = Indicators.rsi(closes, settings.rsiPeriod());
        double mid = snapshot.mid();
        double spreadRatio = mid > 0.0 ? snapshot.effectiveSpread() / mid : 0.0;

        List<Double> values = List.of(
            Indicators.ratioMinusOne(last, closes.get(n - 2)),
            Indicators.ratioMinusOne(last, closes.get(n - 1 - fast)),
            Indicators.ratioMinusOne(last, smaFast),
            Indicators.ratioMinusOne(last, smaSlow),
            Indicators.ratioMinusOne(smaFast, smaSlow),
            Indicators.normalizedSlope(closes, slow),
            volatility,
            rsi / 100.0 - 0.5,
            spreadRatio,
            Indicators.ratioMinusOne(snapshot.volume(), Indicators.sma(volumes, slow)));

        return new FeatureVector(settings.schemaId(), snapshot.instrument(), snapshot.timestamp(), values);
    }
}
