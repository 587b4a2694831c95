package com.signalplatform.common.regime;

import com.signalplatform.common.feature.Indicators;
import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.Regime;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless single-window classifier. Hysteresis lives in {@link RegimeDetector}.
 *
 * <p>Rules, in priority order:
 * <ol>
 *   <li>mean spread/mid &gt; illiquidSpreadThreshold, or mean volume &lt; minVolume → ILLIQUID</li>
 *   <li>volatility &gt; highVolatilityThreshold                                  → HIGH_VOLATILITY</li>
 *   <li>|normalized slope| &gt; trendSlopeThreshold                              → TRENDING</li>
 *   <li>otherwise                                                              → RANGING</li>
 * </ol>
 *
 * <p>Volatility is the mean supplied volatility when every snapshot carries one, else the
 * realized stdev of log returns over the window.
 *
 * <p>Confidence for a threshold rule is {@code 0.5 + 0.5 × (1 − threshold/metric)}, which
 * grows from 0.5 at the boundary towards 1.0. RANGING uses the slope's distance below
 * its threshold instead.
 */
public final class RegimeClassifier {

    /** One window evaluation. */
    public record Classification(Regime regime, double confidence) {}

    private final RegimeSettings settings;

    public RegimeClassifier(RegimeSettings settings) {
        this.settings = settings;
    }

    public Classification classify(List<MarketSnapshot> window) {
        if (window.isEmpty()) {
            return new Classification(Regime.UNDETERMINED, 0.0);
        }

        List<Double> closes = new ArrayList<>(window.size());
        double spreadSum = 0.0;
        double volumeSum = 0.0;
        double suppliedVolSum = 0.0;
        boolean allVolSupplied = true;
        for (MarketSnapshot s : window) {
            closes.add(s.last());
            double mid = s.mid();
            spreadSum += mid > 0.0 ? s.effectiveSpread() / mid : 0.0;
            volumeSum += s.volume();
            if (s.volatility() > 0.0) suppliedVolSum += s.volatility();
            else allVolSupplied = false;
        }
        int n = window.size();
        double meanSpread = spreadSum / n;
        double meanVolume = volumeSum / n;

        // ── liquidity ───────────────────────────────────────────────────────
        if (meanSpread > settings.illiquidSpreadThreshold()) {
            return new Classification(Regime.ILLIQUID, excess(meanSpread, settings.illiquidSpreadThreshold()));
        }
        if (settings.minVolume() > 0.0 && meanVolume < settings.minVolume()) {
            return new Classification(Regime.ILLIQUID, excess(settings.minVolume(), Math.max(meanVolume, 0.0)));
        }

        // ── volatility ──────────────────────────────────────────────────────
        double volatility = allVolSupplied
            ? suppliedVolSum / n
            : Indicators.realizedVolatility(closes, n - 1);
        if (volatility > settings.highVolatilityThreshold()) {
            return new Classification(Regime.HIGH_VOLATILITY, excess(volatility, settings.highVolatilityThreshold()));
        }

        // ── trend ───────────────────────────────────────────────────────────
        double slope = Math.abs(Indicators.normalizedSlope(closes, n));
        if (slope > settings.trendSlopeThreshold()) {
            return new Classification(Regime.TRENDING, excess(slope, settings.trendSlopeThreshold()));
        }

        double ranging = 0.5 + 0.5 * (1.0 - slope / settings.trendSlopeThreshold());
        return new Classification(Regime.RANGING, Indicators.clamp(ranging, 0.0, 1.0));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** metric strictly above threshold → confidence in (0.5, 1.0]. */
    private static double excess(double metric, double threshold) {
        if (metric <= 0.0) return 1.0;
        return Indicators.clamp(0.5 + 0.5 * (1.0 - threshold / metric), 0.0, 1.0);
    }
}
