package com.signalplatform.common.feature;

import java.util.List;

/**
 * Pure indicator math shared by the feature builder and the regime classifier.
 * All series are oldest-first (last index = most recent value).
 *
 * <p>Every function iterates in a fixed order so repeated calls on equal inputs return
 * bit-identical results.
 */
public final class Indicators {

    private Indicators() {}

    // ── averages ────────────────────────────────────────────────────────────

    /**
     * @param series oldest-first values
     * @param period number of trailing values
     * @return mean of the last {@code period} values, or NaN if there are fewer
     */
    public static double sma(List<Double> series, int period) {
        int n = series.size();
        if (period <= 0 || n < period) return Double.NaN;
        double sum = 0.0;
        for (int i = n - period; i < n; i++) sum += series.get(i);
        return sum / period;
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI using Wilder's smoothing over the whole series.
     *
     * @return RSI in [0, 100]; 50 when the series is flat; NaN if fewer than period+1 values
     */
    public static double rsi(List<Double> series, int period) {
        int n = series.size();
        if (period <= 0 || n < period + 1) return Double.NaN;

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = series.get(i) - series.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss -= change;
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = series.get(i) - series.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
        }

        if (avgGain == 0.0 && avgLoss == 0.0) return 50.0;
        if (avgLoss == 0.0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── dispersion ──────────────────────────────────────────────────────────

    /** Population standard deviation of the last {@code period} values; NaN if short. */
    public static double stdDev(List<Double> series, int period) {
        double mean = sma(series, period);
        if (Double.isNaN(mean)) return Double.NaN;
        int n = series.size();
        double variance = 0.0;
        for (int i = n - period; i < n; i++) {
            double diff = series.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /**
     * Realized volatility: population stdev of log returns over the last {@code period}
     * returns (needs {@code period + 1} prices). Returns 0.0 for fewer than two prices.
     */
    public static double realizedVolatility(List<Double> prices, int period) {
        int n = prices.size();
        int returns = Math.min(period, n - 1);
        if (returns < 1) return 0.0;
        double sum = 0.0;
        double[] r = new double[returns];
        for (int i = 0; i < returns; i++) {
            int idx = n - returns + i;
            r[i] = Math.log(prices.get(idx) / prices.get(idx - 1));
            sum += r[i];
        }
        double mean = sum / returns;
        double variance = 0.0;
        for (double v : r) variance += (v - mean) * (v - mean);
        return Math.sqrt(variance / returns);
    }

    // ── trend ───────────────────────────────────────────────────────────────

    /**
     * Least-squares slope of the last {@code period} values against their index,
     * divided by their mean: relative drift per step. 0.0 for fewer than two values
     * or a zero mean.
     *
     * <pre>
     *   slope = Σ(x − x̄)(y − ȳ) / Σ(x − x̄)²
     *   normalizedSlope = slope / ȳ
     * </pre>
     */
    public static double normalizedSlope(List<Double> series, int period) {
        int n = series.size();
        int len = Math.min(period, n);
        if (len < 2) return 0.0;
        double meanX = (len - 1) / 2.0;
        double meanY = 0.0;
        for (int i = n - len; i < n; i++) meanY += series.get(i);
        meanY /= len;
        if (meanY == 0.0) return 0.0;

        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < len; i++) {
            double dx = i - meanX;
            num += dx * (series.get(n - len + i) - meanY);
            den += dx * dx;
        }
        return (num / den) / meanY;
    }

    /** {@code a / b − 1}, or 0.0 when {@code b} is zero or either side is NaN. */
    public static double ratioMinusOne(double a, double b) {
        if (b == 0.0 || Double.isNaN(a) || Double.isNaN(b)) return 0.0;
        return a / b - 1.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
