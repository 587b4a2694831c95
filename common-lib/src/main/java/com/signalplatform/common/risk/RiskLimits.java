package com.signalplatform.common.risk;

/**
 * Static limits enforced by {@link RiskGate}. All values are fractions of equity.
 *
 * @param maxPositionSize    largest exposure change a single signal may request
 * @param perInstrumentLimit largest |exposure| one instrument may hold
 * @param aggregateLimit     largest Σ|exposure| across all instruments
 * @param maxDrawdown        drawdown from peak equity at which the circuit breaker trips
 */
public record RiskLimits(
    double maxPositionSize,
    double perInstrumentLimit,
    double aggregateLimit,
    double maxDrawdown
) {
    public RiskLimits {
        if (!(maxPositionSize > 0.0) || !(perInstrumentLimit > 0.0) || !(aggregateLimit > 0.0)) {
            throw new IllegalArgumentException("position and exposure limits must be positive");
        }
        if (!(maxDrawdown > 0.0) || maxDrawdown > 1.0) {
            throw new IllegalArgumentException("maxDrawdown must be in (0,1], got " + maxDrawdown);
        }
    }

    public static RiskLimits defaults() {
        return new RiskLimits(0.10, 0.50, 1.00, 0.20);
    }
}
