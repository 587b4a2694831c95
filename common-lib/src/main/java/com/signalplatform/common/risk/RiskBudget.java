package com.signalplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mutable risk state of one instrument: signed exposure (fraction of equity), equity and
 * its running peak. Mutated only through {@link RiskGate#commit} and {@link #applyPnl};
 * all access is synchronized.
 */
public final class RiskBudget {

    /** Serializable view used for checkpoints and the state API. */
    public record Snapshot(
        @JsonProperty("exposure")    double exposure,
        @JsonProperty("equity")      double equity,
        @JsonProperty("peakEquity")  double peakEquity,
        @JsonProperty("drawdown")    double drawdown
    ) {}

    private final RiskLimits limits;
    private double exposure;
    private double equity;
    private double peakEquity;

    public RiskBudget(RiskLimits limits, double initialEquity) {
        if (!(initialEquity > 0.0)) {
            throw new IllegalArgumentException("initialEquity must be positive, got " + initialEquity);
        }
        this.limits     = limits;
        this.equity     = initialEquity;
        this.peakEquity = initialEquity;
    }

    public RiskLimits limits() {
        return limits;
    }

    public synchronized double exposure() {
        return exposure;
    }

    public synchronized double equity() {
        return equity;
    }

    public synchronized double peakEquity() {
        return peakEquity;
    }

    /** {@code 1 − equity / peak}, in [0, 1). */
    public synchronized double drawdown() {
        return peakEquity > 0.0 ? Math.max(0.0, 1.0 - equity / peakEquity) : 0.0;
    }

    synchronized void adjustExposure(double delta) {
        exposure += delta;
    }

    /**
     * Compounds a realized P&L expressed as a fraction of equity.
     * <pre>
     *   equity = equity × (1 + pnl)
     *   peak   = max(peak, equity)
     * </pre>
     */
    public synchronized void applyPnl(double pnlFraction) {
        equity = equity * (1.0 + pnlFraction);
        if (equity > peakEquity) peakEquity = equity;
    }

    public synchronized RiskBudget copy() {
        RiskBudget copy = new RiskBudget(limits, equity);
        copy.exposure   = exposure;
        copy.peakEquity = peakEquity;
        return copy;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(exposure, equity, peakEquity, drawdown());
    }

    public synchronized void restore(Snapshot persisted) {
        if (!(persisted.equity() > 0.0)) {
            throw new IllegalArgumentException("persisted equity must be positive, got " + persisted.equity());
        }
        exposure   = persisted.exposure();
        equity     = persisted.equity();
        peakEquity = Math.max(persisted.peakEquity(), persisted.equity());
    }
}
