package com.signalplatform.common.risk;

import com.signalplatform.common.model.BlendedSignal;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.RiskAssessment;
import com.signalplatform.common.model.TradeSignal;

import java.util.Map;

/**
 * Applies exposure and drawdown limits to a blended signal.
 *
 * <h3>Rules (fixed order)</h3>
 * <ol>
 *   <li>Veto if the instrument's |exposure| would grow past {@code perInstrumentLimit}.</li>
 *   <li>Scale the size down to the remaining aggregate headroom
 *       {@code aggregateLimit − Σ|exposure|}; veto if there is no headroom.</li>
 *   <li>Veto if drawdown ≥ {@code maxDrawdown} (circuit breaker), whatever the direction.</li>
 *   <li>Otherwise pass.</li>
 * </ol>
 *
 * <p>The proposed size is capped at {@code maxPositionSize} before rule 1, so the limits
 * are checked against the size that would trade. Exposure-reducing signals are never
 * blocked by rules 1 and 2. The output size is never larger than the proposed size. Stateless; {@link #commit} is the only mutation.
 */
public final class RiskGate {

    private static final double EPSILON = 1e-12;

    private RiskGate() {}

    /**
     * @param blended       ensemble output for this instrument
     * @param budget        instrument's budget (exposure, drawdown, limits)
     * @param openPositions signed exposure per instrument across the portfolio; the entry
     *                      for this instrument, if present, is superseded by {@code budget}
     * @param instrument    instrument being decided
     */
    public static RiskAssessment evaluate(BlendedSignal blended, RiskBudget budget,
                                          Map<String, Double> openPositions, String instrument) {
        RiskLimits limits = budget.limits();
        Direction direction = blended.direction();
        double size = Math.max(blended.positionSizeFraction(), 0.0);
        double current = budget.exposure();
        String scaleReason = null;

        if (direction != Direction.HOLD && size > 0.0) {
            // single-signal cap
            if (size > limits.maxPositionSize()) {
                size = limits.maxPositionSize();
                scaleReason = String.format("size capped at max position size %.6f", size);
            }
            double proposed = current + direction.sign() * size;
            double increase = Math.abs(proposed) - Math.abs(current);

            // ── rule 1: per-instrument limit ──────────────────────────────────
            if (increase > 0.0 && Math.abs(proposed) > limits.perInstrumentLimit() + EPSILON) {
                return RiskAssessment.vetoed(String.format(
                    "instrument exposure %.6f would exceed per-instrument limit %.6f",
                    Math.abs(proposed), limits.perInstrumentLimit()));
            }

            // ── rule 2: aggregate headroom ────────────────────────────────────
            if (increase > 0.0) {
                double gross = Math.abs(current);
                for (Map.Entry<String, Double> e : openPositions.entrySet()) {
                    if (!e.getKey().equals(instrument)) gross += Math.abs(e.getValue());
                }
                double headroom = limits.aggregateLimit() - gross;
                if (headroom <= EPSILON) {
                    return RiskAssessment.vetoed(String.format(
                        "no aggregate headroom: gross exposure %.6f at limit %.6f",
                        gross, limits.aggregateLimit()));
                }
                if (increase > headroom) {
                    size -= increase - headroom;
                    scaleReason = String.format(
                        "scaled to aggregate headroom %.6f (gross exposure %.6f, limit %.6f)",
                        headroom, gross, limits.aggregateLimit());
                }
            }
        }

        // ── rule 3: drawdown circuit breaker ──────────────────────────────────
        double drawdown = budget.drawdown();
        if (drawdown >= limits.maxDrawdown()) {
            return RiskAssessment.vetoed(String.format(
                "drawdown circuit breaker: drawdown %.6f >= threshold %.6f",
                drawdown, limits.maxDrawdown()));
        }

        // ── rule 4: pass ──────────────────────────────────────────────────────
        if (direction == Direction.HOLD) {
            return RiskAssessment.passed(Direction.HOLD, 0.0);
        }
        return scaleReason == null
            ? RiskAssessment.passed(direction, size)
            : RiskAssessment.scaled(direction, size, scaleReason);
    }

    /** Applies the signal's exposure change to the budget. HOLD is a no-op. */
    public static void commit(RiskBudget budget, TradeSignal signal) {
        double delta = signal.signedSize();
        if (delta != 0.0) {
            budget.adjustExposure(delta);
        }
    }
}
