package com.signalplatform.common.ensemble;

import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.PredictorResult;
import com.signalplatform.common.model.Regime;

import java.util.List;

/**
 * Applies a realized price move to the reliability book and converts it into P&L.
 *
 * <p>Correctness of a call for relative move {@code m}:
 * <pre>
 *   BUY  → 1 if m &gt;  flatTolerance
 *   SELL → 1 if m &lt; −flatTolerance
 *   HOLD → 1 if |m| ≤ flatTolerance
 *   else 0
 * </pre>
 * With the default tolerance of 0 a HOLD is only correct on an unchanged price.
 */
public final class OutcomeResolver {

    private final double flatTolerance;

    public OutcomeResolver(EnsembleSettings settings) {
        this.flatTolerance = settings.flatTolerance();
    }

    /** {@code exit / entry − 1}; 0.0 if the entry price is not positive. */
    public static double relativeMove(double entryPrice, double exitPrice) {
        return entryPrice > 0.0 ? exitPrice / entryPrice - 1.0 : 0.0;
    }

    public double correctness(Direction call, double move) {
        return switch (call) {
            case BUY  -> move >  flatTolerance ? 1.0 : 0.0;
            case SELL -> move < -flatTolerance ? 1.0 : 0.0;
            case HOLD -> Math.abs(move) <= flatTolerance ? 1.0 : 0.0;
        };
    }

    /**
     * Updates reliability for every predictor that responded in the resolved cycle, under
     * the regime that was committed when the decision was made. Failed predictors are
     * left untouched.
     */
    public void resolve(List<PredictorResult> results, Regime regime, double move,
                        ReliabilityBook reliabilities) {
        for (PredictorResult r : results) {
            if (!r.responded()) continue;
            reliabilities.update(r.predictorId(), regime, correctness(r.prediction().direction(), move));
        }
    }

    /** P&L as a fraction of equity for holding {@code exposure} across {@code move}. */
    public static double pnl(double exposure, double move) {
        return exposure * move;
    }
}
