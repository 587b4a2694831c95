package com.signalplatform.orchestrator.pipeline;

import com.signalplatform.common.ensemble.ReliabilityBook;
import com.signalplatform.common.regime.RegimeDetector;
import com.signalplatform.common.risk.RiskBudget;

/**
 * The mutable state one decision cycle reads and commits to: regime state machine,
 * reliability table and risk budget of a single instrument.
 *
 * <p>The risk budget doubles as the instrument's exclusive-access monitor: the arbiter
 * commits the whole cycle inside {@code synchronized (riskBudget)}.
 */
public record DecisionState(
    RegimeDetector regimeDetector,
    ReliabilityBook reliabilities,
    RiskBudget riskBudget
) {
    /** Independent deep copy, taken under the instrument's monitor. */
    public DecisionState copy() {
        synchronized (riskBudget) {
            return new DecisionState(regimeDetector.copy(), reliabilities.copy(), riskBudget.copy());
        }
    }
}
