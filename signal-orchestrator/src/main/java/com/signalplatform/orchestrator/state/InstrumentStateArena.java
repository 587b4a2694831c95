package com.signalplatform.orchestrator.state;

import com.signalplatform.common.ensemble.ReliabilityBook;
import com.signalplatform.common.regime.RegimeDetector;
import com.signalplatform.common.risk.RiskBudget;
import com.signalplatform.orchestrator.config.SignalPlatformProperties;
import com.signalplatform.orchestrator.pipeline.DecisionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-instrument live state addressed by instrument key. Each entry is guarded by its own
 * monitor; there is no global lock.
 */
@Component
public class InstrumentStateArena {

    private static final Logger log = LoggerFactory.getLogger(InstrumentStateArena.class);

    private final SignalPlatformProperties properties;
    private final ConcurrentHashMap<String, InstrumentState> states = new ConcurrentHashMap<>();

    public InstrumentStateArena(SignalPlatformProperties properties) {
        this.properties = properties;
    }

    /** Entry for {@code instrument}, created with fresh state on first use. */
    public InstrumentState stateFor(String instrument) {
        return states.computeIfAbsent(instrument, key -> {
            log.info("[Arena] New instrument state. instrument={}", key);
            return new InstrumentState(key, freshDecisionState(), properties.cycle().historyCapacity());
        });
    }

    public InstrumentState find(String instrument) {
        return states.get(instrument);
    }

    /** State built from configuration alone, with no history. */
    public DecisionState freshDecisionState() {
        return new DecisionState(
            new RegimeDetector(properties.regime().toSettings()),
            new ReliabilityBook(properties.ensemble().toSettings()),
            new RiskBudget(properties.risk().toLimits(), properties.risk().initialEquity()));
    }

    /** Signed exposure of every known instrument, sorted by instrument. */
    public Map<String, Double> openPositions() {
        Map<String, Double> positions = new TreeMap<>();
        states.forEach((key, state) -> positions.put(key, state.decisionState().riskBudget().exposure()));
        return positions;
    }

    public List<String> instruments() {
        return states.keySet().stream().sorted().toList();
    }
}
