package com.signalplatform.orchestrator.state;

import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.orchestrator.pipeline.Decision;
import com.signalplatform.orchestrator.pipeline.DecisionState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Live state of one instrument: decision state, a bounded history of accepted snapshots
 * and the last decision still waiting for its outcome.
 *
 * <p>Written only from the instrument's lane in {@code LiveDecisionService}; the methods
 * are synchronized so that readers on other threads (state API, checkpoints, seeded
 * replays) see a consistent view.
 */
public final class InstrumentState {

    private final String instrument;
    private final DecisionState decisionState;
    private final int historyCapacity;
    private final Deque<MarketSnapshot> history;

    private Decision pending;

    InstrumentState(String instrument, DecisionState decisionState, int historyCapacity) {
        this.instrument      = instrument;
        this.decisionState   = decisionState;
        this.historyCapacity = historyCapacity;
        this.history         = new ArrayDeque<>(historyCapacity);
    }

    public String instrument() {
        return instrument;
    }

    public DecisionState decisionState() {
        return decisionState;
    }

    /** Accepted snapshots, oldest first. */
    public synchronized List<MarketSnapshot> history() {
        return List.copyOf(history);
    }

    public synchronized MarketSnapshot lastSnapshot() {
        return history.peekLast();
    }

    /**
     * Appends {@code snapshot} if it is strictly later than the newest accepted one.
     *
     * @return {@code false} if the snapshot was stale or a duplicate and was dropped
     */
    public synchronized boolean append(MarketSnapshot snapshot) {
        MarketSnapshot newest = history.peekLast();
        if (newest != null && !snapshot.timestamp().isAfter(newest.timestamp())) {
            return false;
        }
        history.addLast(snapshot);
        while (history.size() > historyCapacity) {
            history.removeFirst();
        }
        return true;
    }

    /** Returns and clears the decision awaiting its outcome. */
    public synchronized Decision takePending() {
        Decision d = pending;
        pending = null;
        return d;
    }

    public synchronized void setPending(Decision decision) {
        this.pending = decision;
    }
}
