package com.signalplatform.common.regime;

import com.signalplatform.common.model.MarketSnapshot;
import com.signalplatform.common.model.Regime;
import com.signalplatform.common.model.RegimeState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-instrument regime state machine with hysteresis.
 *
 * <h3>Transitions</h3>
 * <pre>
 *   window not full                          → stay UNDETERMINED
 *   window full, committed = UNDETERMINED    → commit the classification
 *   classification = committed               → reset candidate, refresh confidence
 *   classification ≠ committed               → candidate streak += 1 (reset on a new candidate)
 *   streak ≥ hysteresis                      → commit candidate
 * </pre>
 *
 * <p>Not thread-safe. Live callers hold the instrument's exclusive scope; the backtest
 * replayer owns its own {@link #copy()}.
 */
public final class RegimeDetector {

    private final RegimeSettings   settings;
    private final RegimeClassifier classifier;
    private final Deque<MarketSnapshot> window;

    private RegimeState committed = RegimeState.UNDETERMINED;
    private Regime      candidate;
    private int         candidateStreak;

    public RegimeDetector(RegimeSettings settings) {
        this.settings   = settings;
        this.classifier = new RegimeClassifier(settings);
        this.window     = new ArrayDeque<>(settings.windowSize());
    }

    /**
     * Feeds one snapshot and returns the committed state after it. A snapshot not later
     * than the newest one already in the window is ignored, so re-evaluating the same
     * tick never advances the hysteresis counter.
     */
    public RegimeState evaluate(MarketSnapshot snapshot) {
        MarketSnapshot newest = window.peekLast();
        if (newest != null && !snapshot.timestamp().isAfter(newest.timestamp())) {
            return committed;
        }
        window.addLast(snapshot);
        while (window.size() > settings.windowSize()) {
            window.removeFirst();
        }
        if (window.size() < settings.windowSize()) {
            return committed;
        }

        RegimeClassifier.Classification c = classifier.classify(new ArrayList<>(window));

        if (committed.regime() == Regime.UNDETERMINED) {
            commit(c, snapshot);
        } else if (c.regime() == committed.regime()) {
            candidate       = null;
            candidateStreak = 0;
            committed = new RegimeState(committed.regime(), c.confidence(), committed.committedAt());
        } else {
            if (c.regime() == candidate) {
                candidateStreak++;
            } else {
                candidate       = c.regime();
                candidateStreak = 1;
            }
            if (candidateStreak >= settings.hysteresis()) {
                commit(c, snapshot);
            }
        }
        return committed;
    }

    public RegimeState current() {
        return committed;
    }

    /** Pending candidate regime, or {@code null} when none. */
    public Regime candidate() {
        return candidate;
    }

    public int candidateStreak() {
        return candidateStreak;
    }

    public List<MarketSnapshot> window() {
        return List.copyOf(window);
    }

    public RegimeSettings settings() {
        return settings;
    }

    /** Independent deep copy: window, committed state and hysteresis counters. */
    public RegimeDetector copy() {
        RegimeDetector copy = new RegimeDetector(settings);
        copy.window.addAll(window);
        copy.committed       = committed;
        copy.candidate       = candidate;
        copy.candidateStreak = candidateStreak;
        return copy;
    }

    private void commit(RegimeClassifier.Classification c, MarketSnapshot at) {
        committed       = new RegimeState(c.regime(), c.confidence(), at.timestamp());
        candidate       = null;
        candidateStreak = 0;
    }
}
