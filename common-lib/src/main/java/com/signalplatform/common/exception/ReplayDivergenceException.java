package com.signalplatform.common.exception;

/**
 * Two replays of the same input produced different results. Always a correctness bug.
 */
public class ReplayDivergenceException extends SignalPlatformException {

    private final String instrument;

    public ReplayDivergenceException(String instrument, String message) {
        super("Replay divergence for instrument=" + instrument + ": " + message);
        this.instrument = instrument;
    }

    public String getInstrument() {
        return instrument;
    }
}
