package com.signalplatform.common.exception;

/**
 * The feature builder could not produce a vector because the history window is shorter
 * than the configured lookback. Fatal for the current cycle only: callers treat it as
 * "no decision this tick".
 */
public class InsufficientHistoryException extends SignalPlatformException {

    private final String instrument;
    private final int available;
    private final int required;

    public InsufficientHistoryException(String instrument, int available, int required) {
        super("Insufficient history for instrument=" + instrument
              + ": available=" + available + " required=" + required);
        this.instrument = instrument;
        this.available  = available;
        this.required   = required;
    }

    public String getInstrument() {
        return instrument;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
