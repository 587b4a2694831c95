package com.signalplatform.common.exception;

import java.time.Duration;
import java.time.Instant;

/**
 * A live decision cycle was abandoned after the global per-cycle deadline.
 * The tick is not retried.
 */
public class MissedTickException extends SignalPlatformException {

    private final String instrument;
    private final Instant tickTimestamp;

    public MissedTickException(String instrument, Instant tickTimestamp, Duration deadline) {
        super("Missed tick for instrument=" + instrument + " at " + tickTimestamp
              + ": cycle exceeded " + deadline.toMillis() + "ms");
        this.instrument    = instrument;
        this.tickTimestamp = tickTimestamp;
    }

    public String getInstrument() {
        return instrument;
    }

    public Instant getTickTimestamp() {
        return tickTimestamp;
    }
}
