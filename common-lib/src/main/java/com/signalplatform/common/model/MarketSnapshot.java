package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable market observation for one instrument at one instant.
 *
 * <p>{@code volatility} and {@code spread} are auxiliary indicators supplied by the data
 * source; a value {@code <= 0} means "not supplied" and consumers derive their own.
 */
public record MarketSnapshot(
    @JsonProperty("instrument") String instrument,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("bid")        double bid,
    @JsonProperty("ask")        double ask,
    @JsonProperty("last")       double last,
    @JsonProperty("volume")     double volume,
    @JsonProperty("open")       double open,
    @JsonProperty("high")       double high,
    @JsonProperty("low")        double low,
    @JsonProperty("volatility") double volatility,
    @JsonProperty("spread")     double spread
) {
    public MarketSnapshot {
        Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!(last > 0.0)) {
            throw new IllegalArgumentException("last price must be positive, got " + last
                + " for instrument=" + instrument + " at " + timestamp);
        }
    }

    /** Quote-only snapshot; OHLC collapse to {@code last}, indicators not supplied. */
    public static MarketSnapshot of(String instrument, Instant timestamp,
                                    double bid, double ask, double last, double volume) {
        return new MarketSnapshot(instrument, timestamp, bid, ask, last, volume,
                                  last, last, last, 0.0, 0.0);
    }

    @JsonIgnore
    public double mid() {
        return (bid > 0.0 && ask > 0.0) ? (bid + ask) / 2.0 : last;
    }

    /** Supplied spread, else {@code ask − bid}, never negative. */
    @JsonIgnore
    public double effectiveSpread() {
        if (spread > 0.0) return spread;
        return (bid > 0.0 && ask > bid) ? ask - bid : 0.0;
    }
}
