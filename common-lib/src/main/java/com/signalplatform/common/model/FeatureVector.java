package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-length ordered feature values tagged with the schema that produced them.
 * A predictor only accepts vectors whose {@code schemaId} equals its own.
 */
public record FeatureVector(
    @JsonProperty("schemaId")   String schemaId,
    @JsonProperty("instrument") String instrument,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("values")     List<Double> values
) {
    public FeatureVector {
        Objects.requireNonNull(schemaId, "schemaId");
        values = List.copyOf(values);
    }

    @JsonIgnore
    public int size() {
        return values.size();
    }

    public double get(int index) {
        return values.get(index);
    }
}
