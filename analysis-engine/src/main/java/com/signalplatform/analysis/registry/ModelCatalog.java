package com.signalplatform.analysis.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.signalplatform.analysis.predictor.PredictorDescriptor;

import java.util.List;

/**
 * Persisted model registry document: {@code {"version": "...", "predictors": [ ... ]}}.
 */
public record ModelCatalog(
    @JsonProperty("version")    String version,
    @JsonProperty("predictors") List<PredictorDescriptor> predictors
) {
    public ModelCatalog {
        predictors = predictors == null ? List.of() : List.copyOf(predictors);
    }
}
