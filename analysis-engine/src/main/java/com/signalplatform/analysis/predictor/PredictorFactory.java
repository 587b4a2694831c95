package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.PredictorException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Instantiates the model family named by a registry entry.
 */
public class PredictorFactory {

    private final WebClient advisoryClient;
    private final ObjectMapper objectMapper;
    private final AdvisorySettings advisorySettings;

    public PredictorFactory(WebClient.Builder builder, ObjectMapper objectMapper,
                            AdvisorySettings advisorySettings) {
        this.advisoryClient = builder
            .baseUrl(advisorySettings.baseUrl())
            .defaultHeader("anthropic-version", advisorySettings.apiVersion())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper     = objectMapper;
        this.advisorySettings = advisorySettings;
    }

    public Predictor create(PredictorDescriptor descriptor) {
        if (descriptor.type() == null) {
            throw new PredictorException(descriptor.id(), "missing predictor type");
        }
        return switch (descriptor.type()) {
            case STATISTICAL       -> new StatisticalPredictor(descriptor);
            case TREE_ENSEMBLE     -> new TreeEnsemblePredictor(descriptor);
            case NEURAL_NETWORK    -> new NeuralNetworkPredictor(descriptor);
            case EXTERNAL_ADVISORY -> new ExternalAdvisoryPredictor(descriptor, advisoryClient,
                                                                     objectMapper, advisorySettings);
        };
    }
}
