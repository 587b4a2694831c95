package com.signalplatform.orchestrator.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalplatform.analysis.dispatch.PredictorDispatchService;
import com.signalplatform.analysis.predictor.PredictorFactory;
import com.signalplatform.analysis.registry.ModelRegistry;
import com.signalplatform.common.ensemble.EnsembleAggregator;
import com.signalplatform.common.ensemble.OutcomeResolver;
import com.signalplatform.common.ensemble.ReliabilityWeightedAggregator;
import com.signalplatform.common.feature.FeatureBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class OrchestratorConfig {

    @Bean
    public FeatureBuilder featureBuilder(SignalPlatformProperties properties) {
        return new FeatureBuilder(properties.features().toSettings());
    }

    @Bean
    public EnsembleAggregator ensembleAggregator(SignalPlatformProperties properties) {
        return new ReliabilityWeightedAggregator(properties.ensemble().toSettings());
    }

    @Bean
    public OutcomeResolver outcomeResolver(SignalPlatformProperties properties) {
        return new OutcomeResolver(properties.ensemble().toSettings());
    }

    @Bean
    public PredictorFactory predictorFactory(WebClient.Builder builder, ObjectMapper objectMapper,
                                             SignalPlatformProperties properties) {
        return new PredictorFactory(builder, objectMapper, properties.advisory().toSettings());
    }

    @Bean
    public ModelRegistry modelRegistry(ObjectMapper objectMapper, PredictorFactory predictorFactory) {
        return new ModelRegistry(objectMapper, predictorFactory);
    }

    @Bean
    public PredictorDispatchService predictorDispatchService() {
        return new PredictorDispatchService();
    }

    /** ISO-8601 instants, stable output for report and checkpoint files. */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
