package com.signalplatform.analysis.predictor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalplatform.common.exception.PredictorException;
import com.signalplatform.common.feature.FeatureBuilder;
import com.signalplatform.common.model.Direction;
import com.signalplatform.common.model.FeatureVector;
import com.signalplatform.common.model.ModelPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Predictor backed by an LLM messages API.
 *
 * <p><strong>Prompt contract</strong>: the user message lists instrument, timestamp and
 * each feature as {@code name=value}, and asks for a single JSON object.
 *
 * <p><strong>Response contract</strong>: the first text content block must contain
 * <pre>
 *   {"direction": "BUY" | "SELL" | "HOLD", "confidence": 0.0–1.0}
 * </pre>
 * optionally wrapped in a markdown code fence. Anything else is a {@link PredictorException}.
 *
 * <p>Never blocks: the HTTP exchange is a {@code Mono} and the caller bounds it with the
 * descriptor timeout. Non-deterministic, so backtests exclude it.
 */
public class ExternalAdvisoryPredictor extends AbstractPredictor {

    private static final Logger log = LoggerFactory.getLogger(ExternalAdvisoryPredictor.class);

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final AdvisorySettings settings;
    private final String model;
    private final int maxTokens;

    public ExternalAdvisoryPredictor(PredictorDescriptor descriptor, WebClient client,
                                     ObjectMapper objectMapper, AdvisorySettings settings) {
        super(descriptor);
        this.client       = client;
        this.objectMapper = objectMapper;
        this.settings     = settings;
        this.model        = descriptor.params().path("model").asText(settings.model());
        this.maxTokens    = descriptor.params().path("maxTokens").asInt(settings.maxTokens());
    }

    @Override
    public boolean deterministic() {
        return false;
    }

    @Override
    protected Mono<ModelPrediction> evaluate(FeatureVector features) {
        if (!settings.configured()) {
            return Mono.error(new PredictorException(descriptor.id(), "no advisory API key configured"));
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "messages", List.of(Map.of("role", "user", "content", buildPrompt(features))))))
            .flatMap(body -> client.post()
                .uri("/v1/messages")
                .header("x-api-key", settings.apiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class))
            .map(response -> parseResponse(response, features))
            .doOnSuccess(p -> log.debug("[Advisory] Prediction received. predictor={} direction={} confidence={}",
                                        descriptor.id(), p.direction(), p.confidence()));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(FeatureVector features) {
        StringBuilder lines = new StringBuilder();
        List<String> names = FeatureBuilder.FEATURE_NAMES;
        for (int i = 0; i < features.size(); i++) {
            String name = i < names.size() ? names.get(i) : "f" + i;
            lines.append(String.format("  %s=%.8f%n", name, features.get(i)));
        }
        return """
            You are a trading signal model. Given the engineered features below for one
            instrument, predict the direction of the next price move.

            instrument=%s
            timestamp=%s
            schema=%s
            features:
            %s
            Respond with ONLY a JSON object, no prose:
            {"direction": "BUY" | "SELL" | "HOLD", "confidence": <number between 0 and 1>}
            """.formatted(features.instrument(), features.timestamp(), features.schemaId(), lines);
    }

    // ── response parsing ──────────────────────────────────────────────────────

    ModelPrediction parseResponse(String response, FeatureVector features) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String text = root.path("content").path(0).path("text").asText("");
            String cleaned = text.replace("```json", "").replace("```", "").trim();
            JsonNode json = objectMapper.readTree(cleaned);
            if (json == null || !json.hasNonNull("direction") || !json.hasNonNull("confidence")) {
                throw new PredictorException(descriptor.id(), "response missing direction/confidence: " + cleaned);
            }
            String rawDirection = json.get("direction").asText();
            Direction direction = Direction.parse(rawDirection);
            if (direction == Direction.HOLD && !"HOLD".equalsIgnoreCase(rawDirection.trim())) {
                throw new PredictorException(descriptor.id(), "unknown direction: " + rawDirection);
            }
            double confidence = json.get("confidence").asDouble(Double.NaN);
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new PredictorException(descriptor.id(), "confidence out of range: " + confidence);
            }
            return new ModelPrediction(descriptor.id(), direction, confidence, features.timestamp());
        } catch (PredictorException e) {
            throw e;
        } catch (Exception e) {
            throw new PredictorException(descriptor.id(), "unparseable advisory response", e);
        }
    }
}
