package com.signalplatform.analysis.predictor;

/**
 * Connection settings of the external advisory (LLM messages API).
 * A blank {@code apiKey} leaves the advisory predictor registered but always failing,
 * which degrades the ensemble instead of blocking it.
 */
public record AdvisorySettings(String baseUrl, String apiKey, String model, int maxTokens, String apiVersion) {

    public AdvisorySettings {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://api.anthropic.com";
        if (model == null || model.isBlank()) model = "claude-3-5-haiku-latest";
        if (maxTokens <= 0) maxTokens = 100;
        if (apiVersion == null || apiVersion.isBlank()) apiVersion = "2023-06-01";
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
