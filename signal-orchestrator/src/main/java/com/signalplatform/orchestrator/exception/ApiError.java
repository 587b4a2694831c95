package com.signalplatform.orchestrator.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Error body of every non-2xx response. {@code code} is a stable machine-readable tag. */
public record ApiError(
    @JsonProperty("code")    String code,
    @JsonProperty("message") String message
) {}
