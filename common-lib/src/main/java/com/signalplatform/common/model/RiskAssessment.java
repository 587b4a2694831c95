package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk gate result. {@code reason} is {@code null} only for {@link RiskVerdict#PASSED}.
 */
public record RiskAssessment(
    @JsonProperty("direction")            Direction direction,
    @JsonProperty("positionSizeFraction") double positionSizeFraction,
    @JsonProperty("verdict")              RiskVerdict verdict,
    @JsonProperty("reason")               String reason
) {
    public static RiskAssessment passed(Direction direction, double size) {
        return new RiskAssessment(direction, size, RiskVerdict.PASSED, null);
    }

    public static RiskAssessment scaled(Direction direction, double size, String reason) {
        return new RiskAssessment(direction, size, RiskVerdict.SCALED, reason);
    }

    public static RiskAssessment vetoed(String reason) {
        return new RiskAssessment(Direction.HOLD, 0.0, RiskVerdict.VETOED, reason);
    }
}
