package com.signalplatform.common.model;

/**
 * Directional call of a predictor, the ensemble or the final trade signal.
 *
 * <p>Numeric mapping used by the ensemble vote: BUY=+1, SELL=−1, HOLD=0.
 */
public enum Direction {
    BUY(1),
    SELL(-1),
    HOLD(0);

    private final int sign;

    Direction(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    /** Exactly-zero maps to HOLD; this is the ensemble tie-break. */
    public static Direction fromScore(double score) {
        if (score > 0.0) return BUY;
        if (score < 0.0) return SELL;
        return HOLD;
    }

    /** Lenient parser for external payloads; unknown values read as HOLD. */
    public static Direction parse(String value) {
        if (value == null) return HOLD;
        return switch (value.trim().toUpperCase()) {
            case "BUY", "LONG"   -> BUY;
            case "SELL", "SHORT" -> SELL;
            default              -> HOLD;
        };
    }
}
