package com.signalplatform.common.model;

/**
 * Discrete market regime committed by {@link com.signalplatform.common.regime.RegimeDetector}.
 * {@link #UNDETERMINED} only appears while the detector's window is still filling.
 */
public enum Regime {
    TRENDING,
    RANGING,
    HIGH_VOLATILITY,
    ILLIQUID,
    UNDETERMINED
}
