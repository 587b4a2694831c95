package com.signalplatform.common.model;

/**
 * What the risk gate did to a blended signal.
 *
 * <ul>
 *   <li>{@link #PASSED}: forwarded unchanged</li>
 *   <li>{@link #SCALED}: position size reduced to fit the aggregate exposure headroom</li>
 *   <li>{@link #VETOED}: replaced by HOLD; blended confidence kept for audit</li>
 * </ul>
 */
public enum RiskVerdict {
    PASSED,
    SCALED,
    VETOED
}
