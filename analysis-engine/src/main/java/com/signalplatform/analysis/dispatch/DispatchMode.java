package com.signalplatform.analysis.dispatch;

/**
 * How predictors are invoked within one decision cycle.
 *
 * <ul>
 *   <li>{@link #CONCURRENT}: live: each call on {@code boundedElastic}, bounded by its own timeout</li>
 *   <li>{@link #SEQUENTIAL}: backtest: registry order on the caller thread, no wall-clock timeout</li>
 * </ul>
 */
public enum DispatchMode {
    CONCURRENT,
    SEQUENTIAL
}
