package com.signalplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the decision-cycle id and instrument through Reactor pipelines.
 *
 * <p>The Reactor Context is the source of truth. MDC is written only for the duration of
 * a single log statement via {@link #withMdc}; nothing is left behind on the thread.
 */
public final class TraceContextUtil {

    public static final String CYCLE_ID_KEY   = "cycleId";
    public static final String INSTRUMENT_KEY = "instrument";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** Call at the end of pipeline assembly; {@code contextWrite} propagates upstream. */
    public static <T> Mono<T> withCycle(Mono<T> mono, String cycleId, String instrument) {
        return mono.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId)
                                           .put(INSTRUMENT_KEY, instrument));
    }

    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, UNKNOWN);
    }

    public static String getInstrument(ContextView ctx) {
        return ctx.getOrDefault(INSTRUMENT_KEY, UNKNOWN);
    }

    /**
     * Bridges the cycle id and instrument into MDC while {@code logAction} runs, then
     * removes both entries.
     */
    public static void withMdc(String cycleId, String instrument, Runnable logAction) {
        MDC.put(CYCLE_ID_KEY, cycleId);
        MDC.put(INSTRUMENT_KEY, instrument);
        try {
            logAction.run();
        } finally {
            MDC.remove(CYCLE_ID_KEY);
            MDC.remove(INSTRUMENT_KEY);
        }
    }
}
