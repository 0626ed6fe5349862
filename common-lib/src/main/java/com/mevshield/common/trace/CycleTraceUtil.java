package com.mevshield.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the detection cycle identifier through reactive pipelines and log lines.
 *
 * <p>Reactor Context holds the id inside a pipeline; MDC is written only for the
 * duration of a log statement or a synchronous block, then cleared.
 */
public final class CycleTraceUtil {

    public static final String CYCLE_ID_KEY = "cycleId";

    private CycleTraceUtil() {}

    /** Short random id, e.g. {@code c-5f1a09b2}. */
    public static String newCycleId() {
        return "c-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static <T> Mono<T> withCycleId(Mono<T> mono, String cycleId) {
        return mono.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId));
    }

    /** Returns the cycle id from {@code ctx}, or {@code "none"}. */
    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, "none");
    }

    /**
     * Runs {@code action} with {@code cycleId} in MDC and removes it afterwards,
     * restoring any id that was present before.
     */
    public static void withMdc(String cycleId, Runnable action) {
        String previous = MDC.get(CYCLE_ID_KEY);
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            action.run();
        } finally {
            if (previous == null) {
                MDC.remove(CYCLE_ID_KEY);
            } else {
                MDC.put(CYCLE_ID_KEY, previous);
            }
        }
    }
}
