package com.anomalyplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the detection run id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single
 * log statement via {@link #withMdc}, never left on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withRunId(pipeline, runId);
 *     ...
 *     Mono.deferContextual(ctx -&gt; { String runId = TraceContextUtil.getRunId(ctx); ... })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String RUN_ID_KEY = "runId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    public static <T> Mono<T> withRunId(Mono<T> mono, String runId) {
        return mono.contextWrite(ctx -> ctx.put(RUN_ID_KEY, runId));
    }

    /** The run id stored in {@code ctx}, or {@value #UNKNOWN}; never {@code null}. */
    public static String getRunId(ContextView ctx) {
        return ctx.getOrDefault(RUN_ID_KEY, UNKNOWN);
    }

    /** Puts {@code runId} into MDC while {@code logAction} runs, then removes it. */
    public static void withMdc(String runId, Runnable logAction) {
        MDC.put(RUN_ID_KEY, runId);
        try {
            logAction.run();
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }
}
