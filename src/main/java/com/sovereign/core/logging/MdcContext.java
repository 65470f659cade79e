package com.sovereign.core.logging;

import com.sovereign.core.context.ExecutionContext;
import org.slf4j.MDC;

/**
 * Utility for managing Sovereign-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String MODE = "mode";

    private MdcContext() {}

    public static void set(ExecutionContext context) {
        MDC.put(TRACE_ID, context.traceId());
        MDC.put(SPAN_ID, context.spanId());
        MDC.put(MODE, context.mode().name());
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
        MDC.remove(MODE);
    }
}
