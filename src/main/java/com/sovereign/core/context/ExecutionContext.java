package com.sovereign.core.context;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable position in the causal tree of a run.
 * <p>
 * A child derived with {@link #deriveChild(String)} keeps the parent's trace id
 * and mode, extends the span id with the operation name, and records the
 * parent span under {@value #PARENT_SPAN_KEY} in its metadata. Contexts are
 * passed explicitly to every task body; nothing looks them up ambiently.
 *
 * @param traceId  identifier shared by every context of one run
 * @param spanId   dotted ancestry path, e.g. {@code root.repo_prep.git_init}
 * @param mode     execution mode of the run
 * @param metadata unmodifiable string metadata
 */
public record ExecutionContext(
    String traceId,
    String spanId,
    ExecutionMode mode,
    Map<String, String> metadata
) {

    public static final String ROOT_SPAN = "root";
    public static final String PARENT_SPAN_KEY = "parent_span";
    public static final String REPO_PATH_KEY = "repo_path";
    public static final String REMOTE_URL_KEY = "remote_url";

    private static final DateTimeFormatter TRACE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public ExecutionContext {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(spanId, "spanId");
        Objects.requireNonNull(mode, "mode");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates the root context of a run.
     */
    public static ExecutionContext root(String traceId, ExecutionMode mode, Map<String, String> metadata) {
        return new ExecutionContext(traceId, ROOT_SPAN, mode, metadata);
    }

    /**
     * Generates a trace id in the format {@code <prefix>_yyyyMMdd_HHmmss}.
     */
    public static String newTraceId(String prefix) {
        return prefix + "_" + LocalDateTime.now().format(TRACE_TIMESTAMP);
    }

    /**
     * Derives the context of a named sub-operation. Pure; safe to call from
     * several threads on the same parent. Sibling names must be unique within
     * a scope, which this method does not check.
     *
     * @param operationName name of the sub-operation, appended to the span id
     * @return the child context
     */
    public ExecutionContext deriveChild(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName must not be blank");
        }
        var childMetadata = new LinkedHashMap<>(metadata);
        childMetadata.put(PARENT_SPAN_KEY, spanId);
        return new ExecutionContext(traceId, spanId + "." + operationName, mode, childMetadata);
    }

    /**
     * Returns a copy with one additional metadata entry.
     */
    public ExecutionContext withMetadata(String key, String value) {
        var copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new ExecutionContext(traceId, spanId, mode, copy);
    }
}
