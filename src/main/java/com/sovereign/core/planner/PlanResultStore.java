package com.sovereign.core.planner;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory record of subtask results, keyed by trace. The planner builds
 * each report from the results stored under its trace.
 */
@Component
public class PlanResultStore {

    private final Map<String, CopyOnWriteArrayList<SubtaskResult>> resultsByTrace = new ConcurrentHashMap<>();

    public void put(String traceId, SubtaskResult result) {
        resultsByTrace.computeIfAbsent(traceId, k -> new CopyOnWriteArrayList<>()).add(result);
    }

    /**
     * Results of one trace in the order they were stored.
     */
    public List<SubtaskResult> results(String traceId) {
        List<SubtaskResult> results = resultsByTrace.get(traceId);
        return results == null ? List.of() : List.copyOf(results);
    }

    public void clear(String traceId) {
        resultsByTrace.remove(traceId);
    }
}
