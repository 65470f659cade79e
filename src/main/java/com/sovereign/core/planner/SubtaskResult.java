package com.sovereign.core.planner;

import com.sovereign.core.context.ExecutionMode;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Result of one subtask that reached a decision.
 *
 * @param task   subtask name
 * @param mode   mode it was approached with
 * @param status complete or rejected
 * @param output handler output, or the rejection reason
 */
public record SubtaskResult(String task, ExecutionMode mode, SubtaskStatus status, String output) {

    public static SubtaskResult complete(Subtask subtask, String output) {
        return new SubtaskResult(subtask.name(), subtask.mode(), SubtaskStatus.COMPLETE, output);
    }

    public static SubtaskResult rejected(Subtask subtask, String reason) {
        return new SubtaskResult(subtask.name(), subtask.mode(), SubtaskStatus.REJECTED, reason);
    }

    Map<String, Object> toPayload() {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", status.name().toLowerCase(Locale.ROOT));
        payload.put("task", task);
        payload.put("archetype", mode.displayName());
        payload.put("output", output);
        return payload;
    }
}
