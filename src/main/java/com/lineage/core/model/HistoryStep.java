package com.lineage.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One recorded step of an execution entry (a text chunk, a tool call, a tool result).
 *
 * @param id        step key, unique across the store
 * @param type      step kind, e.g. "text", "tool_call", "tool_result"
 * @param name      tool or step name, if any
 * @param content   textual content
 * @param arguments tool arguments, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryStep(
    String id,
    String type,
    String name,
    String content,
    Map<String, Object> arguments
) {
}
