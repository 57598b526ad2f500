package com.lineage.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One run of one agent for one task, with its ordered steps and timeline events.
 *
 * @param id        unique entry id
 * @param agentId   the agent that owns this run
 * @param startTime when the run started
 * @param endTime   when the run finished, null while running
 * @param status    current status; finalized once
 * @param input     the run input, any JSON value
 * @param output    the run output, any JSON value
 * @param usage     token and resource counters
 * @param steps     ordered steps
 * @param events    ordered timeline events
 * @param metadata  open metadata map
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionEntry(
    String id,
    String agentId,
    Instant startTime,
    Instant endTime,
    AgentStatus status,
    Object input,
    Object output,
    Map<String, Object> usage,
    List<HistoryStep> steps,
    List<TimelineEvent> events,
    Map<String, Object> metadata
) {
    public ExecutionEntry {
        steps = steps == null ? List.of() : List.copyOf(steps);
        events = events == null ? List.of() : List.copyOf(events);
        metadata = metadata == null ? Map.of() : metadata;
    }

    /**
     * A fresh running entry with no steps or events.
     */
    public static ExecutionEntry started(String id, String agentId, Object input, Instant startTime) {
        return new ExecutionEntry(id, agentId, startTime, null, AgentStatus.RUNNING,
                input, null, null, List.of(), List.of(), Map.of());
    }

    public boolean isActive() {
        return status == null || !status.isTerminal();
    }

    public ExecutionEntry withStatus(AgentStatus newStatus, Object newOutput, Instant newEndTime) {
        return new ExecutionEntry(id, agentId, startTime, newEndTime, newStatus,
                input, newOutput, usage, steps, events, metadata);
    }

    public ExecutionEntry withUsage(Map<String, Object> newUsage) {
        return new ExecutionEntry(id, agentId, startTime, endTime, status,
                input, output, newUsage, steps, events, metadata);
    }

    public ExecutionEntry withSteps(List<HistoryStep> newSteps) {
        return new ExecutionEntry(id, agentId, startTime, endTime, status,
                input, output, usage, newSteps, events, metadata);
    }

    public ExecutionEntry withEvents(List<TimelineEvent> newEvents) {
        return new ExecutionEntry(id, agentId, startTime, endTime, status,
                input, output, usage, steps, newEvents, metadata);
    }

    public ExecutionEntry appendEvent(TimelineEvent event) {
        List<TimelineEvent> appended = new ArrayList<>(events);
        appended.add(event);
        return withEvents(appended);
    }
}
