package com.lineage.core.events;

import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.EventLevel;
import com.lineage.core.model.EventType;
import com.lineage.core.model.ExecutionEntry;
import com.lineage.core.model.StatusMessage;
import com.lineage.core.model.TimelineEvent;

import java.time.Instant;
import java.util.Map;

/**
 * Builds the synthesized "agent" events relayed from a sub-agent to its parents.
 */
final class PropagatedEvents {

    static final String AGENT_START = "agent:start";
    static final String AGENT_SUCCESS = "agent:success";
    static final String AGENT_ERROR = "agent:error";

    private PropagatedEvents() {}

    /**
     * Creation is always relayed as a start, whatever the entry's status.
     */
    static TimelineEvent created(ExecutionEntry entry, Hop hop, String displayName, Instant now) {
        return base(entry, hop, displayName, now)
                .name(AGENT_START)
                .status(AgentStatus.RUNNING)
                .input(entry.input())
                .build();
    }

    static TimelineEvent updated(ExecutionEntry entry, Hop hop, String displayName, Instant now) {
        TimelineEvent.Builder builder = base(entry, hop, displayName, now);
        AgentStatus status = entry.status() == null ? AgentStatus.RUNNING : entry.status();
        return switch (status) {
            case COMPLETED -> builder
                    .name(AGENT_SUCCESS)
                    .status(AgentStatus.COMPLETED)
                    .endTime(entry.endTime() != null ? entry.endTime() : now)
                    .output(entry.output())
                    .build();
            case ERROR -> builder
                    .name(AGENT_ERROR)
                    .status(AgentStatus.ERROR)
                    .level(EventLevel.ERROR)
                    .endTime(entry.endTime() != null ? entry.endTime() : now)
                    .statusMessage(StatusMessage.of(outputText(entry.output())))
                    .output(entry.output())
                    .build();
            case RUNNING, IDLE -> builder
                    .name(AGENT_START)
                    .status(AgentStatus.RUNNING)
                    .input(entry.input())
                    .build();
        };
    }

    private static TimelineEvent.Builder base(ExecutionEntry entry, Hop hop, String displayName, Instant now) {
        return TimelineEvent.builder()
                .type(EventType.AGENT)
                .startTime(entry.startTime() != null ? entry.startTime() : now)
                .metadata(Map.of(
                        "displayName", displayName,
                        "id", hop.childId(),
                        "agentId", hop.parentId()));
    }

    private static String outputText(Object output) {
        return output == null ? null : output instanceof String s ? s : String.valueOf(output);
    }

    /**
     * One child-to-parent edge of the agent graph.
     */
    record Hop(String childId, String parentId) {
    }
}
