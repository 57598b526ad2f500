package com.lineage.core.persistence.migration;

import com.lineage.core.model.AgentStatus;
import com.lineage.core.model.EventLevel;
import com.lineage.core.model.StatusMessage;
import com.lineage.core.model.TimelineEvent;
import com.lineage.core.persistence.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Converts legacy {@code {type, name, data}} envelopes into typed timeline events.
 * <p>
 * Legacy tool and memory events recorded only their terminal state; they are
 * expanded into a start event plus a completion event linked by
 * {@code parentEventId}.
 */
public class LegacyEventTransformer {

    private static final Logger log = LoggerFactory.getLogger(LegacyEventTransformer.class);

    private final Clock clock;
    private final Supplier<String> idGenerator;

    public LegacyEventTransformer(Clock clock) {
        this(clock, () -> UUID.randomUUID().toString());
    }

    public LegacyEventTransformer(Clock clock, Supplier<String> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    /**
     * Transforms one entry's legacy events in order. Message-node events are not
     * written; their input is attached to the next event. An event that fails to
     * transform is logged and skipped.
     */
    public List<TimelineEvent> transformAll(List<LegacyEvent> events) {
        List<TimelineEvent> result = new ArrayList<>();
        Object carriedInput = null;
        for (LegacyEvent event : events) {
            if (event == null) {
                continue;
            }
            if (event.isMessageNode()) {
                carriedInput = event.dataValue("input");
                continue;
            }
            try {
                result.addAll(transform(event, carriedInput));
            } catch (RuntimeException e) {
                log.warn("Skipping legacy event {} ({}:{}): {}",
                        event.id(), event.type(), event.name(), e.getMessage());
            }
            carriedInput = null;
        }
        return result;
    }

    public List<TimelineEvent> transform(LegacyEvent event, Object carriedInput) {
        Instant now = clock.instant();
        String eventId = event.id() != null ? event.id() : idGenerator.get();
        String type = event.type() != null ? event.type() : "unknown";
        String name = event.name() != null ? event.name() : "unknown";
        Instant startTime = Timestamps.parseOr(firstNonNull(event.timestamp(), event.startTime()), now);
        Instant endTime = Timestamps.parseOr(firstNonNull(event.updatedAt(), event.endTime()), startTime);
        String status = event.status() != null ? event.status() : asText(event.dataValue("status"));
        Object input = wrapInput(event, carriedInput);

        TimelineEvent.Builder base = TimelineEvent.builder()
                .id(eventId)
                .type(type)
                .startTime(startTime)
                .level(EventLevel.parse(event.level()))
                .version(event.version())
                .parentEventId(event.parentEventId())
                .statusMessage(statusMessageOf(event.statusMessage()))
                .input(input);

        return switch (LegacyEventKind.classify(event)) {
            case AGENT_START -> List.of(base
                    .name("agent:start")
                    .endTime(endTime)
                    .status(AgentStatus.RUNNING)
                    .output(event.dataValue("output"))
                    .metadata(defaultMetadata(event))
                    .build());
            case AGENT_FINISHED -> List.of(finished(event, base, endTime, status));
            case TOOL_WORKING -> pair(event, base, "tool:start", "tool:success",
                    endTime, AgentStatus.COMPLETED.value(), toolMetadata(event));
            case MEMORY_SAVE_MESSAGE -> pair(event, base, "memory:write_start", "memory:write_success",
                    endTime, AgentStatus.COMPLETED.value(), memoryMetadata(event));
            case MEMORY_GET_MESSAGES -> pair(event, base, "memory:read_start", "memory:read_success",
                    endTime, status != null ? status : AgentStatus.COMPLETED.value(), memoryMetadata(event));
            case OTHER -> List.of(base
                    .name(name.contains(":") ? name : type + ":" + name)
                    .endTime(endTime)
                    .status(status)
                    .output(event.output())
                    .error(event.error())
                    .metadata(defaultMetadata(event))
                    .build());
        };
    }

    private TimelineEvent finished(LegacyEvent event, TimelineEvent.Builder base, Instant endTime, String status) {
        Map<String, Object> error = event.dataMap("error");
        boolean failed = "error".equals(event.dataValue("status")) || !error.isEmpty();
        base.endTime(endTime)
                .output(event.dataValue("output"))
                .metadata(defaultMetadata(event));
        if (!failed) {
            return base.name("agent:success")
                    .status(status != null ? status : AgentStatus.COMPLETED.value())
                    .build();
        }
        Object message = error.get("message");
        return base.name("agent:error")
                .status(AgentStatus.ERROR)
                .level(EventLevel.ERROR)
                .statusMessage(message != null ? StatusMessage.of(String.valueOf(message)) : null)
                .error(error.isEmpty() ? null : error)
                .build();
    }

    private List<TimelineEvent> pair(LegacyEvent event, TimelineEvent.Builder base,
                                     String startName, String successName, Instant endTime,
                                     String successStatus, Map<String, Object> metadata) {
        TimelineEvent start = base
                .name(startName)
                .endTime(null)
                .status(AgentStatus.RUNNING)
                .metadata(metadata)
                .build();
        TimelineEvent success = start.toBuilder()
                .id(idGenerator.get())
                .name(successName)
                .startTime(endTime)
                .endTime(endTime)
                .status(successStatus)
                .parentEventId(start.id())
                .output(event.dataValue("output"))
                .error(event.error())
                .build();
        return List.of(start, success);
    }

    private static Object wrapInput(LegacyEvent event, Object carriedInput) {
        Object value = event.input() != null ? event.input()
                : event.dataValue("input") != null ? event.dataValue("input")
                : carriedInput;
        if (value == null || (value instanceof String s && s.isEmpty())) {
            return null;
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("input", value);
        return wrapped;
    }

    private static Map<String, Object> defaultMetadata(LegacyEvent event) {
        if (event.metadata() != null) {
            return event.metadata();
        }
        if (event.data().isEmpty()) {
            return Map.of();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", event.nodeSuffix());
        metadata.put("agentId", event.dataMap("metadata").get("sourceAgentId"));
        metadata.putAll(event.data());
        return metadata;
    }

    private static Map<String, Object> toolMetadata(LegacyEvent event) {
        Map<String, Object> source = event.dataMap("metadata");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", event.nodeSuffix());
        metadata.put("agentId", source.get("sourceAgentId"));
        metadata.put("displayName", source.get("toolName"));
        return metadata;
    }

    private static Map<String, Object> memoryMetadata(LegacyEvent event) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("id", "memory");
        metadata.put("agentId", event.nodeSuffix());
        return metadata;
    }

    @SuppressWarnings("unchecked")
    private static StatusMessage statusMessageOf(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> fields = (Map<String, Object>) map;
            return new StatusMessage(asText(fields.get("message")), asText(fields.get("stack")),
                    asText(fields.get("code")));
        }
        return StatusMessage.of(String.valueOf(value));
    }

    private static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
