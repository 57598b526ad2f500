package com.lineage.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One step inside an {@link ExecutionEntry}.
 * <p>
 * Events are immutable once written. A start/success or start/error pair is
 * linked through {@link #parentEventId()} of the completing event.
 *
 * @param id            unique event id
 * @param type          event kind, see {@link EventType}
 * @param name          namespaced event name, e.g. "agent:start" or "tool:success"
 * @param startTime     when the step began
 * @param endTime       when the step finished, null while running
 * @param status        "running", "completed", "error" or "idle"
 * @param statusMessage optional status detail
 * @param level         severity, INFO unless stated otherwise
 * @param version       producer version, optional
 * @param parentEventId id of the event this one completes, optional
 * @param tags          free-form tags, optional
 * @param input         step input, any JSON value
 * @param output        step output, any JSON value
 * @param error         error payload, any JSON value
 * @param metadata      open metadata map (displayName, id, agentId, ...)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineEvent(
    String id,
    String type,
    String name,
    Instant startTime,
    Instant endTime,
    String status,
    StatusMessage statusMessage,
    EventLevel level,
    String version,
    String parentEventId,
    List<String> tags,
    Object input,
    Object output,
    Object error,
    Map<String, Object> metadata
) {
    public TimelineEvent {
        level = level == null ? EventLevel.INFO : level;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id).type(type).name(name)
                .startTime(startTime).endTime(endTime)
                .status(status).statusMessage(statusMessage).level(level)
                .version(version).parentEventId(parentEventId).tags(tags)
                .input(input).output(output).error(error)
                .metadata(metadata);
    }

    public static final class Builder {
        private String id;
        private String type;
        private String name;
        private Instant startTime;
        private Instant endTime;
        private String status;
        private StatusMessage statusMessage;
        private EventLevel level = EventLevel.INFO;
        private String version;
        private String parentEventId;
        private List<String> tags;
        private Object input;
        private Object output;
        private Object error;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder type(EventType type) { this.type = type.value(); return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }
        public Builder status(String status) { this.status = status; return this; }
        public Builder status(AgentStatus status) { this.status = status.value(); return this; }
        public Builder statusMessage(StatusMessage statusMessage) { this.statusMessage = statusMessage; return this; }
        public Builder level(EventLevel level) { this.level = level; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder parentEventId(String parentEventId) { this.parentEventId = parentEventId; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder input(Object input) { this.input = input; return this; }
        public Builder output(Object output) { this.output = output; return this; }
        public Builder error(Object error) { this.error = error; return this; }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public TimelineEvent build() {
            return new TimelineEvent(
                    id != null ? id : UUID.randomUUID().toString(),
                    type, name,
                    startTime != null ? startTime : Instant.now(),
                    endTime, status, statusMessage, level, version, parentEventId,
                    tags, input, output, error, metadata);
        }
    }
}
