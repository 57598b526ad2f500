package com.lineage.core.persistence.migration;

/**
 * Closed set of legacy event shapes that need dedicated handling.
 */
public enum LegacyEventKind {
    AGENT_START,
    AGENT_FINISHED,
    TOOL_WORKING,
    MEMORY_SAVE_MESSAGE,
    MEMORY_GET_MESSAGES,
    OTHER;

    public static LegacyEventKind classify(LegacyEvent event) {
        String type = event.type() == null ? "" : event.type();
        String name = event.name() == null ? "" : event.name();
        return switch (type) {
            case "agent" -> switch (name) {
                case "start", "agent:start" -> AGENT_START;
                case "finished" -> AGENT_FINISHED;
                default -> OTHER;
            };
            case "tool" -> "tool_working".equals(name) ? TOOL_WORKING : OTHER;
            case "memory" -> switch (name) {
                case "saveMessage", "memory:saveMessage" -> MEMORY_SAVE_MESSAGE;
                case "getMessages", "memory:getMessages" -> MEMORY_GET_MESSAGES;
                default -> OTHER;
            };
            default -> OTHER;
        };
    }
}
