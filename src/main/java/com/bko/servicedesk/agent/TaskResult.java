package com.bko.servicedesk.agent;

import org.springframework.lang.Nullable;

/**
 * Outcome of one agent task. Failures are values, never exceptions.
 */
public record TaskResult(
        AgentTask task,
        boolean success,
        @Nullable TaskPayload payload,
        String text,
        @Nullable ErrorInfo error
) {

    public static TaskResult ok(AgentTask task, TaskPayload payload, String text) {
        return new TaskResult(task, true, payload, text, null);
    }

    public static TaskResult failure(AgentTask task, ErrorKind kind, String message) {
        return failure(task, kind, message, message);
    }

    public static TaskResult failure(AgentTask task, ErrorKind kind, String message, String text) {
        return new TaskResult(task, false, null, text, new ErrorInfo(kind, message, task.operation().name()));
    }

    public <T extends TaskPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException("Expected payload " + type.getSimpleName() + " but was "
                    + (payload == null ? "none" : payload.getClass().getSimpleName()));
        }
        return type.cast(payload);
    }
}
