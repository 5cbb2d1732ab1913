package io.sandcron.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Instruction handed to an {@link io.sandcron.ExecutionRunner}. Serialized as the subprocess input record.
 *
 * @param prompt        prompt text
 * @param sessionId     session / correlation id, nullable
 * @param groupFolder   target group
 * @param chatJid       target conversation
 * @param main          true for primary (interactive) origin, false for background work
 * @param scheduledTask true when the request originates from the scheduler
 */
public record ExecutionRequest(
        @JsonProperty("prompt") String prompt,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("group_folder") String groupFolder,
        @JsonProperty("chat_jid") String chatJid,
        @JsonProperty("is_main") boolean main,
        @JsonProperty("is_scheduled_task") boolean scheduledTask
) {
    public ExecutionRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(groupFolder, "groupFolder must not be null");
    }

    /**
     * Background request for a scheduled task; the session id is derived from the task id.
     */
    public static ExecutionRequest forScheduledTask(ScheduledTask task) {
        return new ExecutionRequest(
                task.prompt(),
                "scheduled_" + task.id(),
                task.groupFolder(),
                task.chatJid(),
                false,
                true
        );
    }
}
