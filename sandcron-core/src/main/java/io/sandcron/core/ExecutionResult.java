package io.sandcron.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Structured result reported by the agent subprocess.
 *
 * @param status       free-form short status, conventionally {@code success} or {@code error}
 * @param result       result text, nullable
 * @param newSessionId continuation session id, nullable
 * @param error        error text, nullable
 */
public record ExecutionResult(
        @JsonProperty("status") String status,
        @JsonProperty("result") String result,
        @JsonProperty("new_session_id") String newSessionId,
        @JsonProperty("error") String error
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static ExecutionResult success(String result) {
        return new ExecutionResult(STATUS_SUCCESS, result, null, null);
    }

    public static ExecutionResult error(String error) {
        return new ExecutionResult(STATUS_ERROR, null, null, error);
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
