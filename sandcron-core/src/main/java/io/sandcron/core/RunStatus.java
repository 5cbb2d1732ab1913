package io.sandcron.core;

/**
 * Outcome recorded in a {@link TaskRunLog}.
 */
public enum RunStatus {
    SUCCESS("success"),
    ERROR("error"),
    TIMEOUT("timeout");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RunStatus fromValue(String value) {
        for (RunStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
