package io.sandcron.utils;

/**
 * Compact duration text for log lines: {@code 500ms}, {@code 30s}, {@code 2m}.
 */
public final class DurationFormat {
    private DurationFormat() {
    }

    public static String format(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        }
        if (millis < 60_000) {
            return (millis / 1000) + "s";
        }
        return (millis / 60_000) + "m";
    }
}
