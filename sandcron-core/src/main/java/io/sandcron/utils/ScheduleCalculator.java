package io.sandcron.utils;

import io.sandcron.core.ScheduleKind;
import io.sandcron.core.ScheduledTask;
import org.quartz.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Computes when a task is due next.
 * <p>
 * Supported schedule kinds:
 * <ul>
 *   <li>{@code cron}: 5-field, 6-field (with seconds) or 7-field (with year) cron expression,
 *       evaluated with Quartz in the configured zone</li>
 *   <li>{@code interval}: non-negative number of milliseconds, counted from {@code now}</li>
 *   <li>{@code once}: never recurs</li>
 * </ul>
 * <p>
 * Every method takes the current instant as an argument; nothing here reads a clock.
 */
public final class ScheduleCalculator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCalculator.class);

    // latest instant a java.util.Date (and so a BSON date) can hold
    static final Instant LATEST_STORABLE = Instant.ofEpochMilli(Long.MAX_VALUE);

    private ScheduleCalculator() {
    }

    /**
     * Next due time after a run of {@code task}, or empty for "no further occurrence".
     *
     * <p>Invalid schedule values are logged and yield empty; they never throw.
     *
     * @param task the task that just ran
     * @param zone zone used to interpret cron fields
     * @param now  current instant
     */
    public static Optional<Instant> nextRunAfter(ScheduledTask task, ZoneId zone, Instant now) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Optional<ScheduleKind> kind = task.scheduleKind();
        if (kind.isEmpty()) {
            log.warn("Unknown schedule type taskId={} scheduleType={}", task.id(), task.scheduleType());
            return Optional.empty();
        }

        return switch (kind.get()) {
            case ONCE -> Optional.empty();
            case INTERVAL -> nextIntervalRun(task.id(), task.scheduleValue(), now);
            case CRON -> nextCronRun(task.id(), task.scheduleValue(), zone, now);
        };
    }

    /**
     * First due time of a newly created task. Unlike {@link #nextRunAfter}, invalid values are rejected.
     *
     * @throws IllegalArgumentException if the type is unknown or the value does not parse
     */
    public static Instant initialRunAt(String scheduleType, String scheduleValue, ZoneId zone, Instant now) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(now, "now must not be null");
        ScheduleKind kind = ScheduleKind.fromValue(scheduleType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown schedule type: " + scheduleType));
        if (scheduleValue == null || scheduleValue.isBlank()) {
            throw new IllegalArgumentException("scheduleValue must not be blank");
        }

        return switch (kind) {
            case ONCE -> parseTimestamp(scheduleValue.trim());
            case INTERVAL -> intervalRunAt(now, parseIntervalMillis(scheduleValue));
            case CRON -> {
                Date next = cronExpression(scheduleValue, zone).getNextValidTimeAfter(Date.from(now));
                if (next == null) {
                    throw new IllegalArgumentException("Cron expression produced no next execution time: " + scheduleValue);
                }
                yield next.toInstant();
            }
        };
    }

    public static boolean isValidScheduleType(String scheduleType) {
        return ScheduleKind.fromValue(scheduleType).isPresent();
    }

    /* ================= helper ================= */

    private static Optional<Instant> nextIntervalRun(String taskId, String value, Instant now) {
        try {
            return Optional.of(intervalRunAt(now, parseIntervalMillis(value)));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid interval taskId={} value={} msg={}", taskId, value, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Instant> nextCronRun(String taskId, String value, ZoneId zone, Instant now) {
        CronExpression exp;
        try {
            exp = cronExpression(value, zone);
        } catch (IllegalArgumentException e) {
            log.error("Invalid cron expression taskId={} value='{}' msg={}", taskId, value, e.getMessage());
            return Optional.empty();
        }

        Date next = exp.getNextValidTimeAfter(Date.from(now));
        if (next == null) {
            log.warn("Cron expression has no further occurrence taskId={} value='{}'", taskId, value);
            return Optional.empty();
        }
        return Optional.of(next.toInstant());
    }

    private static Instant intervalRunAt(Instant now, long millis) {
        Instant next;
        try {
            next = now.plusMillis(millis);
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException("interval overflows the time line: " + millis);
        }
        if (next.isAfter(LATEST_STORABLE)) {
            throw new IllegalArgumentException("interval reaches past the latest storable date: " + millis);
        }
        return next;
    }

    static long parseIntervalMillis(String value) {
        if (value == null) {
            throw new IllegalArgumentException("interval must not be null");
        }
        long millis;
        try {
            millis = Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("interval is not a number: " + value);
        }
        if (millis < 0) {
            throw new IllegalArgumentException("interval must not be negative: " + value);
        }
        return millis;
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + value, e);
        }
    }

    private static CronExpression cronExpression(String expression, ZoneId zone) {
        String cron = normalizeCron(expression);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression + " (" + ex.getMessage() + ")", ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));
        return exp;
    }

    /**
     * Normalize a standard cron expression into Quartz syntax:
     * - 5 fields: seconds "0" is prepended.
     * - 6 fields: seconds first.
     * - 7 fields: seconds first, year last.
     * Numeric day-of-week values follow standard cron (0 or 7 = Sunday) and are shifted to Quartz's 1-7.
     */
    public static String normalizeCron(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("expression must not be null");
        }
        String s = expression.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        return switch (parts.length) {
            case 5 -> toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4], null);
            case 6 -> toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], null);
            case 7 -> toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5], parts[6]);
            default -> throw new IllegalArgumentException("Cron expression must have 5, 6 or 7 fields: " + expression);
        };
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month,
                                       String dayOfWeek, String year) {
        String dom = dayOfMonth;
        String dow = toQuartzDayOfWeek(dayOfWeek);

        // Quartz wants exactly one of the two day fields to be '?'
        if (isWildcard(dow)) {
            dow = "?";
            if ("?".equals(dom)) {
                dom = "*";
            }
        } else if (isWildcard(dom)) {
            dom = "?";
        }

        String cron = String.join(" ", sec, min, hour, dom, month, dow);
        return year == null ? cron : cron + " " + year;
    }

    private static boolean isWildcard(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String toQuartzDayOfWeek(String field) {
        if (!field.matches("[0-9*?,/-]+")) {
            // names (MON-FRI), L and # are passed through untouched
            return field;
        }
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            String item = items[i];
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = item.substring(slash);
                item = item.substring(0, slash);
            }
            String converted;
            if (item.isEmpty() || isWildcard(item)) {
                converted = item;
            } else if (item.contains("-")) {
                String[] range = item.split("-", 2);
                converted = shiftDay(range[0]) + "-" + shiftDay(range[1]);
            } else {
                converted = shiftDay(item);
            }
            items[i] = step == null ? converted : converted + step;
        }
        return String.join(",", items);
    }

    private static String shiftDay(String value) {
        int day;
        try {
            day = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid day-of-week: " + value);
        }
        if (day < 0 || day > 7) {
            throw new IllegalArgumentException("Day-of-week out of range: " + value);
        }
        return String.valueOf((day % 7) + 1);
    }
}
