package io.sandcron.utils;

import io.sandcron.core.ScheduledTask;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final Instant NOW = Instant.parse("2026-01-01T10:15:30Z");

    @Test
    void cronShouldReturnNextNineOClockStrictlyAfterNow() {
        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("cron", "0 0 9 * * *"), UTC, NOW);

        assertEquals(Optional.of(Instant.parse("2026-01-02T09:00:00Z")), next);
    }

    @Test
    void cronShouldNotReturnNowWhenNowMatches() {
        Instant nine = Instant.parse("2026-01-01T09:00:00Z");

        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("cron", "0 0 9 * * *"), UTC, nine);

        assertEquals(Optional.of(Instant.parse("2026-01-02T09:00:00Z")), next);
    }

    @Test
    void fiveFieldCronShouldBeAccepted() {
        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("cron", "*/5 * * * *"), UTC, NOW);

        assertEquals(Optional.of(Instant.parse("2026-01-01T10:20:00Z")), next);
    }

    @Test
    void numericDayOfWeekShouldFollowStandardCron() {
        // 2026-01-01 is a Thursday; 1 = Monday
        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("cron", "0 9 * * 1"), UTC, NOW);

        assertEquals(Optional.of(Instant.parse("2026-01-05T09:00:00Z")), next);
    }

    @Test
    void cronShouldBeEvaluatedInTheConfiguredZone() {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");

        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("cron", "0 0 9 * * *"), tokyo, NOW);

        // 09:00 JST is 00:00 UTC
        assertEquals(Optional.of(Instant.parse("2026-01-02T00:00:00Z")), next);
    }

    @Test
    void intervalShouldAddExactMillis() {
        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("interval", "3600000"), UTC, NOW);

        assertEquals(Optional.of(NOW.plusMillis(3_600_000)), next);
    }

    @Test
    void invalidIntervalShouldMeanNoFurtherOccurrence() {
        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("interval", "not_a_number"), UTC, NOW));
        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("interval", "-5"), UTC, NOW));
    }

    @Test
    void intervalPastTheLatestStorableDateShouldMeanNoFurtherOccurrence() {
        String huge = String.valueOf(Long.MAX_VALUE);

        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("interval", huge), UTC, NOW));
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.initialRunAt("interval", huge, UTC, NOW));
    }

    @Test
    void intervalEndingExactlyAtTheLatestStorableDateShouldBeKept() {
        long millis = Long.MAX_VALUE - NOW.toEpochMilli();

        assertEquals(Optional.of(ScheduleCalculator.LATEST_STORABLE),
                ScheduleCalculator.nextRunAfter(task("interval", String.valueOf(millis)), UTC, NOW));
    }

    @Test
    void onceShouldNeverRecur() {
        Optional<Instant> next = ScheduleCalculator.nextRunAfter(task("once", "2026-01-01T10:00:00Z"), UTC, NOW);

        assertFalse(next.isPresent());
    }

    @Test
    void invalidCronShouldMeanNoFurtherOccurrence() {
        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("cron", "every morning"), UTC, NOW));
        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("cron", "99 * * * *"), UTC, NOW));
    }

    @Test
    void unknownScheduleTypeShouldMeanNoFurtherOccurrence() {
        assertEquals(Optional.empty(), ScheduleCalculator.nextRunAfter(task("weekly", "monday"), UTC, NOW));
    }

    @Test
    void initialRunAtShouldParseEachKind() {
        assertEquals(Instant.parse("2026-03-01T08:00:00Z"),
                ScheduleCalculator.initialRunAt("once", "2026-03-01T10:00:00+02:00", UTC, NOW));
        assertEquals(NOW.plusMillis(60_000),
                ScheduleCalculator.initialRunAt("interval", "60000", UTC, NOW));
        assertEquals(Instant.parse("2026-01-02T09:00:00Z"),
                ScheduleCalculator.initialRunAt("cron", "0 9 * * *", UTC, NOW));
    }

    @Test
    void initialRunAtShouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.initialRunAt("cron", "bad", UTC, NOW));
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.initialRunAt("interval", "x", UTC, NOW));
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.initialRunAt("once", "tomorrow", UTC, NOW));
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.initialRunAt("daily", "1", UTC, NOW));
    }

    @Test
    void isValidScheduleTypeShouldAcceptOnlyKnownKinds() {
        assertTrue(ScheduleCalculator.isValidScheduleType("cron"));
        assertTrue(ScheduleCalculator.isValidScheduleType("interval"));
        assertTrue(ScheduleCalculator.isValidScheduleType("once"));
        assertFalse(ScheduleCalculator.isValidScheduleType("CRON"));
        assertFalse(ScheduleCalculator.isValidScheduleType(null));
    }

    @Test
    void normalizeCronShouldProduceQuartzSyntax() {
        assertEquals("0 */5 * * * ?", ScheduleCalculator.normalizeCron("*/5 * * * *"));
        assertEquals("0 0 9 ? * 2-6", ScheduleCalculator.normalizeCron("0 9 * * 1-5"));
        assertEquals("0 0 9 ? * 1,7", ScheduleCalculator.normalizeCron("0 9 * * 0,6"));
        assertEquals("0 0 9 ? * MON-FRI", ScheduleCalculator.normalizeCron("0 9 * * MON-FRI"));
        assertEquals("0 0 9 * * ? 2027", ScheduleCalculator.normalizeCron("0 0 9 * * * 2027"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleCalculator.normalizeCron("* * *"));
    }

    private static ScheduledTask task(String type, String value) {
        return new ScheduledTask("t-1", "main", "chat@1", "say hi", type, value,
                null, null, null, "active", NOW, null);
    }
}
