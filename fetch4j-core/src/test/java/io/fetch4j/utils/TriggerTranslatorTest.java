package io.fetch4j.utils;

import io.fetch4j.core.InvalidScheduleException;
import io.fetch4j.core.RecurrenceSpec;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TriggerTranslatorTest {

    // 2026-01-01 is a Thursday
    private static final Instant FROM = Instant.parse("2026-01-01T10:15:30Z");

    @Test
    void hourlyShouldFireAtNextTopOfHour() {
        Instant next = TriggerTranslator.nextFire("hourly", "UTC", FROM);
        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), next);
    }

    @Test
    void hourlyShouldBeStrictlyAfterFrom() {
        Instant next = TriggerTranslator.nextFire("hourly", "UTC", Instant.parse("2026-01-01T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T11:00:00Z"), next);
    }

    @Test
    void dailyShouldFireAtNextMidnight() {
        Instant next = TriggerTranslator.nextFire("daily", "UTC", FROM);
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), next);
    }

    @Test
    void dailyShouldRespectTimezone() {
        // 18:15 in Taipei, next local midnight is 16:00 UTC
        Instant next = TriggerTranslator.nextFire("daily", "Asia/Taipei", FROM);
        assertEquals(Instant.parse("2026-01-01T16:00:00Z"), next);
    }

    @Test
    void weeklyShouldFireOnSundayMidnight() {
        Instant next = TriggerTranslator.nextFire("weekly", "UTC", FROM);
        assertEquals(Instant.parse("2026-01-04T00:00:00Z"), next);
        assertEquals(DayOfWeek.SUNDAY, next.atZone(ZoneOffset.UTC).getDayOfWeek());
    }

    @Test
    void weekdayOnlySpecShouldOnlyYieldThatWeekday() {
        Instant cursor = FROM;
        for (int i = 0; i < 5; i++) {
            Instant next = TriggerTranslator.nextFireAfter(RecurrenceSpec.parse("cron:30,9,*,*,1"), "UTC", cursor);
            assertEquals(DayOfWeek.MONDAY, next.atZone(ZoneOffset.UTC).getDayOfWeek());
            assertEquals(9, next.atZone(ZoneOffset.UTC).getHour());
            assertEquals(30, next.atZone(ZoneOffset.UTC).getMinute());
            cursor = next;
        }
        assertEquals(Instant.parse("2026-01-05T09:30:00Z"),
                TriggerTranslator.nextFire("cron:30,9,*,*,1", "UTC", FROM));
    }

    @Test
    void customSpecShouldIncludeFromWhenOnTheMinute() {
        Instant from = Instant.parse("2026-01-01T10:00:00Z");
        assertEquals(from, TriggerTranslator.nextFire("cron:0,10,*,*,*", "UTC", from));
    }

    @Test
    void customSpecShouldSkipPartialMinute() {
        Instant next = TriggerTranslator.nextFire("cron:0,10,*,*,*", "UTC", Instant.parse("2026-01-01T10:00:30Z"));
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void nextFireAfterShouldSkipTheSlotThatJustFired() {
        Instant next = TriggerTranslator.nextFireAfter(
                RecurrenceSpec.parse("cron:0,10,*,*,*"),
                "UTC",
                Instant.parse("2026-01-01T10:00:00Z")
        );
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), next);
    }

    @Test
    void dayOfMonthAndWeekdayShouldBothMatch() {
        // first Friday the 13th of 2026
        Instant next = TriggerTranslator.nextFire("cron:0,0,13,*,5", "UTC", FROM);
        assertEquals(Instant.parse("2026-02-13T00:00:00Z"), next);
    }

    @Test
    void leapDayShouldWaitForLeapYear() {
        Instant next = TriggerTranslator.nextFire("cron:0,0,29,2,*", "UTC", FROM);
        assertEquals(Instant.parse("2028-02-29T00:00:00Z"), next);
    }

    @Test
    void wrongFieldCountShouldBeRejected() {
        assertThrows(InvalidScheduleException.class,
                () -> TriggerTranslator.nextFire("cron:1,2,3", "UTC", FROM));
    }

    @Test
    void toQuartzCronShouldMapSundayFirstWeekdays() {
        assertEquals("0 30 9 ? * 2", TriggerTranslator.toQuartzCron(RecurrenceSpec.parse("cron:30,9,*,*,1")));
        assertEquals("0 0 * * * ?", TriggerTranslator.toQuartzCron(RecurrenceSpec.hourly()));
        assertEquals("0 0 0 ? * 1", TriggerTranslator.toQuartzCron(RecurrenceSpec.weekly()));
    }

    @Test
    void unknownTimezoneShouldFallBackToSystemDefault() {
        assertEquals(java.time.ZoneId.systemDefault(), TriggerTranslator.resolveZone("Mars/Olympus"));
    }
}
