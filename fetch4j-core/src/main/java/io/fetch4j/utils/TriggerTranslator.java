package io.fetch4j.utils;

import io.fetch4j.core.InvalidScheduleException;
import io.fetch4j.core.RecurrenceSpec;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Turns {@link RecurrenceSpec}s into concrete fire times.
 * <p>
 * Semantics:
 * <ul>
 *   <li>Named cadences (hourly, daily, weekly): next boundary strictly after {@code from}</li>
 *   <li>Custom specs: earliest whole minute at or after {@code from} matching every literal field</li>
 * </ul>
 * <p>
 * Evaluation is delegated to a Quartz {@link CronExpression}. Quartz cannot restrict day-of-month and day-of-week
 * at the same time, so when both are literal the weekday is applied as a filter over the day-of-month matches.
 */
public final class TriggerTranslator {

    // day-of-month matches tried by the weekday filter; covers the 28-year calendar cycle
    private static final int MAX_WEEKDAY_CANDIDATES = 1000;

    private TriggerTranslator() {
    }

    /**
     * Parses {@code recurrence} and computes its next fire time.
     *
     * @throws InvalidScheduleException if the recurrence is malformed or never fires
     */
    public static Instant nextFire(String recurrence, String timezone, Instant from) {
        return nextFire(RecurrenceSpec.parse(recurrence), timezone, from);
    }

    /**
     * Computes the next fire time of {@code spec}.
     *
     * @param spec     parsed recurrence
     * @param timezone IANA time zone id (e.g. "UTC", "Asia/Taipei"); if null or unknown, system default is used
     * @param from     base instant
     * @throws InvalidScheduleException if the spec never fires
     */
    public static Instant nextFire(RecurrenceSpec spec, String timezone, Instant from) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(from, "from must not be null");

        ZoneId zone = resolveZone(timezone);
        CronExpression exp = compile(spec, zone);

        // Quartz searches strictly after the given time, at second resolution.
        Instant after = spec.isNamed() ? from : ceilToMinute(from).minusSeconds(1);
        boolean filterWeekday = spec.dayOfMonth() != null && spec.dayOfWeek() != null;

        for (int tried = 0; tried < MAX_WEEKDAY_CANDIDATES; tried++) {
            Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
            if (nextDate == null) {
                throw new InvalidScheduleException(spec.expression(), "Recurrence produced no next fire time");
            }
            Instant candidate = nextDate.toInstant();
            if (!filterWeekday || weekdayOf(candidate, zone) == spec.dayOfWeek()) {
                return candidate;
            }
            // skip the remainder of the non-matching day
            after = candidate.atZone(zone)
                    .toLocalDate()
                    .plusDays(1)
                    .atStartOfDay(zone)
                    .toInstant()
                    .minusSeconds(1);
        }
        throw new InvalidScheduleException(spec.expression(), "Recurrence never fires");
    }

    /**
     * Next fire time strictly after {@code previous}, for every kind of spec.
     * Used when rescheduling a slot that has just fired.
     */
    public static Instant nextFireAfter(RecurrenceSpec spec, String timezone, Instant previous) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(previous, "previous must not be null");
        if (spec.isNamed()) {
            return nextFire(spec, timezone, previous);
        }
        return nextFire(spec, timezone, previous.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES));
    }

    /**
     * Quartz form of a spec: seconds pinned to 0, cron weekday 0..6 (Sunday first) mapped to Quartz 1..7.
     */
    public static String toQuartzCron(RecurrenceSpec spec) {
        String dom;
        String dow;
        if (spec.dayOfWeek() == null) {
            dom = field(spec.dayOfMonth());
            dow = "?";
        } else if (spec.dayOfMonth() == null) {
            dom = "?";
            dow = String.valueOf(spec.dayOfWeek() + 1);
        } else {
            dom = field(spec.dayOfMonth());
            dow = "?";
        }
        return String.join(" ", "0", field(spec.minute()), field(spec.hour()), dom, field(spec.month()), dow);
    }

    /**
     * Resolves an IANA zone id, falling back to the system default.
     */
    public static ZoneId resolveZone(String timezone) {
        try {
            return ZoneId.of(timezone != null ? timezone : ZoneId.systemDefault().getId());
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }

    /* ================= helper ================= */

    private static CronExpression compile(RecurrenceSpec spec, ZoneId zone) {
        String cron = toQuartzCron(spec);
        if (!CronExpression.isValidExpression(cron)) {
            throw new InvalidScheduleException(spec.expression(), "Invalid cron expression " + cron);
        }
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new InvalidScheduleException(spec.expression(), "Invalid cron expression " + cron);
        }
    }

    private static String field(Integer value) {
        return value == null ? "*" : value.toString();
    }

    private static int weekdayOf(Instant instant, ZoneId zone) {
        DayOfWeek dow = instant.atZone(zone).getDayOfWeek();
        return dow.getValue() % 7;
    }

    private static Instant ceilToMinute(Instant instant) {
        Instant truncated = instant.truncatedTo(ChronoUnit.MINUTES);
        return truncated.equals(instant) ? instant : truncated.plus(1, ChronoUnit.MINUTES);
    }
}
