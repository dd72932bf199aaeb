package io.fetch4j.core;

import java.time.Month;
import java.util.Locale;

/**
 * Parsed recurrence declaration.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>Named cadences: {@code hourly}, {@code daily}, {@code weekly}</li>
 *   <li>Custom: {@code cron:minute,hour,day,month,weekday}, each field a number or {@code *}</li>
 * </ul>
 *
 * <p>A {@code null} field means "any value". Weekdays use cron numbering (0 = Sunday, 7 is accepted as Sunday).
 * Named cadences are represented with the equivalent fields, so hourly is {@code (0,*,*,*,*)}.
 */
public record RecurrenceSpec(
        Cadence cadence,
        Integer minute,
        Integer hour,
        Integer dayOfMonth,
        Integer month,
        Integer dayOfWeek
) {

    public enum Cadence {
        HOURLY,
        DAILY,
        WEEKLY,
        CUSTOM
    }

    public static final String CRON_PREFIX = "cron:";

    private static final RecurrenceSpec HOURLY = new RecurrenceSpec(Cadence.HOURLY, 0, null, null, null, null);
    private static final RecurrenceSpec DAILY = new RecurrenceSpec(Cadence.DAILY, 0, 0, null, null, null);
    private static final RecurrenceSpec WEEKLY = new RecurrenceSpec(Cadence.WEEKLY, 0, 0, null, null, 0);

    public static RecurrenceSpec hourly() {
        return HOURLY;
    }

    public static RecurrenceSpec daily() {
        return DAILY;
    }

    public static RecurrenceSpec weekly() {
        return WEEKLY;
    }

    /**
     * Parse a recurrence declaration.
     *
     * @throws InvalidScheduleException if the declaration is unknown or a custom spec is malformed
     */
    public static RecurrenceSpec parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(expression), "recurrence must not be blank");
        }
        String s = expression.trim();

        switch (s.toLowerCase(Locale.ROOT)) {
            case "hourly" -> {
                return HOURLY;
            }
            case "daily" -> {
                return DAILY;
            }
            case "weekly" -> {
                return WEEKLY;
            }
            default -> {
                // fall through to custom
            }
        }

        if (!s.regionMatches(true, 0, CRON_PREFIX, 0, CRON_PREFIX.length())) {
            throw new InvalidScheduleException(expression, "Unsupported recurrence");
        }

        String[] parts = s.substring(CRON_PREFIX.length()).split(",", -1);
        if (parts.length != 5) {
            throw new InvalidScheduleException(expression,
                    "Custom recurrence must have exactly five fields (minute,hour,day,month,weekday), got " + parts.length);
        }

        Integer minute = field(expression, "minute", parts[0], 0, 59);
        Integer hour = field(expression, "hour", parts[1], 0, 23);
        Integer day = field(expression, "day", parts[2], 1, 31);
        Integer month = field(expression, "month", parts[3], 1, 12);
        Integer weekday = field(expression, "weekday", parts[4], 0, 7);
        if (weekday != null && weekday == 7) {
            weekday = 0;
        }

        if (day != null && month != null && day > Month.of(month).maxLength()) {
            throw new InvalidScheduleException(expression, "Day " + day + " never occurs in month " + month);
        }

        return new RecurrenceSpec(Cadence.CUSTOM, minute, hour, day, month, weekday);
    }

    private static Integer field(String expression, String name, String raw, int min, int max) {
        String v = raw.trim();
        if (v.equals("*")) {
            return null;
        }
        if (!v.matches("^\\d{1,2}$")) {
            throw new InvalidScheduleException(expression, "Invalid " + name + " field '" + raw + "'");
        }
        int n = Integer.parseInt(v);
        if (n < min || n > max) {
            throw new InvalidScheduleException(expression,
                    name + " must be between " + min + " and " + max + ", got " + n);
        }
        return n;
    }

    public boolean isNamed() {
        return cadence != Cadence.CUSTOM;
    }

    /**
     * Canonical declaration, accepted by {@link #parse(String)}.
     */
    public String expression() {
        return switch (cadence) {
            case HOURLY -> "hourly";
            case DAILY -> "daily";
            case WEEKLY -> "weekly";
            case CUSTOM -> CRON_PREFIX + String.join(",",
                    text(minute), text(hour), text(dayOfMonth), text(month), text(dayOfWeek));
        };
    }

    private static String text(Integer value) {
        return value == null ? "*" : value.toString();
    }

    @Override
    public String toString() {
        return expression();
    }
}
