package io.helmttl.services;

import io.helmttl.exceptions.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts user supplied TTL expressions to absolute times, and absolute times to CronJob schedules and back.
 * <p>
 * A CronJob schedule has no year field, so a TTL can never be more than {@link #MAX_TTL} in the future.
 */
abstract public class ScheduleService {
    public static final Duration MAX_TTL = Duration.ofDays(330);

    private static final BigDecimal MAX_TTL_NANOS = BigDecimal.valueOf(MAX_TTL.toNanos());

    private static final Pattern DURATION = Pattern.compile("^([+-])?((?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|s|m|h))+)$");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Pattern DAYS = Pattern.compile("^([+-]?\\d+)d$");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    /**
     * Parses a TTL expression relative to {@code now}. Formats are tried in order, the first one matching wins:
     * <ol>
     *     <li>a duration with h / m / s units: {@code 30m}, {@code 2h30m}, {@code 168h}</li>
     *     <li>a number of days: {@code 7d}</li>
     *     <li>a human duration: {@code 3 days}, {@code 2 weeks}, {@code 1 day 6 hours}</li>
     *     <li>a natural language expression: {@code tomorrow}, {@code next monday}, {@code in 2 hours}</li>
     * </ol>
     *
     * @throws ValidationException with {@link ValidationException.Reason#INVALID_DURATION} when nothing matches,
     *                             the offset is not positive or the result is beyond {@link #MAX_TTL}
     */
    public static ZonedDateTime parseTimeInput(String input, ZonedDateTime now) {
        if (input == null || input.isBlank()) {
            throw invalidDuration("duration must not be empty");
        }

        String value = input.trim();

        Optional<Duration> duration = parseDuration(value);
        if (duration.isPresent()) {
            return checkedOffset(now, duration.get());
        }

        Matcher days = DAYS.matcher(value);
        if (days.matches()) {
            Duration offset;
            try {
                offset = Duration.ofDays(Long.parseLong(days.group(1)));
            } catch (NumberFormatException | ArithmeticException e) {
                throw outOfRange(days.group(1).startsWith("-"), value);
            }

            return checkedOffset(now, offset);
        }

        Optional<ZonedDateTime> human;
        Optional<ZonedDateTime> natural;
        try {
            human = HumanTimeParser.parseRelative(value, now);
            natural = human.isPresent() ? Optional.empty() : HumanTimeParser.parseNatural(value, now);
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            // amounts are unsigned here, only a too large one can overflow
            throw invalidDuration(exceedsMaximum());
        }

        if (human.isPresent()) {
            return checkedTarget(now, human.get());
        }

        if (natural.isPresent()) {
            return checkedTarget(now, natural.get());
        }

        throw invalidDuration(
            "unable to parse duration '" + value + "'; supported formats: 30m, 2h, 7d, '3 days', 'tomorrow', 'next monday', 'in 2 hours'"
        );
    }

    /**
     * @return the minute, hour, day of month and month of {@code time} as a cron expression, weekday wildcarded
     */
    public static String timeToSchedule(ZonedDateTime time) {
        return String.format("%d %d %d %d *", time.getMinute(), time.getHour(), time.getDayOfMonth(), time.getMonthValue());
    }

    /**
     * Decodes a schedule produced by {@link #timeToSchedule(ZonedDateTime)} to its next occurrence at or after
     * {@code now}, in the zone of {@code now}.
     *
     * @throws ValidationException with {@link ValidationException.Reason#INVALID_SCHEDULE}
     */
    public static ZonedDateTime parseSchedule(String schedule, ZonedDateTime now) {
        if (schedule == null) {
            throw invalidSchedule(null, "schedule is empty");
        }

        String[] fields = schedule.trim().split("\\s+");
        if (fields.length != 5) {
            throw invalidSchedule(schedule, "expected 5 fields, got " + fields.length);
        }

        int minute = scheduleField(schedule, fields[0], "minute", 0, 59);
        int hour = scheduleField(schedule, fields[1], "hour", 0, 23);
        int day = scheduleField(schedule, fields[2], "day of month", 1, 31);
        int month = scheduleField(schedule, fields[3], "month", 1, 12);

        ZonedDateTime startOfMinute = now.withSecond(0).withNano(0);

        // a 29th of February may need a few years to happen again
        for (int year = now.getYear(); year <= now.getYear() + 8; year++) {
            try {
                ZonedDateTime candidate = LocalDateTime.of(year, month, day, hour, minute).atZone(now.getZone());
                if (!candidate.isBefore(startOfMinute)) {
                    return candidate;
                }
            } catch (DateTimeException e) {
                if (day <= 28) {
                    throw invalidSchedule(schedule, e.getMessage());
                }
            }
        }

        throw invalidSchedule(schedule, "day " + day + " never occurs in month " + month);
    }

    public static String formatScheduledDate(ZonedDateTime time) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time);
    }

    static Optional<Duration> parseDuration(String value) {
        Matcher matcher = DURATION.matcher(value);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        BigDecimal nanos = BigDecimal.ZERO;
        Matcher part = DURATION_PART.matcher(matcher.group(2));
        while (part.find()) {
            nanos = nanos.add(new BigDecimal(part.group(1)).multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(part.group(2)))));
        }

        boolean negative = "-".equals(matcher.group(1));
        if (nanos.compareTo(MAX_TTL_NANOS) > 0) {
            throw outOfRange(negative, value);
        }

        Duration duration = Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        return Optional.of(negative ? duration.negated() : duration);
    }

    private static ValidationException outOfRange(boolean negative, String value) {
        if (negative) {
            return invalidDuration("duration must be positive, got " + value);
        }

        return invalidDuration(exceedsMaximum());
    }

    private static ZonedDateTime checkedOffset(ZonedDateTime now, Duration offset) {
        if (offset.isNegative() || offset.isZero()) {
            throw invalidDuration("duration must be positive, got " + offset);
        }

        if (offset.compareTo(MAX_TTL) > 0) {
            throw invalidDuration(exceedsMaximum());
        }

        return now.plus(offset);
    }

    private static ZonedDateTime checkedTarget(ZonedDateTime now, ZonedDateTime target) {
        if (!target.isAfter(now)) {
            throw invalidDuration("duration must be positive, '" + formatScheduledDate(target) + "' is not in the future");
        }

        if (target.isAfter(now.plus(MAX_TTL))) {
            throw invalidDuration(exceedsMaximum());
        }

        return target;
    }

    private static String exceedsMaximum() {
        return "TTL exceeds the maximum of " + MAX_TTL.toDays() + " days (cron schedules have no year field)";
    }

    private static int scheduleField(String schedule, String field, String name, int min, int max) {
        int value;
        try {
            value = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw invalidSchedule(schedule, name + " '" + field + "' is not a number");
        }

        if (value < min || value > max) {
            throw invalidSchedule(schedule, name + " " + value + " is out of range [" + min + "-" + max + "]");
        }

        return value;
    }

    private static ValidationException invalidDuration(String message) {
        return new ValidationException(ValidationException.Reason.INVALID_DURATION, message);
    }

    private static ValidationException invalidSchedule(String schedule, String message) {
        return new ValidationException(
            ValidationException.Reason.INVALID_SCHEDULE,
            "invalid cron schedule '" + schedule + "': " + message
        );
    }
}
