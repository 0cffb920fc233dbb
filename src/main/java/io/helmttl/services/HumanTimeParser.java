package io.helmttl.services;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the human friendly TTL expressions: {@code 3 days}, {@code 1 week 2 days}, {@code tomorrow},
 * {@code next friday at 6pm}, {@code in 2 hours}, {@code 30 minutes from now}.
 */
final class HumanTimeParser {
    private static final Pattern AMOUNT = Pattern.compile(
        "(\\d+|an?)\\s*(seconds?|secs?|minutes?|mins?|hours?|hrs?|days?|weeks?|wks?|months?|mos?|years?|yrs?)"
    );
    private static final Pattern SEPARATOR = Pattern.compile("^(?:\\s|,|and\\b)*");
    private static final Pattern IN = Pattern.compile("^in\\s+(.+)$");
    private static final Pattern FROM_NOW = Pattern.compile("^(.+?)\\s+(?:from now|later)$");
    private static final Pattern NEXT = Pattern.compile("^next\\s+(\\w+)$");
    private static final Pattern AT = Pattern.compile("^(.+?)\\s+at\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?$");

    private HumanTimeParser() {
    }

    /**
     * Parses a sequence of amounts with units, each applied to {@code now} in order.
     */
    static Optional<ZonedDateTime> parseRelative(String input, ZonedDateTime now) {
        String value = input.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return Optional.empty();
        }

        ZonedDateTime result = now;
        int position = 0;
        boolean matched = false;

        while (position < value.length()) {
            Matcher separator = SEPARATOR.matcher(value).region(position, value.length());
            if (separator.lookingAt()) {
                position = separator.end();
            }

            if (position >= value.length()) {
                break;
            }

            Matcher amount = AMOUNT.matcher(value).region(position, value.length());
            if (!amount.lookingAt()) {
                return Optional.empty();
            }

            int end = amount.end();
            if (end < value.length() && Character.isLetter(value.charAt(end))) {
                return Optional.empty();
            }

            long count = amount.group(1).startsWith("a") ? 1 : Long.parseLong(amount.group(1));
            result = result.plus(count, unit(amount.group(2)));
            position = end;
            matched = true;
        }

        return matched ? Optional.of(result) : Optional.empty();
    }

    static Optional<ZonedDateTime> parseNatural(String input, ZonedDateTime now) {
        String value = input.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");

        Matcher at = AT.matcher(value);
        if (at.matches()) {
            Optional<ZonedDateTime> day = parseDay(at.group(1), now);
            if (day.isEmpty()) {
                return Optional.empty();
            }

            return time(at.group(2), at.group(3), at.group(4))
                .map(time -> day.get().with(time));
        }

        Matcher in = IN.matcher(value);
        if (in.matches()) {
            return parseRelative(in.group(1), now);
        }

        Matcher fromNow = FROM_NOW.matcher(value);
        if (fromNow.matches()) {
            return parseRelative(fromNow.group(1), now);
        }

        return parseDay(value, now);
    }

    private static Optional<ZonedDateTime> parseDay(String value, ZonedDateTime now) {
        switch (value) {
            case "tomorrow":
                return Optional.of(now.plusDays(1));
            case "today":
            case "tonight":
                return Optional.of(now);
            case "day after tomorrow":
                return Optional.of(now.plusDays(2));
            default:
                break;
        }

        Matcher next = NEXT.matcher(value);
        if (!next.matches()) {
            return Optional.empty();
        }

        String what = next.group(1);
        switch (what) {
            case "week":
                return Optional.of(now.plusWeeks(1));
            case "month":
                return Optional.of(now.plusMonths(1));
            case "year":
                return Optional.of(now.plusYears(1));
            default:
                return dayOfWeek(what).map(day -> now.with(TemporalAdjusters.next(day)));
        }
    }

    private static Optional<DayOfWeek> dayOfWeek(String value) {
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name().toLowerCase(Locale.ROOT);
            if (name.equals(value) || name.substring(0, 3).equals(value)) {
                return Optional.of(day);
            }
        }

        return Optional.empty();
    }

    private static Optional<LocalTime> time(String hours, String minutes, String meridiem) {
        int hour = Integer.parseInt(hours);
        int minute = minutes == null ? 0 : Integer.parseInt(minutes);

        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            hour = hour % 12 + ("pm".equals(meridiem) ? 12 : 0);
        }

        if (hour > 23 || minute > 59) {
            return Optional.empty();
        }

        return Optional.of(LocalTime.of(hour, minute));
    }

    private static ChronoUnit unit(String unit) {
        if (unit.startsWith("s")) {
            return ChronoUnit.SECONDS;
        }
        if (unit.startsWith("mi")) {
            return ChronoUnit.MINUTES;
        }
        if (unit.startsWith("h")) {
            return ChronoUnit.HOURS;
        }
        if (unit.startsWith("d")) {
            return ChronoUnit.DAYS;
        }
        if (unit.startsWith("w")) {
            return ChronoUnit.WEEKS;
        }
        if (unit.startsWith("y")) {
            return ChronoUnit.YEARS;
        }

        return ChronoUnit.MONTHS;
    }
}
