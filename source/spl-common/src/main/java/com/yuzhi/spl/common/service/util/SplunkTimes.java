package com.yuzhi.spl.common.service.util;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * Time conversions between Java instants and Splunk's REST representation.
 */
public final class SplunkTimes {

    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS]xx"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]xxx")
    );

    /**
     * {@code [+-N unit][@snap[weekday]][+-N unit]}, e.g. {@code -24h}, {@code -1d@d}, {@code @w1+8h}.
     */
    private static final Pattern RELATIVE = Pattern.compile(
        "^(?:([+-])(\\d*)([a-z]+))?(?:@([a-z]+)(\\d)?)?(?:([+-])(\\d*)([a-z]+))?$"
    );

    private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
        Map.entry("s", ChronoUnit.SECONDS),
        Map.entry("sec", ChronoUnit.SECONDS),
        Map.entry("secs", ChronoUnit.SECONDS),
        Map.entry("second", ChronoUnit.SECONDS),
        Map.entry("seconds", ChronoUnit.SECONDS),
        Map.entry("m", ChronoUnit.MINUTES),
        Map.entry("min", ChronoUnit.MINUTES),
        Map.entry("mins", ChronoUnit.MINUTES),
        Map.entry("minute", ChronoUnit.MINUTES),
        Map.entry("minutes", ChronoUnit.MINUTES),
        Map.entry("h", ChronoUnit.HOURS),
        Map.entry("hr", ChronoUnit.HOURS),
        Map.entry("hrs", ChronoUnit.HOURS),
        Map.entry("hour", ChronoUnit.HOURS),
        Map.entry("hours", ChronoUnit.HOURS),
        Map.entry("d", ChronoUnit.DAYS),
        Map.entry("day", ChronoUnit.DAYS),
        Map.entry("days", ChronoUnit.DAYS),
        Map.entry("w", ChronoUnit.WEEKS),
        Map.entry("week", ChronoUnit.WEEKS),
        Map.entry("weeks", ChronoUnit.WEEKS),
        Map.entry("mon", ChronoUnit.MONTHS),
        Map.entry("month", ChronoUnit.MONTHS),
        Map.entry("months", ChronoUnit.MONTHS),
        Map.entry("y", ChronoUnit.YEARS),
        Map.entry("yr", ChronoUnit.YEARS),
        Map.entry("yrs", ChronoUnit.YEARS),
        Map.entry("year", ChronoUnit.YEARS),
        Map.entry("years", ChronoUnit.YEARS)
    );

    private SplunkTimes() {}

    /**
     * Formats an instant as ISO-8601 UTC with whole seconds, e.g. {@code 2024-05-01T08:00:00Z}.
     */
    public static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    /**
     * Parses an event timestamp. Accepts ISO-8601 instants, ISO offsets with or without a colon and
     * epoch seconds with an optional fraction.
     */
    public static Optional<Instant> parse(String value) {
        String text = StringUtils.trimToNull(value);
        if (text == null) {
            return Optional.empty();
        }
        if (text.matches("\\d+(\\.\\d+)?")) {
            try {
                BigDecimal seconds = new BigDecimal(text);
                return Optional.of(Instant.ofEpochMilli(seconds.movePointRight(3).longValue()));
            } catch (ArithmeticException | NumberFormatException | DateTimeException e) {
                return Optional.empty();
            }
        }
        Optional<Instant> instant = tryParse(text, null);
        if (instant.isPresent()) {
            return instant;
        }
        for (DateTimeFormatter formatter : OFFSET_FORMATS) {
            Optional<Instant> parsed = tryParse(text, formatter);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a Splunk time bound against {@code now}: {@code now}, an absolute timestamp as
     * accepted by {@link #parse(String)}, or a relative modifier with an optional snap. Snapping
     * and calendar arithmetic use UTC. Weeks snap to Sunday unless a weekday digit follows.
     *
     * @return empty when the bound is blank or not understood
     */
    public static Optional<Instant> resolve(String bound, Instant now) {
        String text = StringUtils.trimToNull(bound);
        if (text == null) {
            return Optional.empty();
        }
        Optional<Instant> absolute = parse(text);
        if (absolute.isPresent()) {
            return absolute;
        }
        text = text.toLowerCase(Locale.ROOT);
        if ("now".equals(text)) {
            return Optional.of(now);
        }
        Matcher matcher = RELATIVE.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        ZonedDateTime time = now.atZone(ZoneOffset.UTC);
        try {
            Optional<ZonedDateTime> shifted = shift(time, matcher.group(1), matcher.group(2), matcher.group(3));
            if (shifted.isEmpty()) {
                return Optional.empty();
            }
            time = shifted.get();
            if (matcher.group(4) != null) {
                Optional<ZonedDateTime> snapped = snap(time, matcher.group(4), matcher.group(5));
                if (snapped.isEmpty()) {
                    return Optional.empty();
                }
                time = snapped.get();
            }
            return shift(time, matcher.group(6), matcher.group(7), matcher.group(8)).map(ZonedDateTime::toInstant);
        } catch (ArithmeticException | DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<ZonedDateTime> shift(ZonedDateTime time, String sign, String amount, String unitName) {
        if (sign == null) {
            return Optional.of(time);
        }
        ChronoUnit unit = UNITS.get(unitName);
        if (unit == null) {
            return Optional.empty();
        }
        long count = amount.isEmpty() ? 1 : Long.parseLong(amount);
        return Optional.of("-".equals(sign) ? time.minus(count, unit) : time.plus(count, unit));
    }

    private static Optional<ZonedDateTime> snap(ZonedDateTime time, String unitName, String weekday) {
        ChronoUnit unit = UNITS.get(unitName);
        if (unit == null) {
            return Optional.empty();
        }
        switch (unit) {
            case SECONDS:
            case MINUTES:
            case HOURS:
            case DAYS:
                return Optional.of(time.truncatedTo(unit));
            case WEEKS:
                int target = weekday == null ? 0 : Integer.parseInt(weekday) % 7;
                // getDayOfWeek: Monday=1 .. Sunday=7, Splunk: Sunday=0 .. Saturday=6
                int current = time.getDayOfWeek().getValue() % 7;
                int back = Math.floorMod(current - target, 7);
                return Optional.of(time.truncatedTo(ChronoUnit.DAYS).minusDays(back));
            case MONTHS:
                return Optional.of(time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1));
            case YEARS:
                return Optional.of(time.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Instant> tryParse(String text, DateTimeFormatter formatter) {
        try {
            Instant parsed = formatter == null ? Instant.parse(text) : OffsetDateTime.parse(text, formatter).toInstant();
            return Optional.of(parsed);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
