package io.prompty.core.engine.builtin;

import io.prompty.core.expr.Values;
import io.prompty.core.spi.TemplateFunction;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Date and time functions. Time values are {@link ZonedDateTime}; arguments may also be other
 * {@code java.time} values, epoch seconds, or strings in one of the common formats below.
 * Patterns use {@link DateTimeFormatter} syntax.
 */
final class DateTimeFunctions {

    static final DateTimeFormatter DEFAULT_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private static final List<DateTimeFormatter> COMMON_FORMATS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.ISO_INSTANT,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.RFC_1123_DATE_TIME,
            pattern("yyyy-MM-dd HH:mm:ss"),
            pattern("yyyy/MM/dd"),
            pattern("MM/dd/yyyy"),
            pattern("dd-MM-yyyy"),
            pattern("MMM d, yyyy"),
            pattern("MMMM d, yyyy"));

    private DateTimeFunctions() {}

    static List<TemplateFunction> all(Clock clock) {
        return List.of(
                TemplateFunction.of("now", 0, 0, args -> ZonedDateTime.now(clock)),
                TemplateFunction.of("formatDate", 1, 2, args -> {
                    DateTimeFormatter format = args.size() > 1 ? pattern(layout(args.get(1))) : DEFAULT_FORMAT;
                    return format.format(toTime(args.get(0), "formatDate"));
                }),
                TemplateFunction.of("parseDate", 1, 2, args -> {
                    String text = Values.toText(args.get(0));
                    if (args.size() > 1) {
                        return parse(text, pattern(layout(args.get(1))));
                    }
                    return parseCommon(text);
                }),
                TemplateFunction.of("addDays", 2, 2, args -> toTime(args.get(0), "addDays").plusDays(amount(args, "addDays"))),
                TemplateFunction.of(
                        "addHours", 2, 2, args -> toTime(args.get(0), "addHours").plusHours(amount(args, "addHours"))),
                TemplateFunction.of(
                        "addMinutes",
                        2,
                        2,
                        args -> toTime(args.get(0), "addMinutes").plusMinutes(amount(args, "addMinutes"))),
                TemplateFunction.of("diffDays", 2, 2, args -> Duration.between(
                                toTime(args.get(0), "diffDays"), toTime(args.get(1), "diffDays"))
                        .toDays()),
                TemplateFunction.of("year", 1, 1, args -> toTime(args.get(0), "year").getYear()),
                TemplateFunction.of("month", 1, 1, args -> toTime(args.get(0), "month").getMonthValue()),
                TemplateFunction.of("day", 1, 1, args -> toTime(args.get(0), "day").getDayOfMonth()),
                TemplateFunction.of("weekday", 1, 1, args -> toTime(args.get(0), "weekday")
                        .getDayOfWeek()
                        .getDisplayName(TextStyle.FULL, Locale.ENGLISH)),
                TemplateFunction.of(
                        "isAfter", 2, 2, args -> toTime(args.get(0), "isAfter").isAfter(toTime(args.get(1), "isAfter"))),
                TemplateFunction.of(
                        "isBefore",
                        2,
                        2,
                        args -> toTime(args.get(0), "isBefore").isBefore(toTime(args.get(1), "isBefore"))));
    }

    static ZonedDateTime toTime(Object value, String function) {
        if (value instanceof ZonedDateTime z) {
            return z;
        }
        if (value instanceof OffsetDateTime o) {
            return o.toZonedDateTime();
        }
        if (value instanceof Instant i) {
            return i.atZone(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime l) {
            return l.atZone(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC);
        }
        if (value instanceof CharSequence s) {
            return parseCommon(s.toString());
        }
        if (Values.isIntegral(value)) {
            return Instant.ofEpochSecond(((Number) value).longValue()).atZone(ZoneOffset.UTC);
        }
        if (value instanceof Number n) {
            long millis = Math.round(n.doubleValue() * 1000);
            return Instant.ofEpochMilli(millis).atZone(ZoneOffset.UTC);
        }
        throw new IllegalArgumentException(function + ": expected time argument, got " + Values.typeName(value));
    }

    static ZonedDateTime parseCommon(String text) {
        String trimmed = text.strip();
        DateTimeParseException last = null;
        for (DateTimeFormatter format : COMMON_FORMATS) {
            try {
                return parse(trimmed, format);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new IllegalArgumentException("invalid time format: " + text, last);
    }

    private static ZonedDateTime parse(String text, DateTimeFormatter format) {
        TemporalAccessor parsed =
                format.parseBest(text.strip(), ZonedDateTime::from, Instant::from, LocalDateTime::from, LocalDate::from);
        if (parsed instanceof ZonedDateTime z) {
            return z;
        }
        if (parsed instanceof Instant i) {
            return i.atZone(ZoneOffset.UTC);
        }
        if (parsed instanceof LocalDateTime l) {
            return l.atZone(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC);
    }

    private static long amount(List<Object> args, String function) {
        Object value = args.get(1);
        if (Values.isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.longValue();
        }
        throw new IllegalArgumentException(function + ": expected integer argument, got " + Values.typeName(value));
    }

    private static String layout(Object value) {
        if (value instanceof CharSequence s && s.length() > 0) {
            return s.toString();
        }
        throw new IllegalArgumentException("expected date format layout string");
    }

    private static DateTimeFormatter pattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    }
}
