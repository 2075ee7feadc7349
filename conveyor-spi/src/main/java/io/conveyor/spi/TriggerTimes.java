package io.conveyor.spi;

import com.google.common.base.Optional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses date-time values of DATE triggers and the bounds of validity windows. All results are UTC.
 */
public final class TriggerTimes
{
    private TriggerTimes()
    { }

    // end of a day given as a bare date
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d.*)$");

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter
        .ofPattern("uuuu-MM-dd", Locale.ENGLISH)  // strict mode requires 'uuuu'
        .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Parses an ISO-8601 date-time. {@code T} or a single space separates the date and
     * the time. A value without offset or zone is UTC. A bare date is rejected.
     */
    public static Instant parseDateTime(String value)
        throws InvalidTriggerException
    {
        String text = normalize(value);
        if (text.isEmpty()) {
            throw new InvalidTriggerException("Date-time is empty");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        }
        catch (DateTimeParseException ex) {
            throw new InvalidTriggerException("Invalid date-time: '" + value + "'", ex);
        }
    }

    /**
     * Parses the start of a validity window. A bare date becomes the start of that day in UTC.
     */
    public static Optional<Instant> parseStart(Optional<String> value)
        throws InvalidTriggerException
    {
        if (!isPresent(value)) {
            return Optional.absent();
        }
        Optional<LocalDate> date = parseBareDate(value.get());
        if (date.isPresent()) {
            return Optional.of(date.get().atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return Optional.of(parseBound("start", value.get()));
    }

    /**
     * Parses the end of a validity window. A bare date becomes {@code 23:59:59.999999} of that day in UTC.
     */
    public static Optional<Instant> parseEnd(Optional<String> value)
        throws InvalidTriggerException
    {
        if (!isPresent(value)) {
            return Optional.absent();
        }
        Optional<LocalDate> date = parseBareDate(value.get());
        if (date.isPresent()) {
            return Optional.of(date.get().atTime(END_OF_DAY).toInstant(ZoneOffset.UTC));
        }
        return Optional.of(parseBound("end", value.get()));
    }

    public static void validateStartEnd(Optional<Instant> start, Optional<Instant> end)
        throws InvalidTriggerException
    {
        if (start.isPresent() && end.isPresent() && start.get().isAfter(end.get())) {
            throw new InvalidTriggerException(String.format(Locale.ENGLISH,
                        "The end of the window is earlier than its start: start=%s, end=%s", start.get(), end.get()));
        }
    }

    public static boolean isWithin(Instant time, Optional<Instant> start, Optional<Instant> end)
    {
        if (start.isPresent() && time.isBefore(start.get())) {
            return false;
        }
        return !(end.isPresent() && time.isAfter(end.get()));
    }

    private static Instant parseBound(String name, String value)
        throws InvalidTriggerException
    {
        try {
            return parseDateTime(value);
        }
        catch (InvalidTriggerException ex) {
            throw new InvalidTriggerException("Invalid " + name + ": '" + value + "'", ex);
        }
    }

    private static Optional<LocalDate> parseBareDate(String value)
    {
        String text = value.trim();
        if (text.length() != 10) {
            return Optional.absent();
        }
        try {
            return Optional.of(LocalDate.from(DATE_FORMATTER.parse(text)));
        }
        catch (DateTimeParseException ex) {
            return Optional.absent();
        }
    }

    private static boolean isPresent(Optional<String> value)
    {
        return value.isPresent() && !value.get().trim().isEmpty();
    }

    private static String normalize(String value)
    {
        String text = value.trim();
        return SPACE_SEPARATED.matcher(text).replaceFirst("$1T$2");
    }
}
