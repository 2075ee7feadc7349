package io.conveyor.standards.trigger;

import java.time.Instant;
import java.util.TimeZone;
import java.util.regex.Pattern;

import com.google.common.base.Optional;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Trigger;
import io.conveyor.spi.TriggerFactory;
import io.conveyor.spi.TriggerKind;
import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.SchedulingPattern;

public class CronTriggerFactory
        implements TriggerFactory
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    // every combination of month, day of month and day of week occurs within 28 years
    private static final long CYCLE_START = Instant.parse("2000-01-01T00:00:00Z").toEpochMilli();
    private static final long DAYS_PER_CYCLE = 28 * 366;
    private static final long MINUTES_PER_DAY = 24 * 60;

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.CRON;
    }

    @Override
    public Trigger newTrigger(String value, Optional<Instant> startDate, Optional<Instant> endDate)
        throws InvalidTriggerException
    {
        String expression = value.trim();
        int fields = expression.isEmpty() ? 0 : WHITESPACE.split(expression).length;
        if (fields != 5) {
            throw new InvalidTriggerException("Cron expression must have 5 fields but has " + fields + ": '" + value + "'");
        }
        if (!SchedulingPattern.validate(expression)) {
            throw new InvalidTriggerException("Invalid cron expression: '" + value + "'");
        }
        try {
            String[] split = WHITESPACE.split(expression);
            if (!hasMatchingTime(split)) {
                throw new InvalidTriggerException("Cron expression never matches: '" + value + "'");
            }
            return new CronTrigger(expression, startDate, endDate);
        }
        catch (InvalidPatternException ex) {
            throw new InvalidTriggerException("Invalid cron expression: '" + value + "'", ex);
        }
    }

    // cron4j's Predictor doesn't terminate on patterns such as "0 0 30 2 *"
    private static boolean hasMatchingTime(String[] fields)
    {
        SchedulingPattern timeOfDay = new SchedulingPattern(fields[0] + " " + fields[1] + " * * *");
        SchedulingPattern day = new SchedulingPattern("0 0 " + fields[2] + " " + fields[3] + " " + fields[4]);

        boolean anyTime = false;
        for (long minute = 0; minute < MINUTES_PER_DAY && !anyTime; minute++) {
            anyTime = timeOfDay.match(UTC, CYCLE_START + minute * 60_000L);
        }
        if (!anyTime) {
            return false;
        }
        for (long d = 0; d < DAYS_PER_CYCLE; d++) {
            if (day.match(UTC, CYCLE_START + d * 86_400_000L)) {
                return true;
            }
        }
        return false;
    }
}
