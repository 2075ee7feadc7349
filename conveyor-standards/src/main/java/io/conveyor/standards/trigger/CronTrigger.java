package io.conveyor.standards.trigger;

import java.util.Date;
import java.util.TimeZone;
import java.time.Instant;

import com.google.common.base.Optional;
import io.conveyor.spi.TriggerKind;
import it.sauronsoftware.cron4j.SchedulingPattern;
import it.sauronsoftware.cron4j.Predictor;

/**
 * Fires at every minute matching a 5-field cron expression, evaluated in UTC.
 */
public class CronTrigger
        extends BaseTrigger
{
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final String expression;
    private final SchedulingPattern pattern;

    CronTrigger(String expression, Optional<Instant> start, Optional<Instant> end)
    {
        super(start, end);
        this.expression = expression;
        this.pattern = new SchedulingPattern(expression) {
            // cron4j matches in the default time zone unless the zone is given
            @Override
            public boolean match(long millis)
            {
                return match(UTC, millis);
            }
        };
    }

    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.CRON;
    }

    public String getExpression()
    {
        return expression;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant lastFireTime)
    {
        // Predictor returns the first matching minute after the minute of the given time
        Predictor predictor = new Predictor(pattern, Date.from(searchBase(lastFireTime)));
        predictor.setTimeZone(UTC);
        return checkEnd(Instant.ofEpochMilli(predictor.nextMatchingTime()));
    }

    @Override
    public String toString()
    {
        return "CronTrigger{" + expression + ", start=" + start + ", end=" + end + "}";
    }
}
