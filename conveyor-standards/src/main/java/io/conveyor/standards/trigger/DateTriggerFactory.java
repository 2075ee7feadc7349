package io.conveyor.standards.trigger;

import java.time.Instant;

import com.google.common.base.Optional;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Trigger;
import io.conveyor.spi.TriggerFactory;
import io.conveyor.spi.TriggerKind;
import io.conveyor.spi.TriggerTimes;

/**
 * Fires once at an ISO-8601 date-time.
 */
public class DateTriggerFactory
        implements TriggerFactory
{
    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.DATE;
    }

    @Override
    public Trigger newTrigger(String value, Optional<Instant> startDate, Optional<Instant> endDate)
        throws InvalidTriggerException
    {
        return new DateTrigger(TriggerTimes.parseDateTime(value), startDate, endDate);
    }

    static class DateTrigger
            extends BaseTrigger
    {
        private final Instant at;

        DateTrigger(Instant at, Optional<Instant> start, Optional<Instant> end)
        {
            super(start, end);
            this.at = at;
        }

        @Override
        public TriggerKind getKind()
        {
            return TriggerKind.DATE;
        }

        @Override
        public Optional<Instant> nextFireTime(Instant lastFireTime)
        {
            if (!at.isAfter(lastFireTime) || !TriggerTimes.isWithin(at, start, end)) {
                return Optional.absent();
            }
            return Optional.of(at);
        }

        @Override
        public String toString()
        {
            return "DateTrigger{" + at + "}";
        }
    }
}
