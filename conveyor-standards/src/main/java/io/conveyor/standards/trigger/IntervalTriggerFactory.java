package io.conveyor.standards.trigger;

import java.time.Instant;

import com.google.common.base.Optional;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Trigger;
import io.conveyor.spi.TriggerFactory;
import io.conveyor.spi.TriggerKind;

/**
 * Fires every N seconds. Fire times are aligned to the start of the window, or to the
 * Unix epoch when there is none, so they are the same before and after a restart.
 */
public class IntervalTriggerFactory
        implements TriggerFactory
{
    @Override
    public TriggerKind getKind()
    {
        return TriggerKind.INTERVAL;
    }

    @Override
    public Trigger newTrigger(String value, Optional<Instant> startDate, Optional<Instant> endDate)
        throws InvalidTriggerException
    {
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        }
        catch (NumberFormatException ex) {
            throw new InvalidTriggerException("Interval must be an integer number of seconds: '" + value + "'", ex);
        }
        if (seconds <= 0) {
            throw new InvalidTriggerException("Interval must be positive: " + seconds);
        }
        long millis;
        try {
            millis = Math.multiplyExact(seconds, 1000L);
        }
        catch (ArithmeticException ex) {
            throw new InvalidTriggerException("Interval is too large: " + seconds, ex);
        }
        return new IntervalTrigger(millis, startDate, endDate);
    }

    static class IntervalTrigger
            extends BaseTrigger
    {
        private final long intervalMillis;
        private final long anchorMillis;

        IntervalTrigger(long intervalMillis, Optional<Instant> start, Optional<Instant> end)
        {
            super(start, end);
            this.intervalMillis = intervalMillis;
            this.anchorMillis = start.isPresent() ? start.get().toEpochMilli() : 0L;
        }

        @Override
        public TriggerKind getKind()
        {
            return TriggerKind.INTERVAL;
        }

        @Override
        public Optional<Instant> nextFireTime(Instant lastFireTime)
        {
            long last = searchBase(lastFireTime).toEpochMilli();
            long next;
            if (last < anchorMillis) {
                next = anchorMillis;
            }
            else {
                try {
                    long steps = Math.floorDiv(last - anchorMillis, intervalMillis) + 1;
                    next = Math.addExact(anchorMillis, Math.multiplyExact(steps, intervalMillis));
                }
                catch (ArithmeticException ex) {
                    // past the last representable instant
                    return Optional.absent();
                }
            }
            return checkEnd(Instant.ofEpochMilli(next));
        }

        @Override
        public String toString()
        {
            return "IntervalTrigger{" + (intervalMillis / 1000) + "s, start=" + start + ", end=" + end + "}";
        }
    }
}
