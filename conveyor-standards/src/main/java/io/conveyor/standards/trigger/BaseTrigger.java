package io.conveyor.standards.trigger;

import com.google.common.base.Optional;
import io.conveyor.spi.Trigger;
import io.conveyor.spi.TriggerKind;

import java.time.Instant;

abstract class BaseTrigger
        implements Trigger
{
    protected final Optional<Instant> start;
    protected final Optional<Instant> end;

    BaseTrigger(Optional<Instant> start, Optional<Instant> end)
    {
        this.start = start;
        this.end = end;
    }

    @Override
    public abstract TriggerKind getKind();

    @Override
    public Optional<Instant> getStartDate()
    {
        return start;
    }

    @Override
    public Optional<Instant> getEndDate()
    {
        return end;
    }

    @Override
    public Optional<Instant> getFirstFireTime(Instant currentTime)
    {
        // the start is inclusive
        return nextFireTime(currentTime.minusNanos(1));
    }

    // the instant to search from, moved up to just before the start of the window
    Instant searchBase(Instant lastFireTime)
    {
        if (start.isPresent() && start.get().isAfter(lastFireTime)) {
            return start.get().minusNanos(1);
        }
        return lastFireTime;
    }

    Optional<Instant> checkEnd(Instant next)
    {
        if (end.isPresent() && next.isAfter(end.get())) {
            return Optional.absent();
        }
        return Optional.of(next);
    }
}
