package io.conveyor.core.schedule;

import com.google.inject.Inject;

import java.time.Duration;
import java.time.Instant;

/**
 * Due instants that come within {@code scheduler.startup_grace_period} seconds after the
 * engine started are left to other running processes. The engine checks it before claiming.
 */
public class StartupGraceGuard
{
    private final Duration gracePeriod;

    @Inject
    public StartupGraceGuard(ScheduleConfig config)
    {
        this(Duration.ofSeconds(config.getStartupGracePeriod()));
    }

    public StartupGraceGuard(Duration gracePeriod)
    {
        this.gracePeriod = gracePeriod;
    }

    public Duration getGracePeriod()
    {
        return gracePeriod;
    }

    public boolean isSuppressed(Instant startedAt, Instant now)
    {
        return now.isBefore(startedAt.plus(gracePeriod));
    }
}
