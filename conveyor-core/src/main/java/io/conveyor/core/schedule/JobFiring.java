package io.conveyor.core.schedule;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * A due instant of a job claimed by the scheduling engine.
 */
@Value.Immutable
public abstract class JobFiring
{
    public abstract ScheduledJob getJob();

    public abstract Instant getScheduledTime();

    public abstract Instant getFiredAt();

    // when the engine that claimed this firing was started
    public abstract Instant getEngineStartedAt();

    public static JobFiring of(ScheduledJob job, Instant scheduledTime, Instant firedAt, Instant engineStartedAt)
    {
        return ImmutableJobFiring.builder()
            .job(job)
            .scheduledTime(scheduledTime)
            .firedAt(firedAt)
            .engineStartedAt(engineStartedAt)
            .build();
    }
}
