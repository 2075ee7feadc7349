package io.conveyor.core.schedule;

import java.time.Instant;
import java.util.UUID;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableScheduledJob.class)
@JsonDeserialize(as = ImmutableScheduledJob.class)
public abstract class ScheduledJob
        extends JobDefinition
{
    public abstract UUID getId();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();
}
