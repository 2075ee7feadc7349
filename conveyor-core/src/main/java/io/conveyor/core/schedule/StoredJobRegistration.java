package io.conveyor.core.schedule;

import java.time.Instant;
import java.util.UUID;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Durable state of a live registration. {@code nextFireTime} is absent once the trigger has no further firing.
 */
@Value.Immutable
public abstract class StoredJobRegistration
{
    public abstract UUID getJobId();

    public abstract Optional<Instant> getNextFireTime();

    public abstract Optional<Instant> getLastFireTime();

    public abstract long getFireCount();

    public abstract Instant getUpdatedAt();
}
