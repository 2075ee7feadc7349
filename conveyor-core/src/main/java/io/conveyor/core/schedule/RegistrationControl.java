package io.conveyor.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;

/**
 * Writes to a registration row locked by {@link ScheduledJobStoreManager#lockDueRegistration}.
 */
public interface RegistrationControl
{
    void recordFiring(Instant firedAt, Optional<Instant> nextFireTime);

    void skipTo(Optional<Instant> nextFireTime);
}
