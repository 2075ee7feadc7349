package io.conveyor.spi;

import com.google.common.base.Optional;

import java.time.Instant;

public interface TriggerFactory
{
    TriggerKind getKind();

    Trigger newTrigger(String value, Optional<Instant> startDate, Optional<Instant> endDate)
        throws InvalidTriggerException;
}
