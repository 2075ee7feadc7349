package io.conveyor.spi;

import com.google.common.base.Optional;

import java.time.Instant;

/**
 * A parsed scheduling rule with an optional, inclusive validity window.
 *
 * Triggers hold no state beyond their definition. Every instance can be rebuilt
 * from the stored kind, value and window at any time.
 */
public interface Trigger
{
    TriggerKind getKind();

    Optional<Instant> getStartDate();

    Optional<Instant> getEndDate();

    // first fire time that is same or after currentTime.
    // absent if the trigger never fires again within the window.
    Optional<Instant> getFirstFireTime(Instant currentTime);

    // first fire time that is strictly after lastFireTime.
    Optional<Instant> nextFireTime(Instant lastFireTime);
}
