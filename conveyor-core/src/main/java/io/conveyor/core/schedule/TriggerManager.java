package io.conveyor.core.schedule;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Trigger;
import io.conveyor.spi.TriggerFactory;
import io.conveyor.spi.TriggerKind;
import io.conveyor.spi.TriggerTimes;

/**
 * Builds triggers from the stored fields of a job using the registered {@link TriggerFactory} of each kind.
 */
public class TriggerManager
{
    private final Map<TriggerKind, TriggerFactory> kinds;

    @Inject
    public TriggerManager(Set<TriggerFactory> factories)
    {
        ImmutableMap.Builder<TriggerKind, TriggerFactory> builder = ImmutableMap.builder();
        for (TriggerFactory factory : factories) {
            builder.put(factory.getKind(), factory);
        }
        this.kinds = builder.build();
    }

    public Trigger getTrigger(JobDefinition job)
        throws InvalidTriggerException
    {
        return getTrigger(job.getTriggerKind(), job.getTriggerValue(), job.getStartDate(), job.getEndDate());
    }

    public Trigger getTrigger(TriggerKind kind, String value, Optional<Instant> startDate, Optional<Instant> endDate)
        throws InvalidTriggerException
    {
        TriggerFactory factory = kinds.get(kind);
        if (factory == null) {
            throw new InvalidTriggerException("Unsupported trigger kind: " + kind.getName());
        }
        TriggerTimes.validateStartEnd(startDate, endDate);
        return factory.newTrigger(value, startDate, endDate);
    }
}
