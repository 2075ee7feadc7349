package io.conveyor.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.conveyor.spi.TriggerKind;
import org.immutables.value.Value;

/**
 * Fields of a scheduled job that callers write. {@link ScheduledJob} adds the ones the store assigns.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobDefinition.class)
@JsonDeserialize(as = ImmutableJobDefinition.class)
public abstract class JobDefinition
{
    public abstract String getPipelineName();

    public abstract TriggerKind getTriggerKind();

    public abstract String getTriggerValue();

    public abstract boolean isEnabled();

    public abstract Optional<Instant> getStartDate();

    public abstract Optional<Instant> getEndDate();

    public abstract JobSource getSource();

    public abstract Optional<String> getRunConfigId();

    public static ImmutableJobDefinition.Builder definitionBuilder()
    {
        return ImmutableJobDefinition.builder();
    }

    public static JobDefinition copyOf(JobDefinition job)
    {
        return definitionBuilder()
            .pipelineName(job.getPipelineName())
            .triggerKind(job.getTriggerKind())
            .triggerValue(job.getTriggerValue())
            .isEnabled(job.isEnabled())
            .startDate(job.getStartDate())
            .endDate(job.getEndDate())
            .source(job.getSource())
            .runConfigId(job.getRunConfigId())
            .build();
    }
}
