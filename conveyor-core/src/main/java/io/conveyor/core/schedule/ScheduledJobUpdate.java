package io.conveyor.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import io.conveyor.spi.TriggerKind;

/**
 * A partial change of a scheduled job. Absent fields are left unchanged.
 *
 * {@code runConfigId}, {@code startDate} and {@code endDate} are nullable columns, so
 * their setters take an {@code Optional}: {@code Optional.absent()} clears the value
 * while not calling the setter leaves it as is.
 */
public final class ScheduledJobUpdate
{
    private final Optional<String> pipelineName;
    private final Optional<TriggerKind> triggerKind;
    private final Optional<String> triggerValue;
    private final Optional<Boolean> enabled;
    private final Optional<Optional<Instant>> startDate;
    private final Optional<Optional<Instant>> endDate;
    private final Optional<Optional<String>> runConfigId;

    private ScheduledJobUpdate(Builder builder)
    {
        this.pipelineName = builder.pipelineName;
        this.triggerKind = builder.triggerKind;
        this.triggerValue = builder.triggerValue;
        this.enabled = builder.enabled;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.runConfigId = builder.runConfigId;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Optional<String> getPipelineName()
    {
        return pipelineName;
    }

    public Optional<TriggerKind> getTriggerKind()
    {
        return triggerKind;
    }

    public Optional<String> getTriggerValue()
    {
        return triggerValue;
    }

    public Optional<Boolean> getEnabled()
    {
        return enabled;
    }

    public Optional<Optional<Instant>> getStartDate()
    {
        return startDate;
    }

    public Optional<Optional<Instant>> getEndDate()
    {
        return endDate;
    }

    public Optional<Optional<String>> getRunConfigId()
    {
        return runConfigId;
    }

    public boolean isEmpty()
    {
        return !pipelineName.isPresent() && !triggerKind.isPresent() && !triggerValue.isPresent()
            && !enabled.isPresent() && !startDate.isPresent() && !endDate.isPresent()
            && !runConfigId.isPresent();
    }

    /**
     * Returns the definition that results from applying this change to {@code current}.
     */
    public JobDefinition applyTo(JobDefinition current)
    {
        return JobDefinition.definitionBuilder()
            .pipelineName(pipelineName.or(current.getPipelineName()))
            .triggerKind(triggerKind.or(current.getTriggerKind()))
            .triggerValue(triggerValue.or(current.getTriggerValue()))
            .isEnabled(enabled.or(current.isEnabled()))
            .startDate(startDate.or(current.getStartDate()))
            .endDate(endDate.or(current.getEndDate()))
            .source(current.getSource())
            .runConfigId(runConfigId.or(current.getRunConfigId()))
            .build();
    }

    @Override
    public String toString()
    {
        return "ScheduledJobUpdate{pipelineName=" + pipelineName
            + ", triggerKind=" + triggerKind
            + ", triggerValue=" + triggerValue
            + ", enabled=" + enabled
            + ", startDate=" + startDate
            + ", endDate=" + endDate
            + ", runConfigId=" + runConfigId + "}";
    }

    public static class Builder
    {
        private Optional<String> pipelineName = Optional.absent();
        private Optional<TriggerKind> triggerKind = Optional.absent();
        private Optional<String> triggerValue = Optional.absent();
        private Optional<Boolean> enabled = Optional.absent();
        private Optional<Optional<Instant>> startDate = Optional.absent();
        private Optional<Optional<Instant>> endDate = Optional.absent();
        private Optional<Optional<String>> runConfigId = Optional.absent();

        private Builder()
        { }

        public Builder pipelineName(String pipelineName)
        {
            this.pipelineName = Optional.of(pipelineName);
            return this;
        }

        public Builder trigger(TriggerKind kind, String value)
        {
            this.triggerKind = Optional.of(kind);
            this.triggerValue = Optional.of(value);
            return this;
        }

        public Builder triggerKind(TriggerKind triggerKind)
        {
            this.triggerKind = Optional.of(triggerKind);
            return this;
        }

        public Builder triggerValue(String triggerValue)
        {
            this.triggerValue = Optional.of(triggerValue);
            return this;
        }

        public Builder enabled(boolean enabled)
        {
            this.enabled = Optional.of(enabled);
            return this;
        }

        public Builder startDate(Optional<Instant> startDate)
        {
            this.startDate = Optional.of(startDate);
            return this;
        }

        public Builder endDate(Optional<Instant> endDate)
        {
            this.endDate = Optional.of(endDate);
            return this;
        }

        public Builder runConfigId(Optional<String> runConfigId)
        {
            this.runConfigId = Optional.of(runConfigId);
            return this;
        }

        public ScheduledJobUpdate build()
        {
            return new ScheduledJobUpdate(this);
        }
    }
}
