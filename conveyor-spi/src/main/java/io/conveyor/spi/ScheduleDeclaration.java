package io.conveyor.spi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A recurring schedule declared in a pipeline manifest.
 *
 * A declaration without id is the pipeline's top-level schedule and targets the default
 * run configuration. A declaration with an id targets the run configuration of that name.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableScheduleDeclaration.class)
@JsonDeserialize(as = ImmutableScheduleDeclaration.class)
public interface ScheduleDeclaration
{
    @JsonProperty("id")
    Optional<String> getId();

    @JsonProperty("cron")
    Optional<String> getCron();

    @JsonProperty("interval_seconds")
    Optional<String> getIntervalSeconds();

    @JsonProperty("start")
    Optional<String> getStart();

    @JsonProperty("end")
    Optional<String> getEnd();

    @JsonProperty("enabled")
    @Value.Default
    default boolean isEnabled()
    {
        return true;
    }

    static ImmutableScheduleDeclaration.Builder builder()
    {
        return ImmutableScheduleDeclaration.builder();
    }
}
