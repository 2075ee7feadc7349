package io.conveyor.standards.pipeline;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.conveyor.spi.ScheduleDeclaration;
import org.immutables.value.Value;

/**
 * Scheduling fields of {@code pipeline.json}. Other fields of the file are ignored.
 */
@Value.Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(as = ImmutablePipelineManifest.class)
@JsonDeserialize(as = ImmutablePipelineManifest.class)
public interface PipelineManifest
{
    @JsonProperty("enabled")
    @Value.Default
    default boolean isEnabled()
    {
        return true;
    }

    @JsonProperty("schedule_cron")
    Optional<String> getScheduleCron();

    // a number in most manifests; read as text and validated by the trigger
    @JsonProperty("schedule_interval_seconds")
    Optional<String> getScheduleIntervalSeconds();

    @JsonProperty("schedule_start")
    Optional<String> getScheduleStart();

    @JsonProperty("schedule_end")
    Optional<String> getScheduleEnd();

    @JsonProperty("run_once_at")
    Optional<String> getRunOnceAt();

    @JsonProperty("restart_interval")
    Optional<String> getRestartInterval();

    @JsonProperty("schedules")
    List<ScheduleDeclaration> getSchedules();

    static ImmutablePipelineManifest.Builder builder()
    {
        return ImmutablePipelineManifest.builder();
    }

    static PipelineManifest empty()
    {
        return builder().build();
    }
}
