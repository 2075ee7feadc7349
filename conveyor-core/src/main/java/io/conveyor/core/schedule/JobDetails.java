package io.conveyor.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJobDetails.class)
@JsonDeserialize(as = ImmutableJobDetails.class)
public interface JobDetails
{
    @JsonProperty("job")
    ScheduledJob getJob();

    // a live registration exists in this process
    @JsonProperty("registered")
    boolean getRegistered();

    @JsonProperty("next_fire_time")
    Optional<Instant> getNextFireTime();

    @JsonProperty("last_fire_time")
    Optional<Instant> getLastFireTime();

    @JsonProperty("fire_count")
    long getFireCount();
}
