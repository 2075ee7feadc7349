package io.conveyor.spi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.time.Instant;

@Value.Immutable
@JsonSerialize(as = ImmutableFailureNotification.class)
@JsonDeserialize(as = ImmutableFailureNotification.class)
public interface FailureNotification
{
    @JsonProperty("timestamp")
    Instant getTimestamp();

    @JsonProperty("pipeline_name")
    String getPipelineName();

    @JsonProperty("message")
    String getMessage();

    static FailureNotification of(Instant timestamp, String pipelineName, String message)
    {
        return ImmutableFailureNotification.builder()
            .timestamp(timestamp)
            .pipelineName(pipelineName)
            .message(message)
            .build();
    }
}
