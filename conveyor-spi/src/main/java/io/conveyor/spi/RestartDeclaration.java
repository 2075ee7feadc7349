package io.conveyor.spi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Periodic restart of a long-running daemon pipeline. The interval is either a
 * five-field cron expression or a number of seconds.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRestartDeclaration.class)
@JsonDeserialize(as = ImmutableRestartDeclaration.class)
public interface RestartDeclaration
{
    @JsonProperty("interval")
    String getInterval();

    static RestartDeclaration of(String interval)
    {
        return ImmutableRestartDeclaration.builder()
            .interval(interval)
            .build();
    }
}
