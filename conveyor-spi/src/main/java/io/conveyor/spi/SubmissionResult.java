package io.conveyor.spi;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Outcome of handing a run request to the execution backend. Acceptance only means that
 * a run record was created, not that the run finished.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSubmissionResult.class)
@JsonDeserialize(as = ImmutableSubmissionResult.class)
public interface SubmissionResult
{
    @JsonProperty("accepted")
    boolean isAccepted();

    @JsonProperty("run_id")
    Optional<String> getRunId();

    @JsonProperty("message")
    Optional<String> getMessage();

    static SubmissionResult accepted(String runId)
    {
        return ImmutableSubmissionResult.builder()
            .isAccepted(true)
            .runId(runId)
            .build();
    }

    static SubmissionResult rejected(String message)
    {
        return ImmutableSubmissionResult.builder()
            .isAccepted(false)
            .message(message)
            .build();
    }
}
