package io.conveyor.core.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Counts of one reconciliation pass.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableReconcileSummary.class)
@JsonDeserialize(as = ImmutableReconcileSummary.class)
public interface ReconcileSummary
{
    @JsonProperty("created")
    int getCreated();

    @JsonProperty("updated")
    int getUpdated();

    @JsonProperty("deleted")
    int getDeleted();

    // declarations that could not be parsed
    @JsonProperty("skipped")
    int getSkipped();

    // writes that failed and are retried by the next pass
    @JsonProperty("failed")
    int getFailed();

    default int getWrites()
    {
        return getCreated() + getUpdated() + getDeleted();
    }

    default ReconcileSummary plus(ReconcileSummary other)
    {
        return ImmutableReconcileSummary.builder()
            .created(getCreated() + other.getCreated())
            .updated(getUpdated() + other.getUpdated())
            .deleted(getDeleted() + other.getDeleted())
            .skipped(getSkipped() + other.getSkipped())
            .failed(getFailed() + other.getFailed())
            .build();
    }

    static ReconcileSummary of(int created, int updated, int deleted, int skipped, int failed)
    {
        return ImmutableReconcileSummary.builder()
            .created(created)
            .updated(updated)
            .deleted(deleted)
            .skipped(skipped)
            .failed(failed)
            .build();
    }

    static ReconcileSummary empty()
    {
        return of(0, 0, 0, 0, 0);
    }
}
