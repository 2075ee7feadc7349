package io.conveyor.spi;

import com.google.common.base.Optional;

import java.util.List;

/**
 * A pipeline discovered by a {@link PipelineResolver}, with the schedules its manifest declares.
 */
public interface Pipeline
{
    String getName();

    boolean isEnabled();

    List<ScheduleDeclaration> getSchedules();

    Optional<RestartDeclaration> getRestartDeclaration();

    Optional<String> getRunOnceAt();

    default boolean hasSchedules()
    {
        return !getSchedules().isEmpty() || getRestartDeclaration().isPresent() || getRunOnceAt().isPresent();
    }
}
