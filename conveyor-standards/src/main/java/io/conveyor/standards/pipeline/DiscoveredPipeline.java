package io.conveyor.standards.pipeline;

import java.nio.file.Path;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.RestartDeclaration;
import io.conveyor.spi.ScheduleDeclaration;
import org.immutables.value.Value;

@Value.Immutable
public abstract class DiscoveredPipeline
        implements Pipeline
{
    @Override
    public abstract String getName();

    public abstract Path getPath();

    @Override
    public abstract boolean isEnabled();

    @Override
    public abstract List<ScheduleDeclaration> getSchedules();

    @Override
    public abstract Optional<RestartDeclaration> getRestartDeclaration();

    @Override
    public abstract Optional<String> getRunOnceAt();

    public static DiscoveredPipeline of(String name, Path path, PipelineManifest manifest)
    {
        ImmutableList.Builder<ScheduleDeclaration> schedules = ImmutableList.builder();

        Optional<String> cron = nonBlank(manifest.getScheduleCron());
        Optional<String> interval = nonBlank(manifest.getScheduleIntervalSeconds());
        if (cron.isPresent() || interval.isPresent()) {
            schedules.add(ScheduleDeclaration.builder()
                    .cron(cron)
                    .intervalSeconds(cron.isPresent() ? Optional.<String>absent() : interval)
                    .start(nonBlank(manifest.getScheduleStart()))
                    .end(nonBlank(manifest.getScheduleEnd()))
                    .build());
        }
        for (ScheduleDeclaration entry : manifest.getSchedules()) {
            schedules.add(ScheduleDeclaration.builder()
                    .id(nonBlank(entry.getId()))
                    .cron(nonBlank(entry.getCron()))
                    .intervalSeconds(nonBlank(entry.getIntervalSeconds()))
                    .start(nonBlank(entry.getStart()))
                    .end(nonBlank(entry.getEnd()))
                    .isEnabled(entry.isEnabled())
                    .build());
        }

        Optional<String> restart = nonBlank(manifest.getRestartInterval());

        return ImmutableDiscoveredPipeline.builder()
            .name(name)
            .path(path)
            .isEnabled(manifest.isEnabled())
            .schedules(schedules.build())
            .restartDeclaration(restart.transform(RestartDeclaration::of))
            .runOnceAt(nonBlank(manifest.getRunOnceAt()))
            .build();
    }

    private static Optional<String> nonBlank(Optional<String> value)
    {
        if (value.isPresent() && !value.get().trim().isEmpty()) {
            return Optional.of(value.get().trim());
        }
        return Optional.absent();
    }
}
