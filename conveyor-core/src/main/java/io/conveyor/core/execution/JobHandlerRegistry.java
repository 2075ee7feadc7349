package io.conveyor.core.execution;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.conveyor.core.schedule.JobSource;
import io.conveyor.spi.TriggerKind;

import java.util.Locale;
import java.util.Map;

/**
 * Maps the source and trigger kind of a job to the handler that executes it.
 */
public class JobHandlerRegistry
{
    private final Map<JobSource, Map<TriggerKind, JobHandler>> handlers;

    @Inject
    public JobHandlerRegistry(PipelineRunHandler runHandler, DaemonRestartHandler restartHandler)
    {
        this(runHandler, (JobHandler) restartHandler);
    }

    JobHandlerRegistry(JobHandler runHandler, JobHandler restartHandler)
    {
        ImmutableMap.Builder<TriggerKind, JobHandler> runs = ImmutableMap.builder();
        for (TriggerKind kind : TriggerKind.values()) {
            runs.put(kind, runHandler);
        }
        Map<TriggerKind, JobHandler> runHandlers = runs.build();

        this.handlers = ImmutableMap.of(
                JobSource.API, runHandlers,
                JobSource.MANIFEST_SCHEDULE, runHandlers,
                JobSource.MANIFEST_RESTART, ImmutableMap.of(
                    TriggerKind.CRON, restartHandler,
                    TriggerKind.INTERVAL, restartHandler));
    }

    public JobHandler getHandler(JobSource source, TriggerKind kind)
    {
        Map<TriggerKind, JobHandler> bySource = handlers.get(source);
        JobHandler handler = bySource == null ? null : bySource.get(kind);
        if (handler == null) {
            throw new IllegalStateException(String.format(Locale.ENGLISH,
                        "No handler for %s jobs with %s trigger", source.getName(), kind.getName()));
        }
        return handler;
    }
}
