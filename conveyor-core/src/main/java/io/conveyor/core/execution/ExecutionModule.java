package io.conveyor.core.execution;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.conveyor.core.schedule.JobFiringHandler;

public class ExecutionModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ExecutionConfig.class).toProvider(ExecutionConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(PrimaryRuntime.class).in(Scopes.SINGLETON);
        binder.bind(ExecutionBridge.class).in(Scopes.SINGLETON);
        binder.bind(PipelineRunHandler.class).in(Scopes.SINGLETON);
        binder.bind(DaemonRestartHandler.class).in(Scopes.SINGLETON);
        binder.bind(JobHandlerRegistry.class).in(Scopes.SINGLETON);
        binder.bind(JobFiringHandler.class).to(ScheduledJobFiringHandler.class).in(Scopes.SINGLETON);
    }
}
