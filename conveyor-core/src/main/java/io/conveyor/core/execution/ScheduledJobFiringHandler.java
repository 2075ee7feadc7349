package io.conveyor.core.execution;

import com.google.inject.Inject;
import io.conveyor.core.schedule.JobFiring;
import io.conveyor.core.schedule.JobFiringHandler;
import io.conveyor.core.schedule.ScheduledJob;

/**
 * Routes a claimed firing to the handler of its job's source and trigger kind.
 */
public class ScheduledJobFiringHandler
        implements JobFiringHandler
{
    private final JobHandlerRegistry registry;

    @Inject
    public ScheduledJobFiringHandler(JobHandlerRegistry registry)
    {
        this.registry = registry;
    }

    @Override
    public boolean fire(JobFiring firing)
        throws ExecutionSubmissionFailedException
    {
        ScheduledJob job = firing.getJob();
        JobHandler handler = registry.getHandler(job.getSource(), job.getTriggerKind());
        return handler.handle(firing);
    }
}
