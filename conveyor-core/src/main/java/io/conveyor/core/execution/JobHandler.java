package io.conveyor.core.execution;

import io.conveyor.core.schedule.JobFiring;

/**
 * Executes one kind of scheduled job.
 */
public interface JobHandler
{
    /**
     * @return true if the job was submitted, false if it was skipped
     */
    boolean handle(JobFiring firing)
        throws ExecutionSubmissionFailedException;
}
