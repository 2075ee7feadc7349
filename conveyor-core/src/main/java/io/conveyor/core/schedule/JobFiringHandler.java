package io.conveyor.core.schedule;

public interface JobFiringHandler
{
    /**
     * Hands a firing to its execution target.
     *
     * @return true if the firing was submitted, false if it was skipped
     * @throws Exception if the submission failed
     */
    boolean fire(JobFiring firing)
        throws Exception;
}
