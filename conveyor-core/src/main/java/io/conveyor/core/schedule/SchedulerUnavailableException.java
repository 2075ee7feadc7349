package io.conveyor.core.schedule;

/**
 * Thrown when a live registration is requested while the scheduling engine is stopped.
 * Stored jobs are registered again when the engine starts.
 */
public class SchedulerUnavailableException
        extends IllegalStateException
{
    public SchedulerUnavailableException(String message)
    {
        super(message);
    }
}
