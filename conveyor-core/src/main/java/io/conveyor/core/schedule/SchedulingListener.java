package io.conveyor.core.schedule;

public interface SchedulingListener
{
    default void onFiringSucceeded(JobFiring firing)
    { }

    default void onFiringFailed(JobFiring firing, Exception error)
    { }
}
