package io.conveyor.spi;

/**
 * Best-effort sink for scheduler failures. Implementations never throw.
 */
public interface SchedulerFailureNotifier
{
    void notifySchedulerFailure(String pipelineName, String errorText);
}
