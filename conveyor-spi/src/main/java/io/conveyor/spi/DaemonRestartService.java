package io.conveyor.spi;

public interface DaemonRestartService
{
    SubmissionResult restart(String pipelineName)
        throws Exception;
}
