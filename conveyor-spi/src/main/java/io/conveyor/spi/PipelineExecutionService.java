package io.conveyor.spi;

import com.google.common.base.Optional;

/**
 * Starts pipeline runs. It must be safe to call while the named pipeline is already running.
 */
public interface PipelineExecutionService
{
    SubmissionResult submit(String pipelineName, String triggeredBy, Optional<String> runConfigId)
        throws Exception;
}
