package io.conveyor.core.schedule;

import io.conveyor.core.ResourceNotFoundException;

public class PipelineNotFoundException
        extends ResourceNotFoundException
{
    public PipelineNotFoundException(String pipelineName)
    {
        super("Pipeline not found: " + pipelineName);
    }
}
