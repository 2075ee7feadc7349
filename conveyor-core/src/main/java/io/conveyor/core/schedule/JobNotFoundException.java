package io.conveyor.core.schedule;

import java.util.UUID;
import io.conveyor.core.ResourceNotFoundException;

public class JobNotFoundException
        extends ResourceNotFoundException
{
    public JobNotFoundException(UUID jobId)
    {
        super("Scheduled job not found: " + jobId);
    }
}
