package io.conveyor.core;

/**
 * An exception thrown when a required resource (job, pipeline) does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException
        extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }

    public ResourceNotFoundException(Throwable cause)
    {
        super(cause);
    }
}
