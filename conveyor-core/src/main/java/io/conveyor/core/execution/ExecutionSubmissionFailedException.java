package io.conveyor.core.execution;

/**
 * A firing could not be handed to the execution backend: it timed out, threw, or was rejected.
 */
public class ExecutionSubmissionFailedException
        extends Exception
{
    public ExecutionSubmissionFailedException(String message)
    {
        super(message);
    }

    public ExecutionSubmissionFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
