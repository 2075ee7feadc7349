package io.conveyor.core.database;

/**
 * Thrown when a storage operation kept failing with transient errors after all retries.
 */
public class StorageFailureException
        extends RuntimeException
{
    public StorageFailureException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
