package io.conveyor.spi;

/**
 * Thrown when a trigger value or its validity window cannot be parsed.
 */
public class InvalidTriggerException
        extends Exception
{
    public InvalidTriggerException(String message)
    {
        super(message);
    }

    public InvalidTriggerException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
