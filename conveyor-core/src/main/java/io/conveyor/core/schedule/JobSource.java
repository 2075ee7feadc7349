package io.conveyor.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import static java.util.Locale.ENGLISH;

/**
 * Subsystem that owns a scheduled job. Only {@code API} jobs are edited directly;
 * manifest jobs are rewritten by the reconciler.
 */
public enum JobSource
{
    API,
    MANIFEST_SCHEDULE,
    MANIFEST_RESTART;

    @JsonCreator
    public static JobSource of(String name)
    {
        for (JobSource source : values()) {
            if (source.getName().equals(name)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown job source: " + name);
    }

    @JsonValue
    public String getName()
    {
        return name().toLowerCase(ENGLISH);
    }
}
