package io.conveyor.spi;

import java.util.Locale;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TriggerKind
{
    CRON,
    INTERVAL,
    DATE;

    @JsonCreator
    public static TriggerKind of(String name)
    {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ENGLISH));
        }
        catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown trigger kind: " + name, ex);
        }
    }

    @JsonValue
    public String getName()
    {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
