package io.conveyor.core.database.migrate;

import java.util.regex.Pattern;
import java.util.regex.Matcher;
import org.jdbi.v3.core.Handle;

public interface Migration
{
    Pattern MIGRATION_NAME_PATTERN = Pattern.compile("Migration_([0-9]{14})_([A-Za-z0-9]+)");

    default String getVersion()
    {
        Matcher m = MIGRATION_NAME_PATTERN.matcher(getClass().getSimpleName());
        if (!m.matches()) {
            throw new AssertionError("Invalid migration class name: " + getClass().getSimpleName());
        }
        return m.group(1);
    }

    /**
     * If true, this migration runs without a transaction (PostgreSQL's
     * CREATE INDEX CONCURRENTLY). Such a migration must run a single DDL statement.
     */
    default boolean noTransaction(MigrationContext context)
    {
        return false;
    }

    void migrate(Handle handle, MigrationContext context);
}
