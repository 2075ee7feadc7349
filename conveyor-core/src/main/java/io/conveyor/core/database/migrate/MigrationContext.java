package io.conveyor.core.database.migrate;

import io.conveyor.core.database.DatabaseConfig;

public class MigrationContext
{
    private final String databaseType;

    public MigrationContext(String databaseType)
    {
        this.databaseType = databaseType;
    }

    public boolean isPostgres()
    {
        return DatabaseConfig.isPostgres(databaseType);
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(databaseType, tableName);
    }
}
