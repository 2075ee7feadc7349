package io.conveyor.core.database.migrate;

import io.conveyor.core.database.DatabaseConfig;

import java.util.List;
import java.util.ArrayList;

public class CreateTableBuilder
{
    private final String databaseType;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    CreateTableBuilder(String databaseType, String name)
    {
        this.databaseType = databaseType;
        this.name = name;
    }

    private boolean isPostgres()
    {
        return DatabaseConfig.isPostgres(databaseType);
    }

    public CreateTableBuilder add(String column, String typeAndOptions)
    {
        columns.add(column + " " + typeAndOptions);
        return this;
    }

    public CreateTableBuilder addUuid(String column, String options)
    {
        return add(column, "uuid " + options);
    }

    public CreateTableBuilder addBoolean(String column, String options)
    {
        return add(column, "boolean " + options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return add(column, "bigint " + options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        if (isPostgres()) {
            return add(column, "text " + options);
        }
        else {
            return add(column, "varchar(255) " + options);
        }
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        if (isPostgres()) {
            return add(column, "timestamp with time zone " + options);
        }
        else {
            return add(column, "timestamp " + options);
        }
    }

    public String build()
    {
        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE " + name + " (\n");
        for (int i = 0; i < columns.size(); i++) {
            sb.append("  ");
            sb.append(columns.get(i));
            if (i + 1 < columns.size()) {
                sb.append(",\n");
            }
            else {
                sb.append("\n");
            }
        }
        sb.append(")");
        return sb.toString();
    }
}
