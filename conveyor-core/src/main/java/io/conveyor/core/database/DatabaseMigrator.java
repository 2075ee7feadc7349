package io.conveyor.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.conveyor.core.database.migrate.Migration;
import io.conveyor.core.database.migrate.MigrationContext;
import io.conveyor.core.database.migrate.Migration_20250301093000_CreateScheduledJobs;
import io.conveyor.core.database.migrate.Migration_20250301093500_CreateJobRegistrations;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.sql.DataSource;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20250301093000_CreateScheduledJobs(),
        new Migration_20250301093500_CreateJobRegistrations(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi jdbi;
    private final String databaseType;

    public DatabaseMigrator(Jdbi jdbi, DatabaseConfig config)
    {
        this(jdbi, config.getType());
    }

    @Inject
    public DatabaseMigrator(DataSource ds, DatabaseConfig config)
    {
        this(DatabaseHelper.createJdbi(ds), config.getType());
    }

    DatabaseMigrator(Jdbi jdbi, String databaseType)
    {
        this.jdbi = jdbi;
        this.databaseType = databaseType;
    }

    public String getSchemaVersion()
    {
        try (Handle handle = jdbi.open()) {
            return handle.createQuery("select name from schema_migrations order by name desc limit 1")
                .mapTo(String.class)
                .first();
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = jdbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            if (context.isPostgres()) {
                logger.info("{} migrations applied.", numApplied);
            }
            else {
                logger.debug("{} migrations applied.", numApplied);
            }
        }
        return numApplied;
    }

    // synchronized so that threads of this process don't apply the same migration twice
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        // a new handle per migration releases pg_advisory_lock on close
        try (Handle handle = jdbi.open()) {
            if (m.noTransaction(context)) {
                if (context.isPostgres()) {
                    handle.execute("select pg_advisory_lock(23299, 0)");
                    if (!checkIfMigrationApplied(handle, m.getVersion())) {
                        logger.info("Applying database migration:" + m.getVersion());
                        applyMigration(m, handle, context);
                        return true;
                    }
                    return false;
                }
                else {
                    logger.debug("Applying database migration:" + m.getVersion());
                    applyMigration(m, handle, context);
                    return true;
                }
            }
            else {
                return handle.inTransaction((h) -> {
                    if (context.isPostgres()) {
                        // other processes sharing the database wait here
                        h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                        if (!checkIfMigrationApplied(h, m.getVersion())) {
                            logger.info("Applying database migration:" + m.getVersion());
                            applyMigration(m, h, context);
                            return true;
                        }
                        return false;
                    }
                    else {
                        logger.debug("Applying database migration:" + m.getVersion());
                        applyMigration(m, h, context);
                        return true;
                    }
                });
            }
        }
    }

    public List<Migration> getApplicableMigration()
    {
        List<Migration> applicableMigrations = new ArrayList<>();
        try (Handle handle = jdbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                return new ArrayList<>(migrations);
            }

            Set<String> appliedSet = getAppliedMigrationNames(handle);
            for (Migration m : migrations) {
                if (!appliedSet.contains(m.getVersion())) {
                    applicableMigrations.add(m);
                }
            }
        }
        return applicableMigrations;
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from schema_migrations where name = :name limit 1")
            .bind("name", name)
            .mapTo(String.class)
            .list()
            .size() > 0;
    }

    @VisibleForTesting
    void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    public boolean existsSchemaMigrationsTable()
    {
        try (Handle handle = jdbi.open()) {
            return existsSchemaMigrationsTable(handle);
        }
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            logger.trace("schema_migrations table is not readable", re);
            return false;
        }
    }

    private void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }

    @VisibleForTesting
    String getDatabaseType()
    {
        return databaseType;
    }
}
