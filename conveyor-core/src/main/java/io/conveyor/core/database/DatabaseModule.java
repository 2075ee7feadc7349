package io.conveyor.core.database;

import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Binder;
import com.google.inject.Scopes;
import javax.sql.DataSource;
import javax.annotation.PostConstruct;
import io.conveyor.core.schedule.ScheduledJobStoreManager;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(ScheduledJobStoreManager.class).to(DatabaseScheduledJobStoreManager.class).in(Scopes.SINGLETON);
    }

    public static class AutoMigrator
    {
        private DatabaseMigrator migrator;

        @Inject
        public AutoMigrator(DataSource ds, DatabaseConfig config)
        {
            if (config.getAutoMigrate()) {
                this.migrator = new DatabaseMigrator(DatabaseHelper.createJdbi(ds), config);
            }
        }

        @PostConstruct
        public void migrate()
        {
            if (migrator != null) {
                migrator.migrate();
                migrator = null;
            }
        }
    }
}
