package io.conveyor.core.database;

import javax.annotation.PreDestroy;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.conveyor.commons.guava.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the job store's data source on first use.
 *
 * {@code database.type=memory} gets a private H2 database that lives until {@link #close()},
 * {@code h2} a file database without a pool, and {@code postgresql} a HikariCP pool sized
 * by {@code database.minimumPoolSize} and {@code database.maximumPoolSize}.
 */
public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(DataSourceProvider.class);

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            String url = DatabaseConfig.buildJdbcUrl(config);
            if (DatabaseConfig.isPostgres(config.getType())) {
                openPool(url);
            }
            else if (config.getPath().isPresent()) {
                openFile(url);
            }
            else {
                openMemory(url);
            }
        }
        return ds;
    }

    private void openMemory(String url)
    {
        JdbcDataSource h2 = h2DataSource(url);

        // the database is dropped when its last connection closes
        Connection keepAlive;
        try {
            keepAlive = h2.getConnection();
        }
        catch (SQLException ex) {
            throw new StorageFailureException("Failed to open in-memory database " + url, ex);
        }
        logger.info("Using a private in-memory job store");
        this.ds = h2;
        this.closer = keepAlive;
    }

    private void openFile(String url)
    {
        logger.info("Using job store file {}", config.getPath().get());
        this.ds = h2DataSource(url);
        this.closer = null;
    }

    private static JdbcDataSource h2DataSource(String url)
    {
        JdbcDataSource h2 = new JdbcDataSource();
        // @PreDestroy closes the database, not H2's shutdown hook
        h2.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");
        return h2;
    }

    private void openPool(String url)
    {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("conveyor-job-store");
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseConfig.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));
        hikari.setAutoCommit(true);  // ThreadLocalTransactionManager begins transactions explicitly

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(Math.min(config.getMinimumPoolSize(), config.getMaximumPoolSize()));

        // no connectionTestQuery: commit() relies on Connection.isValid to detect an aborted transaction

        logger.info("Connecting job store to {} with {} to {} connections",
                url, hikari.getMinimumIdle(), hikari.getMaximumPoolSize());

        HikariDataSource pool = new HikariDataSource(hikari);
        this.ds = pool;
        this.closer = pool;
    }

    @PreDestroy
    @Override
    public synchronized void close()
    {
        if (ds == null) {
            return;
        }
        try {
            if (closer != null) {
                closer.close();
            }
        }
        catch (Exception ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        finally {
            ds = null;
            closer = null;
        }
    }
}
