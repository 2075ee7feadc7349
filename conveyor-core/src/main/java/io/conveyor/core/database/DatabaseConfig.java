package io.conveyor.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Storage settings read from the {@code database.*} parameters of the system configuration.
 *
 * {@code database.type} is {@code memory} (default), {@code h2} with {@code database.path},
 * or {@code postgresql} with {@code database.host}, {@code database.user} and {@code database.database}.
 */
@Value.Immutable
public interface DatabaseConfig
{
    String getType();

    Optional<String> getPath();

    Map<String, String> getOptions();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    boolean getAutoMigrate();

    // retries of transient storage errors

    int getRetries();

    int getMinRetryWait();  // milliseconds

    int getMaxRetryWait();  // milliseconds

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    int getValidationTimeout();  // seconds

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        return convertFrom(config, "database");
    }

    static DatabaseConfig convertFrom(Config config, String keyPrefix)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get(keyPrefix + "." + "type", String.class, "memory");
        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(Optional.of(config.get(keyPrefix + "." + "path", String.class)));
            break;
        case "memory":
            builder.type("h2");
            builder.path(Optional.absent());
            break;
        case "postgresql":
            builder.type("postgresql");
            builder.remoteDatabaseConfig(Optional.of(
                RemoteDatabaseConfig.builder()
                    .user(config.get(keyPrefix + "." + "user", String.class))
                    .password(config.get(keyPrefix + "." + "password", String.class, ""))
                    .host(config.get(keyPrefix + "." + "host", String.class))
                    .port(config.getOptional(keyPrefix + "." + "port", Integer.class))
                    .database(config.get(keyPrefix + "." + "database", String.class))
                    .loginTimeout(config.get(keyPrefix + "." + "loginTimeout", int.class, 30))
                    .socketTimeout(config.get(keyPrefix + "." + "socketTimeout", int.class, 1800))
                    .ssl(config.get(keyPrefix + "." + "ssl", boolean.class, false))
                    .sslmode(config.getOptional(keyPrefix + "." + "sslmode", String.class))
                    .build()));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        builder.connectionTimeout(
                config.get(keyPrefix + "." + "connectionTimeout", int.class, 30));  // HikariCP default: 30
        builder.idleTimeout(
                config.get(keyPrefix + "." + "idleTimeout", int.class, 600));  // HikariCP default: 600
        builder.validationTimeout(
                config.get(keyPrefix + "." + "validationTimeout", int.class, 5));  // HikariCP default: 5

        int maximumPoolSize = config.get(keyPrefix + "." + "maximumPoolSize", int.class, 10);
        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(
                config.get(keyPrefix + "." + "minimumPoolSize", int.class, maximumPoolSize));

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        String optionKey = keyPrefix + "." + "opts.";
        for (String key : config.getKeys()) {
            if (key.startsWith(optionKey)) {
                options.put(key.substring(optionKey.length()), config.get(key, String.class));
            }
        }
        builder.options(options.build());

        builder.autoMigrate(
                config.get(keyPrefix + "." + "migrate", boolean.class, true));

        builder.retries(config.get(keyPrefix + "." + "retries", int.class, 3));
        builder.minRetryWait(config.get(keyPrefix + "." + "min_retry_wait", int.class, 200));
        builder.maxRetryWait(config.get(keyPrefix + "." + "max_retry_wait", int.class, 2000));

        return builder.build();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        switch (config.getType()) {
        case "h2":
            if (config.getPath().isPresent()) {
                Path dir = Paths.get(config.getPath().get());
                try {
                    Files.createDirectories(dir);
                }
                catch (IOException ex) {
                    throw new ConfigException(ex);
                }
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        dir.resolve("conveyor").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:conveyor-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            {
                if (!config.getRemoteDatabaseConfig().isPresent()) {
                    throw new IllegalArgumentException("Database type is postgresql but remoteDatabaseConfig is not set unexpectedly");
                }
                RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
                if (remote.getPort().isPresent()) {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s:%d/%s",
                            remote.getHost(), remote.getPort().get(), remote.getDatabase());
                }
                else {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s/%s",
                            remote.getHost(), remote.getDatabase());
                }
            }

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        Optional<RemoteDatabaseConfig> rc = config.getRemoteDatabaseConfig();

        if (rc.isPresent()) {
            props.setProperty("loginTimeout", Integer.toString(rc.get().getLoginTimeout()));
            props.setProperty("socketTimeout", Integer.toString(rc.get().getSocketTimeout()));
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("user", rc.get().getUser());
            props.setProperty("password", rc.get().getPassword());
            if (rc.get().getSsl()) {
                props.setProperty("ssl", "true");
                if (rc.get().getSslmode().isPresent()) {
                    props.setProperty("sslmode", rc.get().getSslmode().get());
                }
            }
        }

        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }

        return props;
    }

    static String getDriverClassName(String type)
    {
        switch (type) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new ConfigException("Unsupported database type: " + type);
        }
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }
}
