package io.conveyor.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;

import com.google.common.base.Optional;
import io.conveyor.commons.guava.ThrowablesUtil;
import io.conveyor.core.ResourceNotFoundException;
import io.conveyor.util.RetryExecutor;
import io.conveyor.util.RetryExecutor.RetryGiveupException;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.conveyor.util.RetryExecutor.retryExecutor;

/**
 * Base of the jdbi store managers.
 *
 * Each public operation of a store runs in its own transaction, or joins the
 * transaction of the calling thread. Operations started outside a transaction are
 * retried when the database reports a transient error (serialization failure,
 * deadlock, lost connection or lock timeout).
 */
public abstract class BasicDatabaseStoreManager <D>
{
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final String databaseType;
    private final Class<? extends D> daoIface;
    private final TransactionManager transactionManager;
    private final RetryExecutor retryExecutor;

    protected BasicDatabaseStoreManager(
            DatabaseConfig config,
            Class<? extends D> daoIface,
            TransactionManager transactionManager)
    {
        this.databaseType = config.getType();
        this.daoIface = daoIface;
        this.transactionManager = transactionManager;
        this.retryExecutor = retryExecutor()
            .withRetryLimit(config.getRetries())
            .withInitialRetryWait(config.getMinRetryWait())
            .withMaxRetryWait(config.getMaxRetryWait())
            .retryIf(BasicDatabaseStoreManager::isTransientException)
            .onRetry((exception, retryCount, retryLimit, retryWait) -> {
                logger.warn("Transient database error, retrying {}/{} after {} ms: {}",
                        retryCount, retryLimit, retryWait, exception.toString());
            });
    }

    public <T> T requiredResource(T resource, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        if (resource == null) {
            throw new ResourceNotFoundException("Resource does not exist: " + String.format(Locale.ENGLISH, messageFormat, messageParameters));
        }
        return resource;
    }

    public <T> T requiredResource(AutoCommitAction<T, D> action, String messageFormat, Object... messageParameters)
            throws ResourceNotFoundException
    {
        return requiredResource(autoCommit(action), messageFormat, messageParameters);
    }

    public boolean isConflictException(SQLException ex)
    {
        // h2 and postgresql
        return "23505".equals(ex.getSQLState());
    }

    static boolean isTransientException(Exception exception)
    {
        Throwable t = exception;
        while (t != null) {
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null && (state.startsWith("40") || state.startsWith("08") || state.equals("HYT00"))) {
                    return true;
                }
            }
            t = t.getCause();
        }
        return false;
    }

    public interface AutoCommitAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionAction <T, D>
    {
        T call(Handle handle, D dao);
    }

    public interface TransactionActionWithExceptions <T, D, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    {
        T call(Handle handle, D dao) throws E1, E2, E3;
    }

    public <T> T transaction(TransactionAction<T, D> action)
    {
        return transaction((handle, dao) -> action.call(handle, dao), RuntimeException.class);
    }

    public <T, E1 extends Exception> T transaction(
            TransactionActionWithExceptions<T, D, E1, RuntimeException, RuntimeException> action,
            Class<E1> exClass1)
        throws E1
    {
        if (transactionManager.isInTransaction()) {
            return callWithCurrentHandle(action);
        }
        return withRetry(
                () -> transactionManager.begin(() -> callWithCurrentHandle(action), exClass1),
                exClass1);
    }

    public <T> T autoCommit(AutoCommitAction<T, D> action)
    {
        if (transactionManager.isInTransaction()) {
            Handle handle = transactionManager.getHandle();
            return action.call(handle, handle.attach(daoIface));
        }
        return withRetry(
                () -> transactionManager.autoCommit(() -> {
                    Handle handle = transactionManager.getHandle();
                    return action.call(handle, handle.attach(daoIface));
                }),
                RuntimeException.class);
    }

    private <T, E1 extends Exception> T callWithCurrentHandle(
            TransactionActionWithExceptions<T, D, E1, RuntimeException, RuntimeException> action)
        throws E1
    {
        Handle handle = transactionManager.getHandle();
        return action.call(handle, handle.attach(daoIface));
    }

    private <T, E1 extends Exception> T withRetry(Callable<T> op, Class<E1> exClass1)
        throws E1
    {
        try {
            return retryExecutor.run(op);
        }
        catch (RetryGiveupException ex) {
            Exception cause = ex.getCause();
            ThrowablesUtil.propagateIfInstanceOf(cause, exClass1);
            if (isTransientException(cause)) {
                throw new StorageFailureException(
                        "Database operation failed after " + ex.getRetryCount() + " retries", cause);
            }
            throw ThrowablesUtil.propagate(cause);
        }
    }

    public static UUID getUuid(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return UUID.fromString(v);
    }

    public static Instant getTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        return r.getTimestamp(column).toInstant();
    }

    public static Optional<Instant> getOptionalTimestampInstant(ResultSet r, String column)
            throws SQLException
    {
        Timestamp t = r.getTimestamp(column);
        if (r.wasNull()) {
            return Optional.absent();
        }
        else {
            return Optional.of(t.toInstant());
        }
    }

    public static Optional<Instant> getOptionalEpochMillis(ResultSet r, String column)
            throws SQLException
    {
        return getOptionalLong(r, column).transform(Instant::ofEpochMilli);
    }

    public static Optional<Long> getOptionalLong(ResultSet r, String column)
            throws SQLException
    {
        long v = r.getLong(column);
        return optional(r.wasNull(), v);
    }

    public static Optional<String> getOptionalString(ResultSet r, String column)
            throws SQLException
    {
        String v = r.getString(column);
        return optional(r.wasNull(), v);
    }

    protected static Timestamp timestampOrNull(Optional<Instant> instant)
    {
        return instant.isPresent() ? Timestamp.from(instant.get()) : null;
    }

    protected static Long epochMillisOrNull(Optional<Instant> instant)
    {
        return instant.isPresent() ? instant.get().toEpochMilli() : null;
    }

    private static <T> Optional<T> optional(boolean wasNull, T v)
    {
        if (wasNull) {
            return Optional.absent();
        }
        else {
            return Optional.of(v);
        }
    }
}
