package io.conveyor.core.notification;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import io.conveyor.commons.guava.ThrowablesUtil;
import io.conveyor.spi.FailureNotification;
import io.conveyor.spi.FailureNotificationSender;
import io.conveyor.spi.NotificationException;
import io.conveyor.spi.SchedulerFailureNotifier;
import io.conveyor.spi.config.Config;
import io.conveyor.util.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static io.conveyor.util.RetryExecutor.retryExecutor;

public class DefaultSchedulerFailureNotifier
        implements SchedulerFailureNotifier
{
    private static final String NOTIFICATION_TYPE = "notification.type";

    private static final String NOTIFICATION_RETRIES = "notification.retries";
    private static final String NOTIFICATION_MIN_RETRY_WAIT = "notification.min_retry_wait";
    private static final String NOTIFICATION_MAX_RETRY_WAIT = "notification.max_retry_wait";
    private static final int NOTIFICATION_RETRIES_DEFAULT = 10;
    private static final int NOTIFICATION_MIN_RETRY_WAIT_DEFAULT = 1000;
    private static final int NOTIFICATION_MAX_RETRY_WAIT_DEFAULT = 30000;

    private static final Logger logger = LoggerFactory.getLogger(DefaultSchedulerFailureNotifier.class);

    private final FailureNotificationSender sender;
    private final RetryExecutor retryExecutor;

    @Inject
    public DefaultSchedulerFailureNotifier(Config systemConfig, Injector injector)
    {
        this(systemConfig, sender(systemConfig, injector));
    }

    @VisibleForTesting
    DefaultSchedulerFailureNotifier(Config systemConfig, FailureNotificationSender sender)
    {
        this(sender, retryExecutor()
                .withRetryLimit(systemConfig.get(NOTIFICATION_RETRIES, int.class, NOTIFICATION_RETRIES_DEFAULT))
                .withInitialRetryWait(systemConfig.get(NOTIFICATION_MIN_RETRY_WAIT, int.class, NOTIFICATION_MIN_RETRY_WAIT_DEFAULT))
                .withMaxRetryWait(systemConfig.get(NOTIFICATION_MAX_RETRY_WAIT, int.class, NOTIFICATION_MAX_RETRY_WAIT_DEFAULT)));
    }

    @VisibleForTesting
    DefaultSchedulerFailureNotifier(FailureNotificationSender sender, RetryExecutor retryExecutor)
    {
        this.sender = sender;
        this.retryExecutor = retryExecutor
            .retryIf(exception -> true)
            .onRetry((exception, retryCount, retryLimit, retryWait) ->
                    logger.warn("Sending scheduler failure notification failed: retry {} of {}", retryCount, retryLimit, exception));
    }

    private static FailureNotificationSender sender(Config systemConfig, Injector injector)
    {
        Optional<String> type = systemConfig.getOptional(NOTIFICATION_TYPE, String.class);
        if (!type.isPresent()) {
            return null;
        }
        return injector.getInstance(Key.get(FailureNotificationSender.class, Names.named(type.get())));
    }

    @Override
    public void notifySchedulerFailure(String pipelineName, String errorText)
    {
        FailureNotification notification = FailureNotification.of(Instant.now(), pipelineName, errorText);
        logger.debug("Scheduler failure notification: {}", notification);

        if (sender == null) {
            return;
        }

        try {
            retryExecutor.run(() -> {
                try {
                    sender.sendNotification(notification);
                }
                catch (NotificationException e) {
                    throw ThrowablesUtil.propagate(e);
                }
            });
        }
        catch (RetryExecutor.RetryGiveupException e) {
            logger.error("Failed to send scheduler failure notification of pipeline '{}'", pipelineName, e.getCause());
        }
        catch (RuntimeException e) {
            logger.error("Failed to send scheduler failure notification of pipeline '{}'", pipelineName, e);
        }
    }
}
