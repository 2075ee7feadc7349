package io.conveyor.core.notification;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.conveyor.core.schedule.JobFiring;
import io.conveyor.core.schedule.SchedulingListener;
import io.conveyor.spi.SchedulerFailureNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;

import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends failed firings to the {@link SchedulerFailureNotifier} on its own thread,
 * so a slow notifier never holds a firing thread.
 */
public class FailureNotificationListener
        implements SchedulingListener
{
    private static final Logger logger = LoggerFactory.getLogger(FailureNotificationListener.class);

    private final SchedulerFailureNotifier notifier;
    private final Executor executor;

    @Inject
    public FailureNotificationListener(SchedulerFailureNotifier notifier)
    {
        this(notifier, Executors.newSingleThreadExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-notification-%d")
                    .build()
                    ));
    }

    @VisibleForTesting
    FailureNotificationListener(SchedulerFailureNotifier notifier, Executor executor)
    {
        this.notifier = notifier;
        this.executor = executor;
    }

    @Override
    public void onFiringFailed(JobFiring firing, Exception error)
    {
        String pipelineName = firing.getJob().getPipelineName();
        String text = String.format(Locale.ENGLISH, "Scheduled job %s (%s '%s') scheduled at %s failed: %s",
                firing.getJob().getId(),
                firing.getJob().getTriggerKind().getName(),
                firing.getJob().getTriggerValue(),
                firing.getScheduledTime(),
                error.getMessage() != null ? error.getMessage() : error.toString());
        try {
            executor.execute(() -> notify(pipelineName, text));
        }
        catch (RejectedExecutionException ex) {
            logger.warn("Notification of failed job {} is dropped because the scheduler is shutting down: {}",
                    firing.getJob().getId(), text);
        }
    }

    private void notify(String pipelineName, String text)
    {
        try {
            notifier.notifySchedulerFailure(pipelineName, text);
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to send failure notification of pipeline '{}'", pipelineName, ex);
        }
    }

    @PreDestroy
    public void shutdown()
    {
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdown();
        }
    }
}
