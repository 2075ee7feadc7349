package io.conveyor.core.reconcile;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.conveyor.core.ErrorReporter;
import io.conveyor.core.schedule.ScheduleConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Re-runs manifest reconciliation every {@code scheduler.reconcile_interval} seconds.
 */
public class ManifestReconcileExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ManifestReconcileExecutor.class);

    private final ManifestReconciler reconciler;
    private final ScheduleConfig config;
    private ScheduledExecutorService executor;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public ManifestReconcileExecutor(ManifestReconciler reconciler, ScheduleConfig config)
    {
        this.reconciler = reconciler;
        this.config = config;
    }

    public synchronized boolean isStarted()
    {
        return executor != null;
    }

    public synchronized void start()
    {
        int interval = config.getReconcileInterval();
        if (interval <= 0) {
            logger.debug("Periodic manifest reconciliation is disabled");
            return;
        }
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("manifest-reconciler-%d")
                .build()
                );
        executor.scheduleWithFixedDelay(() -> runReconcile(),
                interval, interval, TimeUnit.SECONDS);
        logger.info("Reconciling pipeline manifests every {} seconds", interval);
    }

    @PreDestroy
    public synchronized void shutdown()
    {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(config.getShutdownTimeout(), TimeUnit.SECONDS)) {
                logger.warn("Manifest reconciliation did not finish within {} seconds", config.getShutdownTimeout());
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    private void runReconcile()
    {
        try {
            reconciler.reconcile();
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Manifest reconciliation will be retried.", t);
            errorReporter.reportUncaughtError(t);
        }
    }
}
