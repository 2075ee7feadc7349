package io.conveyor.core;

import com.google.inject.Inject;
import io.conveyor.core.reconcile.ManifestReconcileExecutor;
import io.conveyor.core.reconcile.ManifestReconciler;
import io.conveyor.core.schedule.ScheduleConfig;
import io.conveyor.core.schedule.ScheduledJobService;
import io.conveyor.core.schedule.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PostConstruct;

/**
 * Starts the scheduling engine, rebuilds its registrations from storage, and reconciles
 * pipeline manifests once. Does nothing when {@code scheduler.enabled} is false.
 */
public class SchedulerStarter
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulerStarter.class);

    private final ScheduleConfig config;
    private final SchedulingEngine engine;
    private final ScheduledJobService jobService;
    private final ManifestReconciler reconciler;
    private final ManifestReconcileExecutor reconcileExecutor;

    @Inject
    public SchedulerStarter(
            ScheduleConfig config,
            SchedulingEngine engine,
            ScheduledJobService jobService,
            ManifestReconciler reconciler,
            ManifestReconcileExecutor reconcileExecutor)
    {
        this.config = config;
        this.engine = engine;
        this.jobService = jobService;
        this.reconciler = reconciler;
        this.reconcileExecutor = reconcileExecutor;
    }

    @PostConstruct
    public void start()
    {
        if (!config.getEnabled()) {
            logger.info("Scheduler is disabled by scheduler.enabled=false");
            return;
        }
        engine.start();
        jobService.syncRegistrations();
        try {
            reconciler.reconcile();
        }
        catch (RuntimeException ex) {
            // stored jobs keep firing; the next reconciliation retries
            logger.error("Initial reconciliation of pipeline manifests failed", ex);
        }
        reconcileExecutor.start();
    }
}
