package io.conveyor.core.schedule;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.conveyor.core.ErrorReporter;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one live registration per enabled job and fires the jobs that are due.
 *
 * A single timer thread polls the registrations. A due job is claimed by locking its
 * durable registration row, which advances the next fire time, and the firing itself
 * runs on a separate pool. While a firing of a job is in flight, further due instants
 * of the same job are skipped. Within the startup grace period nothing is claimed.
 */
public class SchedulingEngine
{
    private static final Logger logger = LoggerFactory.getLogger(SchedulingEngine.class);

    private final ScheduledJobStoreManager sm;
    private final TriggerManager triggers;
    private final JobFiringHandler firingHandler;
    private final Set<SchedulingListener> listeners;
    private final StartupGraceGuard graceGuard;
    private final ScheduleConfig config;

    private final ConcurrentMap<UUID, Registration> registrations = new ConcurrentHashMap<>();
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private volatile ScheduledExecutorService timer;
    private volatile ExecutorService firingExecutor;
    private volatile Instant startedAt;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public SchedulingEngine(
            ScheduledJobStoreManager sm,
            TriggerManager triggers,
            JobFiringHandler firingHandler,
            Set<SchedulingListener> listeners,
            StartupGraceGuard graceGuard,
            ScheduleConfig config)
    {
        this.sm = sm;
        this.triggers = triggers;
        this.firingHandler = firingHandler;
        this.listeners = listeners;
        this.graceGuard = graceGuard;
        this.config = config;
    }

    private static class Registration
    {
        private final ScheduledJob job;
        private final Trigger trigger;
        private volatile Optional<Instant> nextFireTime;

        Registration(ScheduledJob job, Trigger trigger, Optional<Instant> nextFireTime)
        {
            this.job = job;
            this.trigger = trigger;
            this.nextFireTime = nextFireTime;
        }
    }

    public boolean isRunning()
    {
        return timer != null;
    }

    public Optional<Instant> getStartedAt()
    {
        return Optional.fromNullable(startedAt);
    }

    public synchronized void start()
    {
        if (timer != null) {
            logger.warn("Scheduling engine is already running");
            return;
        }
        startedAt = Instant.now();
        firingExecutor = Executors.newFixedThreadPool(config.getFiringThreads(),
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("scheduler-firing-%d")
                .build()
                );
        timer = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("scheduler-%d")
                .build()
                );
        timer.scheduleWithFixedDelay(() -> runSchedules(),
                config.getPollInterval(), config.getPollInterval(), TimeUnit.SECONDS);
        logger.info("Scheduling engine started");
    }

    @PreDestroy
    public void stop()
    {
        ScheduledExecutorService stoppingTimer;
        ExecutorService stoppingFiring;
        synchronized (this) {
            if (timer == null) {
                return;
            }
            stoppingTimer = timer;
            stoppingFiring = firingExecutor;
            timer = null;
            firingExecutor = null;
            registrations.clear();
            startedAt = null;
        }

        // the current tick finishes before the timer terminates
        stoppingTimer.shutdown();
        awaitTermination(stoppingTimer, config.getShutdownTimeout(), "timer");

        stoppingFiring.shutdown();
        awaitTermination(stoppingFiring, config.getShutdownTimeout(), "firing");

        logger.info("Scheduling engine stopped");
    }

    private static void awaitTermination(ExecutorService executor, int timeoutSeconds, String name)
    {
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Scheduling engine {} threads did not finish within {} seconds", name, timeoutSeconds);
            }
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for scheduling engine {} threads to finish", name);
        }
    }

    /**
     * Installs or replaces the live registration of a job.
     *
     * @throws SchedulerUnavailableException if the engine is not running
     * @throws InvalidTriggerException if the trigger of the job can't be built
     */
    public void register(ScheduledJob job)
        throws InvalidTriggerException
    {
        if (!isRunning()) {
            throw new SchedulerUnavailableException("Scheduling engine is not running. Job " + job.getId() + " is registered when it starts");
        }
        if (!job.isEnabled()) {
            unregister(job.getId());
            return;
        }

        Trigger trigger;
        try {
            trigger = triggers.getTrigger(job);
        }
        catch (InvalidTriggerException ex) {
            logger.error("Rejected registration of job {} for pipeline '{}': {}",
                    job.getId(), job.getPipelineName(), ex.getMessage());
            throw ex;
        }

        Optional<Instant> first = trigger.getFirstFireTime(Instant.now());
        sm.putRegistration(job.getId(), first);
        registrations.put(job.getId(), new Registration(job, trigger, first));

        if (first.isPresent()) {
            logger.info("Registered job {} ({} '{}') for pipeline '{}', next fire time is {}",
                    job.getId(), job.getTriggerKind().getName(), job.getTriggerValue(), job.getPipelineName(), first.get());
        }
        else {
            logger.info("Registered job {} ({} '{}') for pipeline '{}', it has no further fire time",
                    job.getId(), job.getTriggerKind().getName(), job.getTriggerValue(), job.getPipelineName());
        }
    }

    /**
     * Removes the live registration and its durable state. Missing registrations are ignored.
     */
    public boolean unregister(UUID jobId)
    {
        boolean removed = registrations.remove(jobId) != null;
        boolean deleted = sm.deleteRegistration(jobId);
        if (removed || deleted) {
            logger.info("Unregistered job {}", jobId);
        }
        return removed || deleted;
    }

    public boolean isRegistered(UUID jobId)
    {
        return registrations.containsKey(jobId);
    }

    @VisibleForTesting
    boolean isInFlight(UUID jobId)
    {
        return inFlight.contains(jobId);
    }

    public List<JobDetails> listJobs()
    {
        ImmutableMap.Builder<UUID, StoredJobRegistration> stored = ImmutableMap.builder();
        for (StoredJobRegistration registration : sm.getRegistrations()) {
            stored.put(registration.getJobId(), registration);
        }
        Map<UUID, StoredJobRegistration> storedMap = stored.build();

        Instant now = Instant.now();
        ImmutableList.Builder<JobDetails> builder = ImmutableList.builder();
        for (ScheduledJob job : sm.getJobs()) {
            builder.add(buildDetails(job, Optional.fromNullable(storedMap.get(job.getId())), now));
        }
        return builder.build();
    }

    public JobDetails getJob(UUID jobId)
        throws JobNotFoundException
    {
        ScheduledJob job = sm.getJobById(jobId);
        return buildDetails(job, sm.getRegistration(jobId), Instant.now());
    }

    private JobDetails buildDetails(ScheduledJob job, Optional<StoredJobRegistration> stored, Instant now)
    {
        Registration registration = registrations.get(job.getId());

        Optional<Instant> next = Optional.absent();
        if (registration != null) {
            next = registration.nextFireTime;
        }
        if (!next.isPresent() && job.isEnabled()) {
            next = evaluateNextFireTime(job, now);
        }

        return ImmutableJobDetails.builder()
            .job(job)
            .registered(registration != null)
            .nextFireTime(next)
            .lastFireTime(stored.isPresent() ? stored.get().getLastFireTime() : Optional.<Instant>absent())
            .fireCount(stored.isPresent() ? stored.get().getFireCount() : 0L)
            .build();
    }

    private Optional<Instant> evaluateNextFireTime(ScheduledJob job, Instant now)
    {
        try {
            return triggers.getTrigger(job).getFirstFireTime(now);
        }
        catch (InvalidTriggerException ex) {
            logger.debug("Job {} has an invalid trigger: {}", job.getId(), ex.getMessage());
            return Optional.absent();
        }
    }

    private void runSchedules()
    {
        try {
            runScheduleOnce(Instant.now());
        }
        catch (Throwable t) {
            logger.error("An uncaught exception is ignored. Scheduling will be retried.", t);
            errorReporter.reportUncaughtError(t);
        }
    }

    /**
     * Runs one tick of the timer loop.
     *
     * @return number of firings dispatched
     */
    @VisibleForTesting
    int runScheduleOnce(Instant now)
    {
        Instant engineStartedAt = startedAt;
        if (engineStartedAt == null) {
            return 0;
        }
        boolean suppressed = graceGuard.isSuppressed(engineStartedAt, now);

        int count = 0;
        for (Registration registration : ImmutableList.copyOf(registrations.values())) {
            Optional<Instant> next = registration.nextFireTime;
            if (!next.isPresent() || next.get().isAfter(now)) {
                continue;
            }
            if (suppressed) {
                skipWithinGracePeriod(registration, now);
                continue;
            }
            try {
                if (runSchedule(registration, now, engineStartedAt)) {
                    count++;
                }
            }
            catch (RuntimeException ex) {
                logger.error("Failed to process due job {} for pipeline '{}'. It will be retried.",
                        registration.job.getId(), registration.job.getPipelineName(), ex);
                errorReporter.reportUncaughtError(ex);
            }
        }
        return count;
    }

    private void skipWithinGracePeriod(Registration registration, Instant now)
    {
        // the durable row stays due, so a process that is past its grace period claims it
        ScheduledJob job = registration.job;
        Optional<Instant> next = registration.trigger.nextFireTime(now);
        logger.info("Skipped job {} of pipeline '{}' due at {}: within {} seconds after the scheduling engine started. Next fire time is {}",
                job.getId(), job.getPipelineName(), registration.nextFireTime.get(),
                graceGuard.getGracePeriod().getSeconds(), next.isPresent() ? next.get() : "none");
        registration.nextFireTime = next;
    }

    private boolean runSchedule(Registration registration, Instant now, Instant engineStartedAt)
    {
        ScheduledJob job = registration.job;
        UUID jobId = job.getId();

        if (inFlight.contains(jobId)) {
            Optional<Instant> next = registration.trigger.nextFireTime(now);
            Optional<Instant> skipped = sm.lockDueRegistration(jobId, now, (control, stored) -> {
                control.skipTo(next);
                return stored.getNextFireTime().get();
            });
            if (skipped.isPresent()) {
                registration.nextFireTime = next;
                logger.warn("Skipped firing of job {} for pipeline '{}' due at {} because its previous firing is still running. Next fire time is {}",
                        jobId, job.getPipelineName(), skipped.get(), next.isPresent() ? next.get() : "none");
            }
            else {
                refreshFromStore(registration);
            }
            return false;
        }

        Optional<JobFiring> claimed = sm.lockDueRegistration(jobId, now, (control, stored) -> {
            Instant scheduledTime = stored.getNextFireTime().get();
            control.recordFiring(now, registration.trigger.nextFireTime(latest(now, scheduledTime)));
            return JobFiring.of(job, scheduledTime, now, engineStartedAt);
        });
        if (!claimed.isPresent()) {
            // another process fired it or the job was deleted
            refreshFromStore(registration);
            return false;
        }

        JobFiring firing = claimed.get();
        registration.nextFireTime = registration.trigger.nextFireTime(latest(now, firing.getScheduledTime()));
        return dispatch(firing);
    }

    private void refreshFromStore(Registration registration)
    {
        UUID jobId = registration.job.getId();
        Optional<StoredJobRegistration> stored = sm.getRegistration(jobId);
        if (stored.isPresent()) {
            registration.nextFireTime = stored.get().getNextFireTime();
        }
        else {
            logger.info("Registration of job {} no longer exists in storage. Removing it", jobId);
            registrations.remove(jobId, registration);
        }
    }

    private boolean dispatch(JobFiring firing)
    {
        UUID jobId = firing.getJob().getId();
        ExecutorService executor = firingExecutor;
        if (executor == null) {
            logger.warn("Scheduling engine stopped before job {} could fire at {}", jobId, firing.getScheduledTime());
            return false;
        }

        inFlight.add(jobId);
        try {
            executor.execute(() -> fire(firing));
            return true;
        }
        catch (RejectedExecutionException ex) {
            inFlight.remove(jobId);
            logger.warn("Scheduling engine stopped before job {} could fire at {}", jobId, firing.getScheduledTime(), ex);
            return false;
        }
    }

    private void fire(JobFiring firing)
    {
        ScheduledJob job = firing.getJob();
        boolean submitted = false;
        Exception error = null;
        try {
            logger.info("Firing job {} for pipeline '{}' scheduled at {}",
                    job.getId(), job.getPipelineName(), firing.getScheduledTime());
            submitted = firingHandler.fire(firing);
        }
        catch (Exception ex) {
            logger.error("Firing of job {} for pipeline '{}' scheduled at {} failed",
                    job.getId(), job.getPipelineName(), firing.getScheduledTime(), ex);
            error = ex;
        }
        finally {
            // cleared before listeners run
            inFlight.remove(job.getId());
        }

        if (error != null) {
            notifyFailed(firing, error);
        }
        else if (submitted) {
            notifySucceeded(firing);
        }
    }

    private void notifySucceeded(JobFiring firing)
    {
        for (SchedulingListener listener : listeners) {
            try {
                listener.onFiringSucceeded(firing);
            }
            catch (RuntimeException ex) {
                logger.warn("Scheduling listener {} failed", listener.getClass().getName(), ex);
            }
        }
    }

    private void notifyFailed(JobFiring firing, Exception error)
    {
        for (SchedulingListener listener : listeners) {
            try {
                listener.onFiringFailed(firing, error);
            }
            catch (RuntimeException ex) {
                logger.warn("Scheduling listener {} failed", listener.getClass().getName(), ex);
            }
        }
    }

    private static Instant latest(Instant a, Instant b)
    {
        return a.isAfter(b) ? a : b;
    }
}
