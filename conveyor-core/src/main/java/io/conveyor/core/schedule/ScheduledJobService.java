package io.conveyor.core.schedule;

import java.util.List;
import java.util.UUID;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.PipelineResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, updates and deletes scheduled jobs, keeping the live registrations of the
 * scheduling engine in line with storage.
 *
 * Storage is written first. When the engine is stopped, the write still succeeds and
 * the registration is rebuilt by {@link #syncRegistrations()} when the engine starts.
 */
public class ScheduledJobService
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduledJobService.class);

    private final ScheduledJobStoreManager sm;
    private final SchedulingEngine engine;
    private final TriggerManager triggers;
    private final PipelineResolver pipelines;

    @Inject
    public ScheduledJobService(
            ScheduledJobStoreManager sm,
            SchedulingEngine engine,
            TriggerManager triggers,
            PipelineResolver pipelines)
    {
        this.sm = sm;
        this.engine = engine;
        this.triggers = triggers;
        this.pipelines = pipelines;
    }

    public ScheduledJob createJob(JobDefinition definition)
        throws PipelineNotFoundException, InvalidTriggerException
    {
        requirePipeline(definition.getPipelineName());
        triggers.getTrigger(definition);

        ScheduledJob job = sm.insertJob(definition);
        logger.info("Created {} job {} for pipeline '{}' ({} '{}')",
                job.getSource().getName(), job.getId(), job.getPipelineName(),
                job.getTriggerKind().getName(), job.getTriggerValue());

        if (job.isEnabled()) {
            registerLive(job);
        }
        return job;
    }

    public ScheduledJob updateJob(UUID jobId, ScheduledJobUpdate update)
        throws JobNotFoundException, PipelineNotFoundException, InvalidTriggerException
    {
        ScheduledJob current = sm.getJobById(jobId);
        JobDefinition updated = update.applyTo(current);

        if (!updated.getPipelineName().equals(current.getPipelineName())) {
            requirePipeline(updated.getPipelineName());
        }
        // the whole resulting trigger is validated before anything is written
        triggers.getTrigger(updated);

        ScheduledJob job = sm.updateJob(jobId, updated);
        logger.info("Updated job {} for pipeline '{}': {}", jobId, job.getPipelineName(), update);

        if (job.isEnabled()) {
            registerLive(job);
        }
        else {
            unregisterLive(jobId);
        }
        return job;
    }

    public void deleteJob(UUID jobId)
        throws JobNotFoundException
    {
        ScheduledJob job = sm.getJobById(jobId);
        unregisterLive(jobId);
        sm.deleteJob(jobId);
        logger.info("Deleted {} job {} for pipeline '{}'", job.getSource().getName(), jobId, job.getPipelineName());
    }

    public ScheduledJob getJob(UUID jobId)
        throws JobNotFoundException
    {
        return sm.getJobById(jobId);
    }

    public List<ScheduledJob> getJobs()
    {
        return sm.getJobs();
    }

    public List<ScheduledJob> getJobsBySource(JobSource source)
    {
        return sm.getJobsBySource(source);
    }

    public JobDetails getJobDetails(UUID jobId)
        throws JobNotFoundException
    {
        return engine.getJob(jobId);
    }

    public List<JobDetails> listJobDetails()
    {
        return engine.listJobs();
    }

    /**
     * Rebuilds the live registrations from storage. Called after the engine starts.
     *
     * @return number of registered jobs
     */
    public int syncRegistrations()
    {
        int registered = 0;
        List<ScheduledJob> jobs = sm.getJobs();
        for (ScheduledJob job : jobs) {
            if (job.isEnabled()) {
                try {
                    engine.register(job);
                    registered++;
                }
                catch (InvalidTriggerException ex) {
                    logger.warn("Skipped stored job {} for pipeline '{}' with an invalid trigger: {}",
                            job.getId(), job.getPipelineName(), ex.getMessage());
                }
                catch (RuntimeException ex) {
                    logger.error("Failed to register stored job {} for pipeline '{}'", job.getId(), job.getPipelineName(), ex);
                }
            }
            else {
                engine.unregister(job.getId());
            }
        }
        logger.info("Registered {} of {} stored jobs", registered, jobs.size());
        return registered;
    }

    private void requirePipeline(String pipelineName)
        throws PipelineNotFoundException
    {
        Optional<Pipeline> pipeline = pipelines.resolve(pipelineName);
        if (!pipeline.isPresent()) {
            throw new PipelineNotFoundException(pipelineName);
        }
    }

    private void registerLive(ScheduledJob job)
    {
        if (!engine.isRunning()) {
            logger.debug("Scheduling engine is not running. Registration of job {} is deferred to its start", job.getId());
            return;
        }
        try {
            engine.register(job);
        }
        catch (SchedulerUnavailableException ex) {
            logger.info("Scheduling engine stopped. Registration of job {} is deferred to its next start", job.getId());
        }
        catch (InvalidTriggerException ex) {
            // validated before the write, so the trigger factory disagrees with itself
            logger.error("Stored job {} could not be registered", job.getId(), ex);
        }
    }

    private void unregisterLive(UUID jobId)
    {
        try {
            engine.unregister(jobId);
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to unregister job {}. Its registration is removed with the job row", jobId, ex);
        }
    }
}
