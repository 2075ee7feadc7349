package io.conveyor.core.execution;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.conveyor.core.schedule.JobFiring;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.PipelineExecutionService;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts a run of the job's pipeline with its run configuration.
 */
public class PipelineRunHandler
        implements JobHandler
{
    private static final Logger logger = LoggerFactory.getLogger(PipelineRunHandler.class);

    static final String TRIGGERED_BY = "scheduler";

    private final PipelineResolver pipelines;
    private final PipelineExecutionService executionService;
    private final ExecutionBridge bridge;
    private final ExecutionConfig config;

    @Inject
    public PipelineRunHandler(
            PipelineResolver pipelines,
            PipelineExecutionService executionService,
            ExecutionBridge bridge,
            ExecutionConfig config)
    {
        this.pipelines = pipelines;
        this.executionService = executionService;
        this.bridge = bridge;
        this.config = config;
    }

    @Override
    public boolean handle(JobFiring firing)
        throws ExecutionSubmissionFailedException
    {
        ScheduledJob job = firing.getJob();
        Optional<Pipeline> pipeline = pipelines.resolve(job.getPipelineName());
        if (!pipeline.isPresent()) {
            logger.error("Pipeline '{}' of scheduled job {} is not found. Skipped", job.getPipelineName(), job.getId());
            return false;
        }
        if (!pipeline.get().isEnabled()) {
            logger.warn("Pipeline '{}' is disabled. Skipped scheduled job {}", job.getPipelineName(), job.getId());
            return false;
        }

        String description = "run of pipeline '" + job.getPipelineName() + "'"
            + (job.getRunConfigId().isPresent() ? " with run config '" + job.getRunConfigId().get() + "'" : "");
        SubmissionResult result = bridge.submit(description,
                () -> executionService.submit(job.getPipelineName(), TRIGGERED_BY, job.getRunConfigId()),
                config.acceptanceTimeout());

        logger.info("Started {} (run id: {}) for job {} scheduled at {}",
                description, result.getRunId().or("unknown"), job.getId(), firing.getScheduledTime());
        return true;
    }
}
