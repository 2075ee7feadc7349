package io.conveyor.core.execution;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.conveyor.core.schedule.JobFiring;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.spi.DaemonRestartService;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restarts the long-running daemon of the job's pipeline.
 */
public class DaemonRestartHandler
        implements JobHandler
{
    private static final Logger logger = LoggerFactory.getLogger(DaemonRestartHandler.class);

    private final PipelineResolver pipelines;
    private final DaemonRestartService restartService;
    private final ExecutionBridge bridge;
    private final ExecutionConfig config;

    @Inject
    public DaemonRestartHandler(
            PipelineResolver pipelines,
            DaemonRestartService restartService,
            ExecutionBridge bridge,
            ExecutionConfig config)
    {
        this.pipelines = pipelines;
        this.restartService = restartService;
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
            logger.error("Daemon pipeline '{}' of restart job {} is not found. Skipped", job.getPipelineName(), job.getId());
            return false;
        }
        if (!pipeline.get().isEnabled()) {
            logger.warn("Daemon pipeline '{}' is disabled. Skipped restart job {}", job.getPipelineName(), job.getId());
            return false;
        }

        SubmissionResult result = bridge.submit("restart of daemon '" + job.getPipelineName() + "'",
                () -> restartService.restart(job.getPipelineName()),
                config.restartAcceptanceTimeout());

        logger.info("Restarted daemon '{}' (run id: {}) for job {}",
                job.getPipelineName(), result.getRunId().or("unknown"), job.getId());
        return true;
    }
}
