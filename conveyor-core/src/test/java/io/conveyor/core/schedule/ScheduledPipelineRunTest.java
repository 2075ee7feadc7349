package io.conveyor.core.schedule;

import java.time.Duration;
import java.time.Instant;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.conveyor.core.database.DatabaseScheduledJobStoreManager;
import io.conveyor.core.database.DatabaseTestingUtils;
import io.conveyor.core.execution.DaemonRestartHandler;
import io.conveyor.core.execution.ExecutionBridge;
import io.conveyor.core.execution.ExecutionConfig;
import io.conveyor.core.execution.JobHandlerRegistry;
import io.conveyor.core.execution.PipelineRunHandler;
import io.conveyor.core.execution.ScheduledJobFiringHandler;
import io.conveyor.spi.PipelineExecutionService;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.SubmissionResult;
import io.conveyor.spi.TriggerKind;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.conveyor.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Runs the engine against the real firing chain down to {@link PipelineExecutionService}.
 */
@RunWith(MockitoJUnitRunner.class)
public class ScheduledPipelineRunTest
{
    @Mock PipelineResolver pipelines;
    @Mock PipelineExecutionService executionService;
    @Mock DaemonRestartHandler restartHandler;

    private DatabaseTestingUtils.TestingDatabase database;
    private DatabaseScheduledJobStoreManager sm;
    private SchedulingEngine engine;

    @Before
    public void setUp()
    {
        database = setupDatabase();
        sm = database.getScheduledJobStoreManager();
        PipelineRunHandler runHandler = new PipelineRunHandler(pipelines, executionService, new ExecutionBridge(),
                ExecutionConfig.defaultBuilder().build());
        JobFiringHandler firingHandler = new ScheduledJobFiringHandler(new JobHandlerRegistry(runHandler, restartHandler));
        engine = new SchedulingEngine(sm, TestingTriggerFactories.triggerManager(), firingHandler, ImmutableSet.of(),
                new StartupGraceGuard(Duration.ZERO),
                ScheduleConfig.defaultBuilder().pollInterval(3600).shutdownTimeout(5).build());
        engine.start();
    }

    @After
    public void destroy()
    {
        engine.stop();
        database.close();
    }

    @Test
    public void everyFiveMinutesStartsOneRunPerWindow()
            throws Exception
    {
        when(pipelines.resolve("etl")).thenReturn(Optional.of(TestingPipeline.of("etl")));
        when(executionService.submit("etl", "scheduler", Optional.absent()))
            .thenReturn(SubmissionResult.accepted("run-1"));

        ScheduledJob job = sm.insertJob(JobDefinition.definitionBuilder()
                .pipelineName("etl")
                .triggerKind(TriggerKind.CRON)
                .triggerValue("*/5 * * * *")
                .isEnabled(true)
                .source(JobSource.API)
                .build());
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        // ticks every 30 seconds through one 5 minute window
        int dispatched = 0;
        for (Instant now = first; now.isBefore(first.plusSeconds(300)); now = now.plusSeconds(30)) {
            dispatched += engine.runScheduleOnce(now);
        }

        assertThat(dispatched, is(1));
        verify(executionService, timeout(5000)).submit("etl", "scheduler", Optional.absent());
        verify(executionService, times(1)).submit("etl", "scheduler", Optional.absent());
        verifyNoInteractions(restartHandler);

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getFireCount(), is(1L));
        assertThat(reg.getNextFireTime(), is(Optional.of(first.plusSeconds(300))));
    }
}
