package io.conveyor.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.conveyor.core.database.DatabaseScheduledJobStoreManager;
import io.conveyor.core.database.DatabaseTestingUtils;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.TriggerKind;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.conveyor.core.database.DatabaseTestingUtils.assertNotFound;
import static io.conveyor.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class ScheduledJobServiceTest
{
    @Mock PipelineResolver pipelines;
    @Mock JobFiringHandler handler;

    private DatabaseTestingUtils.TestingDatabase database;
    private DatabaseScheduledJobStoreManager sm;
    private SchedulingEngine engine;
    private ScheduledJobService service;

    @Before
    public void setUp()
    {
        database = setupDatabase();
        sm = database.getScheduledJobStoreManager();
        TriggerManager triggers = TestingTriggerFactories.triggerManager();
        engine = new SchedulingEngine(sm, triggers, handler, ImmutableSet.of(), new StartupGraceGuard(Duration.ZERO),
                ScheduleConfig.defaultBuilder().pollInterval(3600).shutdownTimeout(5).build());
        service = new ScheduledJobService(sm, engine, triggers, pipelines);
    }

    @After
    public void destroy()
    {
        engine.stop();
        database.close();
    }

    private void pipelineExists(String name)
    {
        when(pipelines.resolve(name)).thenReturn(Optional.of(TestingPipeline.of(name)));
    }

    private static JobDefinition interval(String pipelineName, String seconds)
    {
        return JobDefinition.definitionBuilder()
            .pipelineName(pipelineName)
            .triggerKind(TriggerKind.INTERVAL)
            .triggerValue(seconds)
            .isEnabled(true)
            .source(JobSource.API)
            .build();
    }

    @Test
    public void createJobRegistersWithRunningEngine()
            throws Exception
    {
        pipelineExists("etl");
        engine.start();

        ScheduledJob job = service.createJob(interval("etl", "60"));

        assertThat(service.getJob(job.getId()), is(job));
        assertThat(engine.isRegistered(job.getId()), is(true));
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime().isPresent(), is(true));

        JobDetails details = service.getJobDetails(job.getId());
        assertThat(details.getRegistered(), is(true));
        assertThat(details.getFireCount(), is(0L));
    }

    @Test
    public void createJobWhileEngineIsStoppedIsRegisteredOnSync()
            throws Exception
    {
        pipelineExists("etl");

        ScheduledJob job = service.createJob(interval("etl", "60"));
        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(service.getJobs(), contains(job));

        engine.start();
        assertThat(service.syncRegistrations(), is(1));
        assertThat(engine.isRegistered(job.getId()), is(true));
    }

    @Test
    public void createJobOfUnknownPipeline()
            throws Exception
    {
        when(pipelines.resolve("missing")).thenReturn(Optional.absent());
        try {
            service.createJob(interval("missing", "60"));
            fail();
        }
        catch (PipelineNotFoundException ex) {
            // expected
        }
        assertThat(service.getJobs(), is(empty()));
    }

    @Test
    public void createJobWithInvalidTrigger()
            throws Exception
    {
        pipelineExists("etl");
        try {
            service.createJob(interval("etl", "-5"));
            fail();
        }
        catch (InvalidTriggerException ex) {
            // expected
        }
        assertThat(service.getJobs(), is(empty()));
    }

    @Test
    public void updateJobReplacesTriggerAndRegistration()
            throws Exception
    {
        pipelineExists("etl");
        engine.start();
        ScheduledJob job = service.createJob(interval("etl", "60"));

        Instant start = Instant.now().plusSeconds(7200).truncatedTo(ChronoUnit.SECONDS);
        ScheduledJob updated = service.updateJob(job.getId(), ScheduledJobUpdate.builder()
                .trigger(TriggerKind.CRON, "0 9 * * *")
                .startDate(Optional.of(start))
                .runConfigId(Optional.of("nightly"))
                .build());

        assertThat(updated.getId(), is(job.getId()));
        assertThat(updated.getTriggerKind(), is(TriggerKind.CRON));
        assertThat(updated.getTriggerValue(), is("0 9 * * *"));
        assertThat(updated.getStartDate(), is(Optional.of(start)));
        assertThat(updated.getRunConfigId(), is(Optional.of("nightly")));
        assertThat(updated.getSource(), is(JobSource.API));
        assertThat(engine.isRegistered(job.getId()), is(true));
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(Optional.of(start)));
    }

    @Test
    public void rejectedUpdatePersistsNothing()
            throws Exception
    {
        pipelineExists("etl");
        engine.start();
        ScheduledJob job = service.createJob(interval("etl", "60"));
        StoredJobRegistration registration = sm.getRegistration(job.getId()).get();

        try {
            service.updateJob(job.getId(), ScheduledJobUpdate.builder()
                    .triggerValue("every minute")
                    .enabled(false)
                    .build());
            fail();
        }
        catch (InvalidTriggerException ex) {
            // expected
        }

        assertThat(service.getJob(job.getId()), is(job));
        assertThat(engine.isRegistered(job.getId()), is(true));
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(registration.getNextFireTime()));
    }

    @Test
    public void updateToUnknownPipelineIsRejected()
            throws Exception
    {
        pipelineExists("etl");
        when(pipelines.resolve("other")).thenReturn(Optional.absent());
        ScheduledJob job = service.createJob(interval("etl", "60"));

        try {
            service.updateJob(job.getId(), ScheduledJobUpdate.builder().pipelineName("other").build());
            fail();
        }
        catch (PipelineNotFoundException ex) {
            // expected
        }
        assertThat(service.getJob(job.getId()), is(job));
    }

    @Test
    public void disablingJobUnregistersIt()
            throws Exception
    {
        pipelineExists("etl");
        engine.start();
        ScheduledJob job = service.createJob(interval("etl", "60"));

        ScheduledJob updated = service.updateJob(job.getId(), ScheduledJobUpdate.builder().enabled(false).build());

        assertThat(updated.isEnabled(), is(false));
        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(sm.getRegistration(job.getId()).isPresent(), is(false));

        service.updateJob(job.getId(), ScheduledJobUpdate.builder().enabled(true).build());
        assertThat(engine.isRegistered(job.getId()), is(true));
    }

    @Test
    public void deleteJobRemovesRowAndRegistration()
            throws Exception
    {
        pipelineExists("etl");
        engine.start();
        ScheduledJob job = service.createJob(interval("etl", "60"));

        service.deleteJob(job.getId());

        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(sm.getRegistration(job.getId()).isPresent(), is(false));
        assertNotFound(() -> service.getJob(job.getId()));
        assertNotFound(() -> service.deleteJob(job.getId()));
    }

    @Test
    public void missingJobsAreNotFound()
    {
        UUID id = UUID.randomUUID();
        assertNotFound(() -> service.updateJob(id, ScheduledJobUpdate.builder().enabled(false).build()));
        assertNotFound(() -> service.deleteJob(id));
        assertNotFound(() -> service.getJobDetails(id));
        assertThat(service.getJobs(), is(empty()));
    }

    @Test
    public void syncRegistrationsSkipsInvalidAndDisabledJobs()
    {
        ScheduledJob valid = sm.insertJob(interval("etl", "60"));
        ScheduledJob invalid = sm.insertJob(interval("etl", "sixty"));
        ScheduledJob disabled = sm.insertJob(JobDefinition.definitionBuilder()
                .from(interval("etl", "60"))
                .isEnabled(false)
                .build());

        engine.start();
        assertThat(service.syncRegistrations(), is(1));

        assertThat(engine.isRegistered(valid.getId()), is(true));
        assertThat(engine.isRegistered(invalid.getId()), is(false));
        assertThat(engine.isRegistered(disabled.getId()), is(false));
    }
}
