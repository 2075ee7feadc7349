package io.conveyor.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;
import io.conveyor.core.database.DatabaseScheduledJobStoreManager;
import io.conveyor.core.database.DatabaseTestingUtils;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.TriggerKind;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.conveyor.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.class)
public class SchedulingEngineTest
{
    @Mock JobFiringHandler handler;
    @Mock SchedulingListener listener;
    @Mock SchedulingListener brokenListener;

    private DatabaseTestingUtils.TestingDatabase database;
    private DatabaseScheduledJobStoreManager sm;
    private SchedulingEngine engine;

    @Before
    public void setUp()
    {
        database = setupDatabase();
        sm = database.getScheduledJobStoreManager();
        engine = newEngine();
    }

    @After
    public void destroy()
    {
        engine.stop();
        database.close();
    }

    private SchedulingEngine newEngine()
    {
        return newEngine(Duration.ZERO);
    }

    private SchedulingEngine newEngine(Duration gracePeriod)
    {
        ScheduleConfig config = ScheduleConfig.defaultBuilder()
            .pollInterval(3600)  // ticks are driven by the tests
            .shutdownTimeout(5)
            .build();
        return new SchedulingEngine(sm, TestingTriggerFactories.triggerManager(), handler,
                ImmutableSet.of(brokenListener, listener), new StartupGraceGuard(gracePeriod), config);
    }

    private ScheduledJob insertJob(TriggerKind kind, String value, boolean enabled)
    {
        return sm.insertJob(JobDefinition.definitionBuilder()
                .pipelineName("etl")
                .triggerKind(kind)
                .triggerValue(value)
                .isEnabled(enabled)
                .source(JobSource.API)
                .build());
    }

    @Test
    public void registerRequiresRunningEngine()
            throws Exception
    {
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        try {
            engine.register(job);
            fail();
        }
        catch (SchedulerUnavailableException ex) {
            // expected
        }
        assertThat(engine.isRegistered(job.getId()), is(false));
    }

    @Test
    public void startAndStopAreIdempotent()
    {
        engine.start();
        Instant startedAt = engine.getStartedAt().get();
        engine.start();
        assertThat(engine.getStartedAt(), is(Optional.of(startedAt)));
        assertThat(engine.isRunning(), is(true));

        engine.stop();
        engine.stop();
        assertThat(engine.isRunning(), is(false));
        assertThat(engine.getStartedAt(), is(Optional.<Instant>absent()));
    }

    @Test
    public void stopDropsLiveRegistrations()
            throws Exception
    {
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        engine.stop();

        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(engine.runScheduleOnce(first), is(0));
        // the durable row stays for the next start
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(Optional.of(first)));
        verify(handler, never()).fire(any(JobFiring.class));
    }

    @Test
    public void registerStoresFirstFireTime()
            throws Exception
    {
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        Instant before = Instant.now();
        engine.register(job);
        Instant after = Instant.now();

        assertThat(engine.isRegistered(job.getId()), is(true));
        Instant next = sm.getRegistration(job.getId()).get().getNextFireTime().get();
        assertThat(next.getEpochSecond() % 60, is(0L));
        assertThat(next.isBefore(before.truncatedTo(ChronoUnit.SECONDS)), is(false));
        assertThat(next.isAfter(after.plusSeconds(60)), is(false));
    }

    @Test
    public void registerRejectsInvalidTrigger()
    {
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "soon", true);
        try {
            engine.register(job);
            fail();
        }
        catch (InvalidTriggerException ex) {
            // expected
        }
        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(sm.getRegistration(job.getId()).isPresent(), is(false));
    }

    @Test
    public void registerOfDisabledJobUnregisters()
            throws Exception
    {
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);

        engine.register(ImmutableScheduledJob.builder().from(job).isEnabled(false).build());

        assertThat(engine.isRegistered(job.getId()), is(false));
        assertThat(sm.getRegistration(job.getId()).isPresent(), is(false));
    }

    @Test
    public void unregisterWhileStoppedRemovesDurableState()
            throws Exception
    {
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        engine.stop();

        assertThat(engine.unregister(job.getId()), is(true));
        assertThat(sm.getRegistration(job.getId()).isPresent(), is(false));
        assertThat(engine.unregister(job.getId()), is(false));
    }

    @Test
    public void fireDueJobOnceForMissedInstants()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(true);
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        // three instants were missed
        Instant now = first.plusSeconds(150);
        assertThat(engine.runScheduleOnce(now), is(1));

        ArgumentCaptor<JobFiring> captor = ArgumentCaptor.forClass(JobFiring.class);
        verify(handler, timeout(5000)).fire(captor.capture());
        JobFiring firing = captor.getValue();
        assertThat(firing.getJob().getId(), is(job.getId()));
        assertThat(firing.getScheduledTime(), is(first));
        assertThat(firing.getFiredAt(), is(now));
        assertThat(firing.getEngineStartedAt(), is(engine.getStartedAt().get()));
        verify(listener, timeout(5000)).onFiringSucceeded(firing);

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getNextFireTime(), is(Optional.of(first.plusSeconds(180))));
        assertThat(reg.getLastFireTime(), is(Optional.of(now)));
        assertThat(reg.getFireCount(), is(1L));

        // nothing is due until the next instant
        assertThat(engine.runScheduleOnce(now.plusSeconds(1)), is(0));
    }

    @Test
    public void skipInstantWhilePreviousFiringIsInFlight()
            throws Exception
    {
        CountDownLatch release = new CountDownLatch(1);
        when(handler.fire(any(JobFiring.class))).thenAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return true;
        });
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        assertThat(engine.runScheduleOnce(first), is(1));
        assertThat(engine.isInFlight(job.getId()), is(true));

        Instant second = first.plusSeconds(60);
        assertThat(engine.runScheduleOnce(second), is(0));

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getNextFireTime(), is(Optional.of(second.plusSeconds(60))));
        assertThat(reg.getFireCount(), is(1L));

        release.countDown();
        verify(listener, timeout(5000)).onFiringSucceeded(any(JobFiring.class));
        verify(handler, timeout(5000).times(1)).fire(any(JobFiring.class));
    }

    @Test
    public void failedFiringIsReportedToEveryListener()
            throws Exception
    {
        RuntimeException error = new RuntimeException("backend is down");
        when(handler.fire(any(JobFiring.class))).thenThrow(error);
        doThrow(new IllegalStateException("broken listener"))
            .when(brokenListener).onFiringFailed(any(JobFiring.class), any(Exception.class));

        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        engine.runScheduleOnce(first);

        verify(brokenListener, timeout(5000)).onFiringFailed(any(JobFiring.class), eq(error));
        verify(listener, timeout(5000)).onFiringFailed(any(JobFiring.class), eq(error));
        verify(listener, never()).onFiringSucceeded(any(JobFiring.class));
    }

    @Test
    public void skippedFiringIsNotSuccess()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(false);
        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        engine.runScheduleOnce(first);

        verify(handler, timeout(5000)).fire(any(JobFiring.class));
        verify(listener, never()).onFiringSucceeded(any(JobFiring.class));
        verify(listener, never()).onFiringFailed(any(JobFiring.class), any(Exception.class));
    }

    @Test
    public void anotherEngineDoesNotFireClaimedInstant()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(true);
        SchedulingEngine other = newEngine();
        try {
            engine.start();
            other.start();
            ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
            engine.register(job);
            other.register(job);
            Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

            assertThat(engine.runScheduleOnce(first), is(1));
            assertThat(other.runScheduleOnce(first), is(0));

            verify(handler, timeout(5000).times(1)).fire(any(JobFiring.class));
            assertThat(sm.getRegistration(job.getId()).get().getFireCount(), is(1L));
        }
        finally {
            other.stop();
        }
    }

    @Test
    public void dueInstantWithinGracePeriodIsLeftToAnotherEngine()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(true);
        SchedulingEngine restarted = newEngine(Duration.ofHours(1));
        try {
            engine.start();
            restarted.start();
            ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
            restarted.register(job);
            engine.register(job);
            Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

            assertThat(restarted.runScheduleOnce(first), is(0));
            assertThat(restarted.runScheduleOnce(first.plusSeconds(60)), is(0));

            // nothing was claimed
            StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
            assertThat(reg.getNextFireTime(), is(Optional.of(first)));
            assertThat(reg.getFireCount(), is(0L));
            verify(handler, never()).fire(any(JobFiring.class));

            assertThat(engine.runScheduleOnce(first), is(1));
            ArgumentCaptor<JobFiring> captor = ArgumentCaptor.forClass(JobFiring.class);
            verify(handler, timeout(5000)).fire(captor.capture());
            assertThat(captor.getValue().getScheduledTime(), is(first));
            assertThat(sm.getRegistration(job.getId()).get().getFireCount(), is(1L));
        }
        finally {
            restarted.stop();
        }
    }

    @Test
    public void blockingListenerDoesNotKeepJobInFlight()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class)))
            .thenThrow(new RuntimeException("backend is down"))
            .thenReturn(true);
        CountDownLatch notified = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            notified.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(listener).onFiringFailed(any(JobFiring.class), any(Exception.class));

        engine.start();
        ScheduledJob job = insertJob(TriggerKind.INTERVAL, "60", true);
        engine.register(job);
        Instant first = sm.getRegistration(job.getId()).get().getNextFireTime().get();

        try {
            assertThat(engine.runScheduleOnce(first), is(1));
            assertThat(notified.await(5, TimeUnit.SECONDS), is(true));
            assertThat(engine.isInFlight(job.getId()), is(false));

            // the next instant is claimed, not skipped
            assertThat(engine.runScheduleOnce(first.plusSeconds(60)), is(1));
            assertThat(sm.getRegistration(job.getId()).get().getFireCount(), is(2L));
        }
        finally {
            release.countDown();
        }
        verify(handler, timeout(5000).times(2)).fire(any(JobFiring.class));
    }

    @Test
    public void futureStartDateHoldsFiringsUntilIt()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(true);
        engine.start();
        Instant start = Instant.now().plus(2, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);
        ScheduledJob job = sm.insertJob(JobDefinition.definitionBuilder()
                .pipelineName("etl")
                .triggerKind(TriggerKind.INTERVAL)
                .triggerValue("60")
                .isEnabled(true)
                .startDate(start)
                .source(JobSource.API)
                .build());
        engine.register(job);
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(Optional.of(start)));

        assertThat(engine.runScheduleOnce(Instant.now()), is(0));
        assertThat(engine.runScheduleOnce(start.minusSeconds(1)), is(0));
        verify(handler, never()).fire(any(JobFiring.class));

        assertThat(engine.runScheduleOnce(start), is(1));
        ArgumentCaptor<JobFiring> captor = ArgumentCaptor.forClass(JobFiring.class);
        verify(handler, timeout(5000)).fire(captor.capture());
        assertThat(captor.getValue().getScheduledTime(), is(start));
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(Optional.of(start.plusSeconds(60))));
    }

    @Test
    public void oneOffJobFiresOnlyOnce()
            throws Exception
    {
        when(handler.fire(any(JobFiring.class))).thenReturn(true);
        engine.start();
        Instant at = Instant.now().plusSeconds(3600).truncatedTo(ChronoUnit.SECONDS);
        ScheduledJob job = insertJob(TriggerKind.DATE, at.toString(), true);
        engine.register(job);

        assertThat(engine.runScheduleOnce(at), is(1));
        assertThat(engine.runScheduleOnce(at.plusSeconds(3600)), is(0));

        verify(handler, timeout(5000).times(1)).fire(any(JobFiring.class));
        assertThat(sm.getRegistration(job.getId()).get().getNextFireTime(), is(Optional.<Instant>absent()));
    }

    @Test
    public void listJobsWithoutRunningEngine()
    {
        ScheduledJob enabled = insertJob(TriggerKind.INTERVAL, "60", true);
        ScheduledJob disabled = insertJob(TriggerKind.INTERVAL, "60", false);

        List<JobDetails> details = engine.listJobs();
        assertThat(details.size(), is(2));

        JobDetails first = findDetails(details, enabled.getId());
        assertThat(first.getJob(), is(enabled));
        assertThat(first.getRegistered(), is(false));
        assertThat(first.getNextFireTime().isPresent(), is(true));
        assertThat(first.getFireCount(), is(0L));

        JobDetails second = findDetails(details, disabled.getId());
        assertThat(second.getJob(), is(disabled));
        assertThat(second.getNextFireTime().isPresent(), is(false));
    }

    @Test
    public void getJobOfMissingIdIsNotFound()
    {
        DatabaseTestingUtils.assertNotFound(() -> engine.getJob(UUID.randomUUID()));
    }

    private static JobDetails findDetails(List<JobDetails> details, UUID jobId)
    {
        for (JobDetails d : details) {
            if (d.getJob().getId().equals(jobId)) {
                return d;
            }
        }
        throw new AssertionError("No details of job " + jobId);
    }
}
