package io.conveyor.core.database;

import java.time.Instant;
import java.util.UUID;

import com.google.common.base.Optional;
import io.conveyor.core.schedule.JobDefinition;
import io.conveyor.core.schedule.JobSource;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.core.schedule.StoredJobRegistration;
import io.conveyor.spi.TriggerKind;
import org.jdbi.v3.core.Handle;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.conveyor.core.database.DatabaseTestingUtils.assertNotFound;
import static io.conveyor.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class DatabaseScheduledJobStoreManagerTest
{
    private DatabaseTestingUtils.TestingDatabase database;
    private DatabaseScheduledJobStoreManager sm;

    @Before
    public void setUp()
    {
        database = setupDatabase();
        sm = database.getScheduledJobStoreManager();
    }

    @After
    public void destroy()
    {
        database.close();
    }

    private static JobDefinition cron(String pipelineName, JobSource source)
    {
        return JobDefinition.definitionBuilder()
            .pipelineName(pipelineName)
            .triggerKind(TriggerKind.CRON)
            .triggerValue("0 9 * * *")
            .isEnabled(true)
            .source(source)
            .build();
    }

    @Test
    public void insertAndGetJob()
            throws Exception
    {
        JobDefinition def = JobDefinition.definitionBuilder()
            .from(cron("etl", JobSource.API))
            .startDate(Instant.parse("2025-01-01T00:00:00Z"))
            .endDate(Instant.parse("2025-12-31T23:59:59.999999Z"))
            .runConfigId("nightly")
            .build();
        ScheduledJob job = sm.insertJob(def);

        assertThat(JobDefinition.copyOf(job), is(def));
        assertThat(sm.getJobById(job.getId()), is(job));
        assertThat(sm.getJobs(), contains(job));
        assertThat(job.getStartDate(), is(Optional.of(Instant.parse("2025-01-01T00:00:00Z"))));
        assertThat(job.getEndDate(), is(Optional.of(Instant.parse("2025-12-31T23:59:59.999999Z"))));
    }

    @Test
    public void committedWritesAreVisibleToOtherConnections()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        Instant due = Instant.parse("2025-01-01T09:00:00Z");
        Instant next = Instant.parse("2025-01-02T09:00:00Z");
        sm.putRegistration(job.getId(), Optional.of(due));
        sm.lockDueRegistration(job.getId(), due, (control, stored) -> {
            control.recordFiring(due, Optional.of(next));
            return true;
        });

        try (Handle handle = database.getJdbi().open()) {
            String pipelineName = handle.createQuery("select pipeline_name from scheduled_jobs where id = :id")
                .bind("id", job.getId())
                .mapTo(String.class)
                .one();
            assertThat(pipelineName, is("etl"));

            long nextFireTime = handle.createQuery("select next_fire_time from job_registrations where job_id = :id")
                .bind("id", job.getId())
                .mapTo(Long.class)
                .one();
            assertThat(nextFireTime, is(next.toEpochMilli()));
        }
    }

    @Test
    public void failedTransactionIsRolledBack()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        Instant due = Instant.parse("2025-01-01T09:00:00Z");
        sm.putRegistration(job.getId(), Optional.of(due));

        try {
            sm.lockDueRegistration(job.getId(), due, (control, stored) -> {
                control.recordFiring(due, Optional.of(due.plusSeconds(60)));
                throw new IllegalStateException("handler failed");
            });
            fail();
        }
        catch (IllegalStateException ex) {
            assertThat(ex.getMessage(), is("handler failed"));
        }

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getNextFireTime(), is(Optional.of(due)));
        assertThat(reg.getFireCount(), is(0L));

        // the connection went back clean and the next transaction commits
        sm.lockDueRegistration(job.getId(), due, (control, stored) -> {
            control.recordFiring(due, Optional.of(due.plusSeconds(60)));
            return true;
        });
        assertThat(sm.getRegistration(job.getId()).get().getFireCount(), is(1L));
    }

    @Test
    public void getJobsBySource()
    {
        ScheduledJob api = sm.insertJob(cron("a", JobSource.API));
        ScheduledJob manifest = sm.insertJob(cron("b", JobSource.MANIFEST_SCHEDULE));
        ScheduledJob restart = sm.insertJob(cron("c", JobSource.MANIFEST_RESTART));

        assertThat(sm.getJobsBySource(JobSource.API), contains(api));
        assertThat(sm.getJobsBySource(JobSource.MANIFEST_SCHEDULE), contains(manifest));
        assertThat(sm.getJobsBySource(JobSource.MANIFEST_RESTART), contains(restart));
    }

    @Test
    public void updateJobReplacesFields()
            throws Exception
    {
        ScheduledJob job = sm.insertJob(JobDefinition.definitionBuilder()
                .from(cron("etl", JobSource.API))
                .runConfigId("nightly")
                .build());

        JobDefinition changed = JobDefinition.definitionBuilder()
            .from(JobDefinition.copyOf(job))
            .triggerKind(TriggerKind.INTERVAL)
            .triggerValue("300")
            .isEnabled(false)
            .runConfigId(Optional.absent())
            .build();
        ScheduledJob updated = sm.updateJob(job.getId(), changed);

        assertThat(updated.getId(), is(job.getId()));
        assertThat(updated.getTriggerKind(), is(TriggerKind.INTERVAL));
        assertThat(updated.getTriggerValue(), is("300"));
        assertThat(updated.isEnabled(), is(false));
        assertThat(updated.getRunConfigId(), is(Optional.<String>absent()));
        assertThat(updated.getCreatedAt(), is(job.getCreatedAt()));
    }

    @Test
    public void missingJobsAreNotFound()
    {
        UUID missing = UUID.randomUUID();
        assertNotFound(() -> sm.getJobById(missing));
        assertNotFound(() -> sm.updateJob(missing, cron("etl", JobSource.API)));
        assertNotFound(() -> sm.deleteJob(missing));
    }

    @Test
    public void deleteJobRemovesRegistration()
            throws Exception
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        sm.putRegistration(job.getId(), Optional.of(Instant.parse("2025-01-01T09:00:00Z")));

        sm.deleteJob(job.getId());

        assertNotFound(() -> sm.getJobById(job.getId()));
        assertThat(sm.getRegistration(job.getId()), is(Optional.<StoredJobRegistration>absent()));
        assertThat(sm.getJobs(), is(empty()));
    }

    @Test
    public void putRegistrationKeepsHistory()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        Instant t1 = Instant.parse("2025-01-01T09:00:00Z");
        Instant t2 = Instant.parse("2025-01-02T09:00:00Z");

        StoredJobRegistration reg = sm.putRegistration(job.getId(), Optional.of(t1));
        assertThat(reg.getNextFireTime(), is(Optional.of(t1)));
        assertThat(reg.getFireCount(), is(0L));

        sm.lockDueRegistration(job.getId(), t1, (control, stored) -> {
            control.recordFiring(t1, Optional.of(t2));
            return true;
        });

        StoredJobRegistration replaced = sm.putRegistration(job.getId(), Optional.of(t1.plusSeconds(3600)));
        assertThat(replaced.getNextFireTime(), is(Optional.of(t1.plusSeconds(3600))));
        assertThat(replaced.getLastFireTime(), is(Optional.of(t1)));
        assertThat(replaced.getFireCount(), is(1L));
    }

    @Test
    public void lockDueRegistrationRunsOnlyWhenDue()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        Instant due = Instant.parse("2025-01-01T09:00:00Z");
        Instant next = Instant.parse("2025-01-02T09:00:00Z");
        sm.putRegistration(job.getId(), Optional.of(due));

        Optional<Instant> early = sm.lockDueRegistration(job.getId(), due.minusMillis(1), (control, stored) -> {
            control.recordFiring(due, Optional.of(next));
            return stored.getNextFireTime().get();
        });
        assertThat(early, is(Optional.<Instant>absent()));

        Optional<Instant> claimed = sm.lockDueRegistration(job.getId(), due, (control, stored) -> {
            control.recordFiring(due, Optional.of(next));
            return stored.getNextFireTime().get();
        });
        assertThat(claimed, is(Optional.of(due)));

        // the row moved to the next time, so the same instant can't be claimed twice
        Optional<Instant> again = sm.lockDueRegistration(job.getId(), due, (control, stored) -> stored.getNextFireTime().get());
        assertThat(again, is(Optional.<Instant>absent()));

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getNextFireTime(), is(Optional.of(next)));
        assertThat(reg.getLastFireTime(), is(Optional.of(due)));
        assertThat(reg.getFireCount(), is(1L));
    }

    @Test
    public void skipToMovesNextFireTimeWithoutCounting()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        Instant due = Instant.parse("2025-01-01T09:00:00Z");
        sm.putRegistration(job.getId(), Optional.of(due));

        sm.lockDueRegistration(job.getId(), due.plusSeconds(5), (control, stored) -> {
            control.skipTo(Optional.absent());
            return true;
        });

        StoredJobRegistration reg = sm.getRegistration(job.getId()).get();
        assertThat(reg.getNextFireTime(), is(Optional.<Instant>absent()));
        assertThat(reg.getFireCount(), is(0L));
    }

    @Test
    public void finishedRegistrationIsNeverDue()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        sm.putRegistration(job.getId(), Optional.absent());

        Optional<Boolean> claimed = sm.lockDueRegistration(job.getId(), Instant.now(), (control, stored) -> true);
        assertThat(claimed, is(Optional.<Boolean>absent()));
    }

    @Test
    public void deleteRegistration()
    {
        ScheduledJob job = sm.insertJob(cron("etl", JobSource.API));
        sm.putRegistration(job.getId(), Optional.of(Instant.now()));

        assertThat(sm.deleteRegistration(job.getId()), is(true));
        assertThat(sm.deleteRegistration(job.getId()), is(false));
        assertThat(sm.getRegistrations(), is(empty()));
    }
}
