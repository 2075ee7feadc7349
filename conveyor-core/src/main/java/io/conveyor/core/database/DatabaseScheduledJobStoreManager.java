package io.conveyor.core.database;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.conveyor.core.schedule.ImmutableScheduledJob;
import io.conveyor.core.schedule.ImmutableStoredJobRegistration;
import io.conveyor.core.schedule.JobDefinition;
import io.conveyor.core.schedule.JobNotFoundException;
import io.conveyor.core.schedule.JobSource;
import io.conveyor.core.schedule.RegistrationControl;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.core.schedule.ScheduledJobStoreManager;
import io.conveyor.core.schedule.StoredJobRegistration;
import io.conveyor.spi.TriggerKind;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class DatabaseScheduledJobStoreManager
        extends BasicDatabaseStoreManager<DatabaseScheduledJobStoreManager.Dao>
        implements ScheduledJobStoreManager
{
    @Inject
    public DatabaseScheduledJobStoreManager(TransactionManager transactionManager, DatabaseConfig config)
    {
        super(config, dao(config.getType()), transactionManager);
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
        case "postgresql":
            return PgDao.class;
        case "h2":
            return H2Dao.class;
        default:
            throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    @Override
    public List<ScheduledJob> getJobs()
    {
        return autoCommit((handle, dao) -> dao.getJobs());
    }

    @Override
    public ScheduledJob getJobById(UUID id)
        throws JobNotFoundException
    {
        ScheduledJob job = autoCommit((handle, dao) -> dao.getJobById(id));
        if (job == null) {
            throw new JobNotFoundException(id);
        }
        return job;
    }

    @Override
    public List<ScheduledJob> getJobsBySource(JobSource source)
    {
        return autoCommit((handle, dao) -> dao.getJobsBySource(source.getName()));
    }

    @Override
    public ScheduledJob insertJob(JobDefinition job)
    {
        UUID id = UUID.randomUUID();
        return transaction((handle, dao) -> {
            Instant now = Instant.now();
            dao.insertJob(id,
                    job.getPipelineName(),
                    job.getTriggerKind().getName(),
                    job.getTriggerValue(),
                    job.isEnabled(),
                    timestampOrNull(job.getStartDate()),
                    timestampOrNull(job.getEndDate()),
                    job.getSource().getName(),
                    job.getRunConfigId().orNull(),
                    Timestamp.from(now));
            return dao.getJobById(id);
        });
    }

    @Override
    public ScheduledJob updateJob(UUID id, JobDefinition job)
        throws JobNotFoundException
    {
        return transaction((handle, dao) -> {
            int n = dao.updateJob(id,
                    job.getPipelineName(),
                    job.getTriggerKind().getName(),
                    job.getTriggerValue(),
                    job.isEnabled(),
                    timestampOrNull(job.getStartDate()),
                    timestampOrNull(job.getEndDate()),
                    job.getSource().getName(),
                    job.getRunConfigId().orNull(),
                    Timestamp.from(Instant.now()));
            if (n <= 0) {
                throw new JobNotFoundException(id);
            }
            return dao.getJobById(id);
        }, JobNotFoundException.class);
    }

    @Override
    public void deleteJob(UUID id)
        throws JobNotFoundException
    {
        this.<Void, JobNotFoundException>transaction((handle, dao) -> {
            dao.deleteRegistration(id);
            int n = dao.deleteJob(id);
            if (n <= 0) {
                throw new JobNotFoundException(id);
            }
            return null;
        }, JobNotFoundException.class);
    }

    @Override
    public Optional<StoredJobRegistration> getRegistration(UUID jobId)
    {
        return Optional.fromNullable(autoCommit((handle, dao) -> dao.getRegistration(jobId)));
    }

    @Override
    public List<StoredJobRegistration> getRegistrations()
    {
        return autoCommit((handle, dao) -> dao.getRegistrations());
    }

    @Override
    public StoredJobRegistration putRegistration(UUID jobId, Optional<Instant> nextFireTime)
    {
        return transaction((handle, dao) -> {
            Timestamp now = Timestamp.from(Instant.now());
            int n = dao.updateNextFireTime(jobId, epochMillisOrNull(nextFireTime), now);
            if (n <= 0) {
                dao.insertRegistration(jobId, epochMillisOrNull(nextFireTime), now);
            }
            return dao.getRegistration(jobId);
        });
    }

    @Override
    public boolean deleteRegistration(UUID jobId)
    {
        return transaction((handle, dao) -> dao.deleteRegistration(jobId) > 0);
    }

    @Override
    public <T> Optional<T> lockDueRegistration(UUID jobId, Instant now, RegistrationLockAction<T> func)
    {
        return transaction((handle, dao) -> {
            StoredJobRegistration registration;
            if (dao instanceof PgDao) {
                // another process working on the same row skips it instead of waiting
                registration = ((PgDao) dao).lockDueRegistrationSkipLocked(jobId, now.toEpochMilli());
            }
            else {
                registration = dao.lockDueRegistration(jobId, now.toEpochMilli());
            }
            if (registration == null) {
                return Optional.<T>absent();
            }
            return Optional.fromNullable(func.call(new DatabaseRegistrationControl(dao, jobId), registration));
        });
    }

    private static class DatabaseRegistrationControl
            implements RegistrationControl
    {
        private final Dao dao;
        private final UUID jobId;

        DatabaseRegistrationControl(Dao dao, UUID jobId)
        {
            this.dao = dao;
            this.jobId = jobId;
        }

        @Override
        public void recordFiring(Instant firedAt, Optional<Instant> nextFireTime)
        {
            dao.recordFiring(jobId, firedAt.toEpochMilli(), epochMillisOrNull(nextFireTime), Timestamp.from(Instant.now()));
        }

        @Override
        public void skipTo(Optional<Instant> nextFireTime)
        {
            dao.updateNextFireTime(jobId, epochMillisOrNull(nextFireTime), Timestamp.from(Instant.now()));
        }
    }

    public interface H2Dao
            extends Dao
    {
    }

    public interface PgDao
            extends Dao
    {
        @SqlQuery("select * from job_registrations" +
                " where job_id = :jobId" +
                " and :now >= next_fire_time" +
                " for update skip locked")
        StoredJobRegistration lockDueRegistrationSkipLocked(@Bind("jobId") UUID jobId, @Bind("now") long now);
    }

    public interface Dao
    {
        @SqlQuery("select * from scheduled_jobs" +
                " order by created_at asc, id asc")
        List<ScheduledJob> getJobs();

        @SqlQuery("select * from scheduled_jobs" +
                " where id = :id")
        ScheduledJob getJobById(@Bind("id") UUID id);

        @SqlQuery("select * from scheduled_jobs" +
                " where source = :source" +
                " order by created_at asc, id asc")
        List<ScheduledJob> getJobsBySource(@Bind("source") String source);

        @SqlUpdate("insert into scheduled_jobs" +
                " (id, pipeline_name, trigger_type, trigger_value, enabled, start_date, end_date, source, run_config_id, created_at, updated_at)" +
                " values (:id, :pipelineName, :triggerType, :triggerValue, :enabled, :startDate, :endDate, :source, :runConfigId, :now, :now)")
        void insertJob(@Bind("id") UUID id,
                @Bind("pipelineName") String pipelineName,
                @Bind("triggerType") String triggerType,
                @Bind("triggerValue") String triggerValue,
                @Bind("enabled") boolean enabled,
                @Bind("startDate") Timestamp startDate,
                @Bind("endDate") Timestamp endDate,
                @Bind("source") String source,
                @Bind("runConfigId") String runConfigId,
                @Bind("now") Timestamp now);

        @SqlUpdate("update scheduled_jobs" +
                " set pipeline_name = :pipelineName, trigger_type = :triggerType, trigger_value = :triggerValue," +
                " enabled = :enabled, start_date = :startDate, end_date = :endDate," +
                " source = :source, run_config_id = :runConfigId, updated_at = :now" +
                " where id = :id")
        int updateJob(@Bind("id") UUID id,
                @Bind("pipelineName") String pipelineName,
                @Bind("triggerType") String triggerType,
                @Bind("triggerValue") String triggerValue,
                @Bind("enabled") boolean enabled,
                @Bind("startDate") Timestamp startDate,
                @Bind("endDate") Timestamp endDate,
                @Bind("source") String source,
                @Bind("runConfigId") String runConfigId,
                @Bind("now") Timestamp now);

        @SqlUpdate("delete from scheduled_jobs" +
                " where id = :id")
        int deleteJob(@Bind("id") UUID id);

        @SqlQuery("select * from job_registrations" +
                " where job_id = :jobId")
        StoredJobRegistration getRegistration(@Bind("jobId") UUID jobId);

        @SqlQuery("select * from job_registrations" +
                " order by job_id asc")
        List<StoredJobRegistration> getRegistrations();

        @SqlQuery("select * from job_registrations" +
                " where job_id = :jobId" +
                " and :now >= next_fire_time" +
                " for update")
        StoredJobRegistration lockDueRegistration(@Bind("jobId") UUID jobId, @Bind("now") long now);

        @SqlUpdate("insert into job_registrations" +
                " (job_id, next_fire_time, last_fire_time, fire_count, updated_at)" +
                " values (:jobId, :nextFireTime, null, 0, :now)")
        void insertRegistration(@Bind("jobId") UUID jobId, @Bind("nextFireTime") Long nextFireTime, @Bind("now") Timestamp now);

        @SqlUpdate("update job_registrations" +
                " set next_fire_time = :nextFireTime, updated_at = :now" +
                " where job_id = :jobId")
        int updateNextFireTime(@Bind("jobId") UUID jobId, @Bind("nextFireTime") Long nextFireTime, @Bind("now") Timestamp now);

        @SqlUpdate("update job_registrations" +
                " set next_fire_time = :nextFireTime, last_fire_time = :firedAt, fire_count = fire_count + 1, updated_at = :now" +
                " where job_id = :jobId")
        int recordFiring(@Bind("jobId") UUID jobId, @Bind("firedAt") long firedAt, @Bind("nextFireTime") Long nextFireTime, @Bind("now") Timestamp now);

        @SqlUpdate("delete from job_registrations" +
                " where job_id = :jobId")
        int deleteRegistration(@Bind("jobId") UUID jobId);
    }

    static class ScheduledJobMapper
            implements RowMapper<ScheduledJob>
    {
        @Override
        public ScheduledJob map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableScheduledJob.builder()
                .id(getUuid(r, "id"))
                .pipelineName(r.getString("pipeline_name"))
                .triggerKind(TriggerKind.of(r.getString("trigger_type")))
                .triggerValue(r.getString("trigger_value"))
                .isEnabled(r.getBoolean("enabled"))
                .startDate(getOptionalTimestampInstant(r, "start_date"))
                .endDate(getOptionalTimestampInstant(r, "end_date"))
                .source(JobSource.of(r.getString("source")))
                .runConfigId(getOptionalString(r, "run_config_id"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }

    static class StoredJobRegistrationMapper
            implements RowMapper<StoredJobRegistration>
    {
        @Override
        public StoredJobRegistration map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableStoredJobRegistration.builder()
                .jobId(getUuid(r, "job_id"))
                .nextFireTime(getOptionalEpochMillis(r, "next_fire_time"))
                .lastFireTime(getOptionalEpochMillis(r, "last_fire_time"))
                .fireCount(r.getLong("fire_count"))
                .updatedAt(getTimestampInstant(r, "updated_at"))
                .build();
        }
    }
}
