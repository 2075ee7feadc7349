package io.conveyor.core.schedule;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import com.google.common.base.Optional;

public interface ScheduledJobStoreManager
{
    List<ScheduledJob> getJobs();

    ScheduledJob getJobById(UUID id)
        throws JobNotFoundException;

    List<ScheduledJob> getJobsBySource(JobSource source);

    ScheduledJob insertJob(JobDefinition job);

    ScheduledJob updateJob(UUID id, JobDefinition job)
        throws JobNotFoundException;

    void deleteJob(UUID id)
        throws JobNotFoundException;

    Optional<StoredJobRegistration> getRegistration(UUID jobId);

    List<StoredJobRegistration> getRegistrations();

    StoredJobRegistration putRegistration(UUID jobId, Optional<Instant> nextFireTime);

    boolean deleteRegistration(UUID jobId);

    interface RegistrationLockAction <T>
    {
        T call(RegistrationControl control, StoredJobRegistration registration);
    }

    /**
     * Locks the registration of a job and runs {@code func} if it is due at {@code now}.
     * Returns absent when the row is missing, not due, or locked by another process.
     */
    <T> Optional<T> lockDueRegistration(UUID jobId, Instant now, RegistrationLockAction<T> func);
}
