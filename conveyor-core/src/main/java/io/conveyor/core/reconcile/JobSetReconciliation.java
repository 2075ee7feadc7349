package io.conveyor.core.reconcile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;

import io.conveyor.core.ResourceNotFoundException;
import io.conveyor.core.schedule.JobDefinition;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.core.schedule.ScheduledJobService;
import io.conveyor.core.schedule.ScheduledJobUpdate;
import io.conveyor.spi.InvalidTriggerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Three-way diff of one class of manifest jobs: desired definitions keyed by {@code K}
 * against the stored rows of the same class.
 *
 * Missing keys are created, keys whose stored values differ are updated, and stored
 * keys that are neither desired nor kept are deleted. When several rows share a key,
 * the oldest one is kept and the others are deleted.
 */
public class JobSetReconciliation <K>
{
    private static final Logger logger = LoggerFactory.getLogger(JobSetReconciliation.class);

    private final String name;
    private final Function<ScheduledJob, K> keyOf;
    private final BiPredicate<ScheduledJob, JobDefinition> differs;
    private final Function<JobDefinition, ScheduledJobUpdate> updateOf;

    public JobSetReconciliation(
            String name,
            Function<ScheduledJob, K> keyOf,
            BiPredicate<ScheduledJob, JobDefinition> differs,
            Function<JobDefinition, ScheduledJobUpdate> updateOf)
    {
        this.name = name;
        this.keyOf = keyOf;
        this.differs = differs;
        this.updateOf = updateOf;
    }

    /**
     * @param desired definitions declared by manifests
     * @param kept keys whose declaration could not be read; their stored rows are left as they are
     * @param current stored rows of this class, oldest first
     */
    public ReconcileSummary apply(ScheduledJobService service,
            Map<K, JobDefinition> desired, Set<K> kept, List<ScheduledJob> current)
    {
        int created = 0;
        int updated = 0;
        int deleted = 0;
        int failed = 0;

        Map<K, ScheduledJob> existing = new LinkedHashMap<>();
        for (ScheduledJob job : current) {
            K key = keyOf.apply(job);
            if (existing.containsKey(key)) {
                logger.warn("Deleting duplicate {} job {} for {}", name, job.getId(), key);
                if (delete(service, job)) {
                    deleted++;
                }
                else {
                    failed++;
                }
            }
            else {
                existing.put(key, job);
            }
        }

        for (Map.Entry<K, JobDefinition> pair : desired.entrySet()) {
            ScheduledJob job = existing.get(pair.getKey());
            try {
                if (job == null) {
                    ScheduledJob createdJob = service.createJob(pair.getValue());
                    logger.info("Created {} job {} for {}", name, createdJob.getId(), pair.getKey());
                    created++;
                }
                else if (differs.test(job, pair.getValue())) {
                    service.updateJob(job.getId(), updateOf.apply(pair.getValue()));
                    logger.info("Updated {} job {} for {}", name, job.getId(), pair.getKey());
                    updated++;
                }
            }
            catch (ResourceNotFoundException | InvalidTriggerException | RuntimeException ex) {
                logger.warn("Failed to reconcile {} job for {}: {}", name, pair.getKey(), ex.toString());
                failed++;
            }
        }

        for (Map.Entry<K, ScheduledJob> pair : existing.entrySet()) {
            if (desired.containsKey(pair.getKey()) || kept.contains(pair.getKey())) {
                continue;
            }
            if (delete(service, pair.getValue())) {
                logger.info("Deleted {} job {} for {} that is no longer declared", name, pair.getValue().getId(), pair.getKey());
                deleted++;
            }
            else {
                failed++;
            }
        }

        return ReconcileSummary.of(created, updated, deleted, 0, failed);
    }

    private boolean delete(ScheduledJobService service, ScheduledJob job)
    {
        try {
            service.deleteJob(job.getId());
            return true;
        }
        catch (ResourceNotFoundException ex) {
            // deleted concurrently
            logger.debug("{} job {} is already deleted", name, job.getId());
            return true;
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to delete {} job {}: {}", name, job.getId(), ex.toString());
            return false;
        }
    }
}
