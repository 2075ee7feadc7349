package io.conveyor.core.reconcile;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.conveyor.core.schedule.JobDefinition;
import io.conveyor.core.schedule.JobSource;
import io.conveyor.core.schedule.ScheduledJob;
import io.conveyor.core.schedule.ScheduledJobService;
import io.conveyor.core.schedule.ScheduledJobUpdate;
import io.conveyor.core.schedule.TriggerManager;
import io.conveyor.spi.InvalidTriggerException;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.RestartDeclaration;
import io.conveyor.spi.ScheduleDeclaration;
import io.conveyor.spi.TriggerKind;
import io.conveyor.spi.TriggerTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes the manifest-sourced rows of the job store match what pipeline manifests declare.
 *
 * Three classes of rows are reconciled independently: recurring schedules, run-once dates
 * and daemon restarts. Rows created through the API are never touched.
 */
public class ManifestReconciler
{
    private static final Logger logger = LoggerFactory.getLogger(ManifestReconciler.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private final PipelineResolver pipelines;
    private final ScheduledJobService service;
    private final TriggerManager triggers;

    private final JobSetReconciliation<RecurringKey> recurringSet = new JobSetReconciliation<>(
            "recurring",
            job -> new RecurringKey(job.getPipelineName(), job.getRunConfigId()),
            (current, desired) -> current.getTriggerKind() != desired.getTriggerKind()
                || !current.getTriggerValue().equals(desired.getTriggerValue())
                || !current.getStartDate().equals(desired.getStartDate())
                || !current.getEndDate().equals(desired.getEndDate())
                || current.isEnabled() != desired.isEnabled(),
            desired -> ScheduledJobUpdate.builder()
                .trigger(desired.getTriggerKind(), desired.getTriggerValue())
                .startDate(desired.getStartDate())
                .endDate(desired.getEndDate())
                .enabled(desired.isEnabled())
                .build());

    private final JobSetReconciliation<String> runOnceSet = new JobSetReconciliation<>(
            "run-once",
            ScheduledJob::getPipelineName,
            (current, desired) -> !current.getTriggerValue().equals(desired.getTriggerValue()),
            desired -> ScheduledJobUpdate.builder()
                .triggerValue(desired.getTriggerValue())
                .build());

    private final JobSetReconciliation<String> restartSet = new JobSetReconciliation<>(
            "restart",
            ScheduledJob::getPipelineName,
            (current, desired) -> current.getTriggerKind() != desired.getTriggerKind()
                || !current.getTriggerValue().equals(desired.getTriggerValue()),
            desired -> ScheduledJobUpdate.builder()
                .trigger(desired.getTriggerKind(), desired.getTriggerValue())
                .build());

    @Inject
    public ManifestReconciler(PipelineResolver pipelines, ScheduledJobService service, TriggerManager triggers)
    {
        this.pipelines = pipelines;
        this.service = service;
        this.triggers = triggers;
    }

    public ReconcileSummary reconcile()
    {
        return reconcile(Instant.now());
    }

    @VisibleForTesting
    synchronized ReconcileSummary reconcile(Instant now)
    {
        List<Pipeline> discovered = pipelines.discoverAll(true);

        DesiredSet<RecurringKey> recurring = new DesiredSet<>();
        DesiredSet<String> runOnce = new DesiredSet<>();
        DesiredSet<String> restart = new DesiredSet<>();

        for (Pipeline pipeline : discovered) {
            for (ScheduleDeclaration declaration : pipeline.getSchedules()) {
                collectRecurring(pipeline, declaration, recurring);
            }
            if (pipeline.getRunOnceAt().isPresent()) {
                collectRunOnce(pipeline, pipeline.getRunOnceAt().get(), now, runOnce);
            }
            if (pipeline.getRestartDeclaration().isPresent()) {
                collectRestart(pipeline, pipeline.getRestartDeclaration().get(), restart);
            }
        }

        List<ScheduledJob> recurringRows = new ArrayList<>();
        List<ScheduledJob> runOnceRows = new ArrayList<>();
        for (ScheduledJob job : service.getJobsBySource(JobSource.MANIFEST_SCHEDULE)) {
            if (job.getTriggerKind() == TriggerKind.DATE) {
                runOnceRows.add(job);
            }
            else {
                recurringRows.add(job);
            }
        }
        List<ScheduledJob> restartRows = service.getJobsBySource(JobSource.MANIFEST_RESTART);

        ReconcileSummary summary = ReconcileSummary.of(0, 0, 0,
                recurring.skipped + runOnce.skipped + restart.skipped, 0);
        summary = summary.plus(recurringSet.apply(service, recurring.definitions, recurring.kept, recurringRows));
        summary = summary.plus(runOnceSet.apply(service, runOnce.definitions, runOnce.kept, runOnceRows));
        summary = summary.plus(restartSet.apply(service, restart.definitions, restart.kept, restartRows));

        if (summary.getWrites() > 0 || summary.getSkipped() > 0 || summary.getFailed() > 0) {
            logger.info("Reconciled manifests of {} pipelines: {}", discovered.size(), summary);
        }
        else {
            logger.debug("Manifests of {} pipelines are in sync with stored jobs", discovered.size());
        }
        return summary;
    }

    private void collectRecurring(Pipeline pipeline, ScheduleDeclaration declaration, DesiredSet<RecurringKey> desired)
    {
        Optional<String> runConfigId = nonBlank(declaration.getId());
        RecurringKey key = new RecurringKey(pipeline.getName(), runConfigId);

        if (desired.definitions.containsKey(key)) {
            logger.warn("Pipeline '{}' declares schedule {} more than once. Only the first declaration is used",
                    pipeline.getName(), key.describeRunConfig());
            desired.skipped++;
            return;
        }

        TriggerKind kind;
        String value;
        Optional<String> cron = nonBlank(declaration.getCron());
        Optional<String> interval = nonBlank(declaration.getIntervalSeconds());
        if (cron.isPresent()) {
            kind = TriggerKind.CRON;
            value = cron.get();
        }
        else if (interval.isPresent()) {
            kind = TriggerKind.INTERVAL;
            value = interval.get();
        }
        else {
            logger.warn("Schedule {} of pipeline '{}' has neither cron nor interval_seconds",
                    key.describeRunConfig(), pipeline.getName());
            desired.skip(key);
            return;
        }

        try {
            Optional<Instant> start = TriggerTimes.parseStart(declaration.getStart());
            Optional<Instant> end = TriggerTimes.parseEnd(declaration.getEnd());
            triggers.getTrigger(kind, value, start, end);

            desired.definitions.put(key, JobDefinition.definitionBuilder()
                    .pipelineName(pipeline.getName())
                    .triggerKind(kind)
                    .triggerValue(value)
                    .isEnabled(pipeline.isEnabled() && declaration.isEnabled())
                    .startDate(start)
                    .endDate(end)
                    .source(JobSource.MANIFEST_SCHEDULE)
                    .runConfigId(runConfigId)
                    .build());
        }
        catch (InvalidTriggerException ex) {
            logger.warn("Skipped invalid schedule {} of pipeline '{}': {}",
                    key.describeRunConfig(), pipeline.getName(), ex.getMessage());
            desired.skip(key);
        }
    }

    private void collectRunOnce(Pipeline pipeline, String runOnceAt, Instant now, DesiredSet<String> desired)
    {
        String value = runOnceAt.trim();
        if (value.isEmpty()) {
            return;
        }
        try {
            Instant at = TriggerTimes.parseDateTime(value);
            if (!at.isAfter(now)) {
                logger.debug("run_once_at {} of pipeline '{}' is not in the future. Ignored", value, pipeline.getName());
                return;
            }
            triggers.getTrigger(TriggerKind.DATE, value, Optional.absent(), Optional.absent());

            desired.definitions.put(pipeline.getName(), JobDefinition.definitionBuilder()
                    .pipelineName(pipeline.getName())
                    .triggerKind(TriggerKind.DATE)
                    .triggerValue(value)
                    .isEnabled(true)
                    .source(JobSource.MANIFEST_SCHEDULE)
                    .build());
        }
        catch (InvalidTriggerException ex) {
            logger.warn("Skipped invalid run_once_at of pipeline '{}': {}", pipeline.getName(), ex.getMessage());
            desired.skip(pipeline.getName());
        }
    }

    private void collectRestart(Pipeline pipeline, RestartDeclaration declaration, DesiredSet<String> desired)
    {
        String value = declaration.getInterval().trim();
        if (value.isEmpty()) {
            return;
        }
        try {
            TriggerKind kind = restartTriggerKind(value);
            triggers.getTrigger(kind, value, Optional.absent(), Optional.absent());

            desired.definitions.put(pipeline.getName(), JobDefinition.definitionBuilder()
                    .pipelineName(pipeline.getName())
                    .triggerKind(kind)
                    .triggerValue(value)
                    .isEnabled(true)
                    .source(JobSource.MANIFEST_RESTART)
                    .build());
        }
        catch (InvalidTriggerException ex) {
            logger.warn("Skipped invalid restart_interval of pipeline '{}': {}", pipeline.getName(), ex.getMessage());
            desired.skip(pipeline.getName());
        }
    }

    static TriggerKind restartTriggerKind(String interval)
        throws InvalidTriggerException
    {
        if (WHITESPACE.split(interval.trim()).length == 5) {
            return TriggerKind.CRON;
        }
        if (INTEGER.matcher(interval.trim()).matches()) {
            return TriggerKind.INTERVAL;
        }
        throw new InvalidTriggerException("Restart interval must be a 5-field cron expression or a number of seconds: '" + interval + "'");
    }

    private static Optional<String> nonBlank(Optional<String> value)
    {
        if (value.isPresent() && !value.get().trim().isEmpty()) {
            return Optional.of(value.get().trim());
        }
        return Optional.absent();
    }

    private static class DesiredSet <K>
    {
        private final Map<K, JobDefinition> definitions = new LinkedHashMap<>();
        private final Set<K> kept = new HashSet<>();
        private int skipped = 0;

        void skip(K key)
        {
            kept.add(key);
            skipped++;
        }
    }

    static final class RecurringKey
    {
        private final String pipelineName;
        private final Optional<String> runConfigId;

        RecurringKey(String pipelineName, Optional<String> runConfigId)
        {
            this.pipelineName = pipelineName;
            this.runConfigId = runConfigId;
        }

        String describeRunConfig()
        {
            return runConfigId.isPresent() ? "'" + runConfigId.get() + "'" : "(default)";
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            RecurringKey other = (RecurringKey) o;
            return pipelineName.equals(other.pipelineName) && runConfigId.equals(other.runConfigId);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(pipelineName, runConfigId);
        }

        @Override
        public String toString()
        {
            return pipelineName + (runConfigId.isPresent() ? "/" + runConfigId.get() : "");
        }
    }
}
