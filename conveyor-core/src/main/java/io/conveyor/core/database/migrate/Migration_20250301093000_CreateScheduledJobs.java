package io.conveyor.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250301093000_CreateScheduledJobs
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("scheduled_jobs")
                .addUuid("id", "primary key")
                .addString("pipeline_name", "not null")
                .addString("trigger_type", "not null")
                .addString("trigger_value", "not null")
                .addBoolean("enabled", "not null default true")
                .addTimestamp("start_date", "")
                .addTimestamp("end_date", "")
                .addString("source", "not null default 'api'")
                .addString("run_config_id", "")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create index scheduled_jobs_on_pipeline_name on scheduled_jobs (pipeline_name)");
        handle.execute("create index scheduled_jobs_on_run_config_id on scheduled_jobs (run_config_id)");
    }
}
