package io.conveyor.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20250301093500_CreateJobRegistrations
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // next_fire_time and last_fire_time are epoch milliseconds
        handle.execute(
                context.newCreateTableBuilder("job_registrations")
                .addUuid("job_id", "primary key references scheduled_jobs (id) on delete cascade")
                .addLong("next_fire_time", "")
                .addLong("last_fire_time", "")
                .addLong("fire_count", "not null default 0")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create index job_registrations_on_next_fire_time on job_registrations (next_fire_time)");
    }
}
