package io.conveyor.core.schedule;

import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigException;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.immutables.value.Value;

/**
 * Settings of the scheduling engine, read from {@code scheduler.*} parameters.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableScheduleConfig.class)
@JsonDeserialize(as = ImmutableScheduleConfig.class)
public interface ScheduleConfig
{
    boolean getEnabled();

    int getPollInterval();  // seconds

    int getFiringThreads();

    int getShutdownTimeout();  // seconds

    int getStartupGracePeriod();  // seconds

    int getReconcileInterval();  // seconds, 0 disables periodic reconciliation

    static ImmutableScheduleConfig.Builder defaultBuilder()
    {
        return ImmutableScheduleConfig.builder()
            .enabled(true)
            .pollInterval(1)
            .firingThreads(10)
            .shutdownTimeout(60)
            .startupGracePeriod(10)
            .reconcileInterval(0);
    }

    static ScheduleConfig convertFrom(Config config)
    {
        ScheduleConfig built = defaultBuilder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .pollInterval(config.get("scheduler.poll_interval", int.class, 1))
            .firingThreads(config.get("scheduler.firing_threads", int.class, 10))
            .shutdownTimeout(config.get("scheduler.shutdown_timeout", int.class, 60))
            .startupGracePeriod(config.get("scheduler.startup_grace_period", int.class, 10))
            .reconcileInterval(config.get("scheduler.reconcile_interval", int.class, 0))
            .build();
        if (built.getPollInterval() <= 0) {
            throw new ConfigException("scheduler.poll_interval must be positive: " + built.getPollInterval());
        }
        if (built.getFiringThreads() <= 0) {
            throw new ConfigException("scheduler.firing_threads must be positive: " + built.getFiringThreads());
        }
        return built;
    }
}
