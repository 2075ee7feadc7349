package io.conveyor.core.execution;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigException;
import org.immutables.value.Value;

import java.time.Duration;

@Value.Immutable
@JsonSerialize(as = ImmutableExecutionConfig.class)
@JsonDeserialize(as = ImmutableExecutionConfig.class)
public interface ExecutionConfig
{
    int getAcceptanceTimeout();  // seconds

    int getRestartAcceptanceTimeout();  // seconds

    int getRuntimeThreads();

    int getRuntimeShutdownTimeout();  // seconds

    default Duration acceptanceTimeout()
    {
        return Duration.ofSeconds(getAcceptanceTimeout());
    }

    default Duration restartAcceptanceTimeout()
    {
        return Duration.ofSeconds(getRestartAcceptanceTimeout());
    }

    static ImmutableExecutionConfig.Builder defaultBuilder()
    {
        return ImmutableExecutionConfig.builder()
            .acceptanceTimeout(30)
            .restartAcceptanceTimeout(120)
            .runtimeThreads(4)
            .runtimeShutdownTimeout(10);
    }

    static ExecutionConfig convertFrom(Config config)
    {
        ExecutionConfig built = defaultBuilder()
            .acceptanceTimeout(config.get("execution.acceptance_timeout", int.class, 30))
            .restartAcceptanceTimeout(config.get("execution.restart_acceptance_timeout", int.class, 120))
            .runtimeThreads(config.get("execution.runtime_threads", int.class, 4))
            .runtimeShutdownTimeout(config.get("execution.runtime_shutdown_timeout", int.class, 10))
            .build();
        if (built.getAcceptanceTimeout() <= 0 || built.getRestartAcceptanceTimeout() <= 0) {
            throw new ConfigException("execution acceptance timeouts must be positive: " + built);
        }
        if (built.getRuntimeThreads() <= 0) {
            throw new ConfigException("execution.runtime_threads must be positive: " + built.getRuntimeThreads());
        }
        if (built.getRuntimeShutdownTimeout() < 0) {
            throw new ConfigException("execution.runtime_shutdown_timeout must not be negative: " + built.getRuntimeShutdownTimeout());
        }
        return built;
    }
}
