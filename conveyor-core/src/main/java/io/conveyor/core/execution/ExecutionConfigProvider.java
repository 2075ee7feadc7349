package io.conveyor.core.execution;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.conveyor.spi.config.Config;

public class ExecutionConfigProvider
    implements Provider<ExecutionConfig>
{
    private final ExecutionConfig config;

    @Inject
    public ExecutionConfigProvider(Config systemConfig)
    {
        this.config = ExecutionConfig.convertFrom(systemConfig);
    }

    @Override
    public ExecutionConfig get()
    {
        return config;
    }
}
