package io.conveyor.standards.pipeline;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.conveyor.spi.config.Config;

public class PipelineDiscoveryConfigProvider
    implements Provider<PipelineDiscoveryConfig>
{
    private final PipelineDiscoveryConfig config;

    @Inject
    public PipelineDiscoveryConfigProvider(Config systemConfig)
    {
        this.config = PipelineDiscoveryConfig.convertFrom(systemConfig);
    }

    @Override
    public PipelineDiscoveryConfig get()
    {
        return config;
    }
}
