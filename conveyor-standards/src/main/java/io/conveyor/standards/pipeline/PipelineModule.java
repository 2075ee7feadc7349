package io.conveyor.standards.pipeline;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import io.conveyor.spi.PipelineResolver;

public class PipelineModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(PipelineDiscoveryConfig.class).toProvider(PipelineDiscoveryConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(FileSystemPipelineResolver.class).in(Scopes.SINGLETON);
        binder.bind(PipelineResolver.class).to(FileSystemPipelineResolver.class);
    }
}
