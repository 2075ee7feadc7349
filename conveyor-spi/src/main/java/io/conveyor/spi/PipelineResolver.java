package io.conveyor.spi;

import com.google.common.base.Optional;

import java.util.List;

public interface PipelineResolver
{
    Optional<Pipeline> resolve(String name);

    // forceRefresh skips any cache the resolver keeps
    List<Pipeline> discoverAll(boolean forceRefresh);
}
