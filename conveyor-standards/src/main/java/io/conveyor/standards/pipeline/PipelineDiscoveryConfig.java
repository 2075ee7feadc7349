package io.conveyor.standards.pipeline;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigException;
import org.immutables.value.Value;

/**
 * Settings of the file-system pipeline resolver, read from {@code pipelines.*} parameters.
 */
@Value.Immutable
public interface PipelineDiscoveryConfig
{
    String getDir();

    List<String> getEntryFiles();

    int getCacheTtl();  // seconds

    static ImmutablePipelineDiscoveryConfig.Builder builder()
    {
        return ImmutablePipelineDiscoveryConfig.builder();
    }

    static PipelineDiscoveryConfig convertFrom(Config config)
    {
        String entryFiles = config.get("pipelines.entry_files", String.class, "main.py,main.ipynb");
        PipelineDiscoveryConfig built = builder()
            .dir(config.get("pipelines.dir", String.class, "pipelines"))
            .entryFiles(ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(entryFiles)))
            .cacheTtl(config.get("pipelines.cache_ttl", int.class, 30))
            .build();
        if (built.getCacheTtl() < 0) {
            throw new ConfigException("pipelines.cache_ttl must not be negative: " + built.getCacheTtl());
        }
        return built;
    }
}
