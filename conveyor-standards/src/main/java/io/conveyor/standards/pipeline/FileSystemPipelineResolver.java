package io.conveyor.standards.pipeline;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.conveyor.spi.Pipeline;
import io.conveyor.spi.PipelineResolver;
import io.conveyor.spi.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers pipelines as subdirectories of {@code pipelines.dir}.
 *
 * A directory is a pipeline when it has a manifest ({@code pipeline.json}, or
 * {@code <name>.json}) or one of the entry files. Results are cached for
 * {@code pipelines.cache_ttl} seconds.
 */
public class FileSystemPipelineResolver
        implements PipelineResolver
{
    private static final Logger logger = LoggerFactory.getLogger(FileSystemPipelineResolver.class);

    private static final String MANIFEST_FILE = "pipeline.json";

    private final ObjectMapper mapper;
    private final PipelineDiscoveryConfig config;

    private List<Pipeline> cache = null;
    private Instant cachedAt = null;

    @Inject
    public FileSystemPipelineResolver(ObjectMapper mapper, PipelineDiscoveryConfig config)
    {
        this.mapper = mapper;
        this.config = config;
    }

    @Override
    public Optional<Pipeline> resolve(String name)
    {
        for (Pipeline pipeline : discoverAll(false)) {
            if (pipeline.getName().equals(name)) {
                return Optional.of(pipeline);
            }
        }
        return Optional.absent();
    }

    @Override
    public synchronized List<Pipeline> discoverAll(boolean forceRefresh)
    {
        Instant now = Instant.now();
        if (!forceRefresh && cache != null &&
                now.isBefore(cachedAt.plus(Duration.ofSeconds(config.getCacheTtl())))) {
            return cache;
        }
        cache = scan(Paths.get(config.getDir()));
        cachedAt = now;
        return cache;
    }

    public synchronized void invalidateCache()
    {
        cache = null;
        cachedAt = null;
    }

    private List<Pipeline> scan(Path dir)
    {
        if (!Files.isDirectory(dir)) {
            throw new ConfigException("Pipelines directory does not exist or is not a directory: " + dir.toAbsolutePath());
        }

        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                if (Files.isDirectory(child) && !child.getFileName().toString().startsWith(".")) {
                    children.add(child);
                }
            }
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to list pipelines directory " + dir.toAbsolutePath(), ex);
        }
        children.sort(Comparator.comparing(path -> path.getFileName().toString()));

        ImmutableList.Builder<Pipeline> pipelines = ImmutableList.builder();
        for (Path child : children) {
            String name = child.getFileName().toString();
            Optional<Path> manifestFile = findManifest(child, name);
            if (!manifestFile.isPresent() && !hasEntryFile(child)) {
                continue;
            }
            PipelineManifest manifest = manifestFile.isPresent()
                ? loadManifest(name, manifestFile.get())
                : PipelineManifest.empty();
            pipelines.add(DiscoveredPipeline.of(name, child, manifest));
        }
        List<Pipeline> result = pipelines.build();
        logger.debug("Discovered {} pipelines in {}", result.size(), dir);
        return result;
    }

    private static Optional<Path> findManifest(Path dir, String name)
    {
        Path manifest = dir.resolve(MANIFEST_FILE);
        if (Files.isRegularFile(manifest)) {
            return Optional.of(manifest);
        }
        Path named = dir.resolve(name + ".json");
        if (Files.isRegularFile(named)) {
            return Optional.of(named);
        }
        return Optional.absent();
    }

    private boolean hasEntryFile(Path dir)
    {
        for (String entry : config.getEntryFiles()) {
            if (Files.isRegularFile(dir.resolve(entry))) {
                return true;
            }
        }
        return false;
    }

    @VisibleForTesting
    PipelineManifest loadManifest(String name, Path file)
    {
        try {
            return mapper.readerFor(PipelineManifest.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(file.toFile());
        }
        catch (JsonProcessingException ex) {
            logger.warn("Invalid manifest {} of pipeline '{}'. The pipeline is loaded without schedules: {}",
                    file, name, ex.getOriginalMessage());
            return PipelineManifest.empty();
        }
        catch (IOException ex) {
            logger.error("Failed to read manifest {} of pipeline '{}'. The pipeline is loaded without schedules",
                    file, name, ex);
            return PipelineManifest.empty();
        }
    }
}
