package io.conveyor.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import io.conveyor.spi.config.Config;
import io.conveyor.spi.config.ConfigElement;
import io.conveyor.spi.config.ConfigException;
import io.conveyor.spi.config.ConfigFactory;

/**
 * Loads the system configuration from {@code .properties} files. Keys stay flat,
 * for example {@code scheduler.poll_interval}.
 */
public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    public static Properties loadResource(ClassLoader loader, String name)
    {
        Properties props = new Properties();
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) {
                throw new ConfigException("Resource not found: " + name);
            }
            props.load(in);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to load " + name, ex);
        }
        return props;
    }

    public static ConfigElement toConfigElement(Properties props)
    {
        Config builder = new ConfigFactory(ConfigFactory.objectMapper()).create();
        for (String key : props.stringPropertyNames()) {
            builder.set(key, props.getProperty(key).trim());
        }
        return ConfigElement.copyOf(builder);
    }
}
