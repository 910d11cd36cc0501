package org.forcecom.restapi.rest.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuration backed by a {@link Properties} instance, typically loaded from a
 * {@code forcecom.properties} file on the classpath.
 */
public class PropertiesConfiguration implements ClientConfiguration {

    private final Properties properties;

    public PropertiesConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads properties from a classpath resource.
     *
     * @param resource Resource name, e.g. {@code "forcecom.properties"}
     * @return Configuration over the loaded properties
     * @throws IllegalArgumentException If the resource does not exist
     * @throws UncheckedIOException If the resource cannot be read
     */
    public static PropertiesConfiguration fromClasspath(String resource) {
        ClassLoader classLoader = PropertiesConfiguration.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return new PropertiesConfiguration(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read configuration resource " + resource, e);
        }
    }

    @Override
    public String get(String key) {
        return properties.getProperty(key);
    }
}
