package org.transparentclassroom.client.rest.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Configuration implementation backed by a {@link Properties} instance, loaded from the
 * classpath resource {@value #DEFAULT_RESOURCE} by default.
 */
public class PropertiesConfiguration implements ClientConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PropertiesConfiguration.class);

    public static final String DEFAULT_RESOURCE = "transparent-classroom.properties";

    private final Properties properties;

    public PropertiesConfiguration(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath; an absent resource yields an
     * empty configuration.
     *
     * @return configuration from the classpath
     * @throws IOException if the resource exists but cannot be read
     */
    public static PropertiesConfiguration fromClasspath() throws IOException {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static PropertiesConfiguration fromClasspath(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream is = PropertiesConfiguration.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                logger.warn("Configuration resource {} not found on classpath", resource);
            } else {
                properties.load(is);
            }
        }
        return new PropertiesConfiguration(properties);
    }

    @Override
    public String get(String key) {
        return properties.getProperty(key);
    }
}
