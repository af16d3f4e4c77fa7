package org.transparentclassroom.client.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("transparentclassroom.email", "admin@school.org");
 *
 * ClientSettings settings = ClientSettings.from(new SystemPropertyConfiguration());
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
