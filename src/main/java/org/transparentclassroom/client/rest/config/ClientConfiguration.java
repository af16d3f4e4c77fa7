package org.transparentclassroom.client.rest.config;

/**
 * Configuration interface for client settings.
 *
 * <p>Abstracts configuration sources (system properties, properties files, etc.)
 * to enable testability and flexibility.</p>
 *
 * <p><b>Configuration keys</b> (prefix {@code transparentclassroom.}):</p>
 * <ul>
 *   <li>host - API root, defaults to https://www.transparentclassroom.com</li>
 *   <li>email, password - credentials used to obtain the API token</li>
 *   <li>masqueradeId - user to act as (network admins only)</li>
 *   <li>schoolId - school to act in (network admins only)</li>
 *   <li>connectionTimeout, responseTimeout - seconds, default 30</li>
 *   <li>timeZone - school time zone (IANA id or school time zone name)</li>
 *   <li>mappingPolicy - BEST_EFFORT or FAIL_FAST</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String host = config.get("transparentclassroom.host");
 * }</pre>
 */
public interface ClientConfiguration {

    /** Prefix shared by every configuration key */
    String PREFIX = "transparentclassroom.";

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
