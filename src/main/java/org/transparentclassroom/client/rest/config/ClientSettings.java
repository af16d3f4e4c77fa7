package org.transparentclassroom.client.rest.config;

import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.rest.MappingPolicy;

import static org.transparentclassroom.client.rest.config.ClientConfiguration.PREFIX;

/**
 * Resolved client settings.
 *
 * <p>Credentials and the masquerade/school ids are passed through to the API as-is;
 * the mapping layer never inspects them.</p>
 */
@Data
public class ClientSettings {

    private static final Logger logger = LoggerFactory.getLogger(ClientSettings.class);

    public static final String DEFAULT_HOST = "https://www.transparentclassroom.com";
    public static final int DEFAULT_TIMEOUT = 30;

    private String host = DEFAULT_HOST;
    private String email;
    @ToString.Exclude
    private String password;
    private Integer masqueradeId;
    private Integer schoolId;
    /** Seconds */
    private int connectionTimeout = DEFAULT_TIMEOUT;
    /** Seconds */
    private int responseTimeout = DEFAULT_TIMEOUT;
    /** IANA zone id or school time zone name; null keeps date-times naive */
    private String timeZone;
    private MappingPolicy mappingPolicy = MappingPolicy.BEST_EFFORT;

    /**
     * Resolves settings from a configuration source; keys absent from the source keep
     * their defaults.
     *
     * @param config configuration source
     * @return resolved settings
     */
    public static ClientSettings from(ClientConfiguration config) {
        ClientSettings settings = new ClientSettings();
        settings.setHost(StringUtils.removeEnd(config.get(PREFIX + "host", DEFAULT_HOST), "/"));
        settings.setEmail(config.get(PREFIX + "email"));
        settings.setPassword(config.get(PREFIX + "password"));
        settings.setMasqueradeId(toInteger(config, "masqueradeId"));
        settings.setSchoolId(toInteger(config, "schoolId"));
        settings.setConnectionTimeout(toTimeout(config, "connectionTimeout"));
        settings.setResponseTimeout(toTimeout(config, "responseTimeout"));
        settings.setTimeZone(StringUtils.trimToNull(config.get(PREFIX + "timeZone")));

        String policy = config.get(PREFIX + "mappingPolicy");
        if (StringUtils.isNotBlank(policy)) {
            try {
                settings.setMappingPolicy(MappingPolicy.valueOf(policy.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown mapping policy '{}', using {}", policy, settings.getMappingPolicy());
            }
        }
        return settings;
    }

    private static Integer toInteger(ClientConfiguration config, String name) {
        String value = StringUtils.trimToNull(config.get(PREFIX + name));
        if (value == null) {
            return null;
        }
        Integer parsed = parseInt(value);
        if (parsed == null) {
            logger.warn("Ignoring invalid {}{} '{}'", PREFIX, name, value);
        }
        return parsed;
    }

    private static int toTimeout(ClientConfiguration config, String name) {
        String value = StringUtils.trimToNull(config.get(PREFIX + name));
        if (value == null) {
            return DEFAULT_TIMEOUT;
        }
        Integer timeout = parseInt(value);
        if (timeout == null || timeout <= 0) {
            logger.warn("Invalid {}{} '{}', using {} seconds", PREFIX, name, value, DEFAULT_TIMEOUT);
            return DEFAULT_TIMEOUT;
        }
        return timeout;
    }

    /**
     * @return the value as an int, or null when it is not a non-negative number within the int range
     */
    private static Integer parseInt(String value) {
        if (!NumberUtils.isDigits(value)) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            logger.debug("{} is outside the int range", value, e);
            return null;
        }
    }
}
