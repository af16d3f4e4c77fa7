package org.transparentclassroom.client.rest;

import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the time zone names schools are configured with to {@link ZoneId}s.
 *
 * <p>Schools report friendly names such as {@code "Pacific Time (US & Canada)"}; IANA ids
 * ({@code "America/Los_Angeles"}) are accepted too.</p>
 */
public class SchoolTimeZones {

    private static final Map<String, String> FRIENDLY_NAMES = new HashMap<>();

    static {
        FRIENDLY_NAMES.put("Hawaii", "Pacific/Honolulu");
        FRIENDLY_NAMES.put("Alaska", "America/Juneau");
        FRIENDLY_NAMES.put("Pacific Time (US & Canada)", "America/Los_Angeles");
        FRIENDLY_NAMES.put("Tijuana", "America/Tijuana");
        FRIENDLY_NAMES.put("Arizona", "America/Phoenix");
        FRIENDLY_NAMES.put("Mountain Time (US & Canada)", "America/Denver");
        FRIENDLY_NAMES.put("Chihuahua", "America/Chihuahua");
        FRIENDLY_NAMES.put("Mazatlan", "America/Mazatlan");
        FRIENDLY_NAMES.put("Central Time (US & Canada)", "America/Chicago");
        FRIENDLY_NAMES.put("Saskatchewan", "America/Regina");
        FRIENDLY_NAMES.put("Guadalajara", "America/Mexico_City");
        FRIENDLY_NAMES.put("Mexico City", "America/Mexico_City");
        FRIENDLY_NAMES.put("Monterrey", "America/Monterrey");
        FRIENDLY_NAMES.put("Central America", "America/Guatemala");
        FRIENDLY_NAMES.put("Eastern Time (US & Canada)", "America/New_York");
        FRIENDLY_NAMES.put("Indiana (East)", "America/Indiana/Indianapolis");
        FRIENDLY_NAMES.put("Bogota", "America/Bogota");
        FRIENDLY_NAMES.put("Lima", "America/Lima");
        FRIENDLY_NAMES.put("Quito", "America/Lima");
        FRIENDLY_NAMES.put("Atlantic Time (Canada)", "America/Halifax");
        FRIENDLY_NAMES.put("Caracas", "America/Caracas");
        FRIENDLY_NAMES.put("La Paz", "America/La_Paz");
        FRIENDLY_NAMES.put("Santiago", "America/Santiago");
        FRIENDLY_NAMES.put("Newfoundland", "America/St_Johns");
        FRIENDLY_NAMES.put("Brasilia", "America/Sao_Paulo");
        FRIENDLY_NAMES.put("Buenos Aires", "America/Argentina/Buenos_Aires");
        FRIENDLY_NAMES.put("Puerto Rico", "America/Puerto_Rico");
        FRIENDLY_NAMES.put("UTC", "Etc/UTC");
        FRIENDLY_NAMES.put("London", "Europe/London");
        FRIENDLY_NAMES.put("Edinburgh", "Europe/London");
        FRIENDLY_NAMES.put("Dublin", "Europe/Dublin");
        FRIENDLY_NAMES.put("Lisbon", "Europe/Lisbon");
        FRIENDLY_NAMES.put("Amsterdam", "Europe/Amsterdam");
        FRIENDLY_NAMES.put("Berlin", "Europe/Berlin");
        FRIENDLY_NAMES.put("Brussels", "Europe/Brussels");
        FRIENDLY_NAMES.put("Copenhagen", "Europe/Copenhagen");
        FRIENDLY_NAMES.put("Madrid", "Europe/Madrid");
        FRIENDLY_NAMES.put("Paris", "Europe/Paris");
        FRIENDLY_NAMES.put("Rome", "Europe/Rome");
        FRIENDLY_NAMES.put("Stockholm", "Europe/Stockholm");
        FRIENDLY_NAMES.put("Vienna", "Europe/Vienna");
        FRIENDLY_NAMES.put("Warsaw", "Europe/Warsaw");
        FRIENDLY_NAMES.put("Athens", "Europe/Athens");
        FRIENDLY_NAMES.put("Helsinki", "Europe/Helsinki");
        FRIENDLY_NAMES.put("Jerusalem", "Asia/Jerusalem");
        FRIENDLY_NAMES.put("Cairo", "Africa/Cairo");
        FRIENDLY_NAMES.put("Pretoria", "Africa/Johannesburg");
        FRIENDLY_NAMES.put("Nairobi", "Africa/Nairobi");
        FRIENDLY_NAMES.put("Moscow", "Europe/Moscow");
        FRIENDLY_NAMES.put("Istanbul", "Europe/Istanbul");
        FRIENDLY_NAMES.put("Abu Dhabi", "Asia/Muscat");
        FRIENDLY_NAMES.put("Mumbai", "Asia/Kolkata");
        FRIENDLY_NAMES.put("New Delhi", "Asia/Kolkata");
        FRIENDLY_NAMES.put("Kathmandu", "Asia/Kathmandu");
        FRIENDLY_NAMES.put("Bangkok", "Asia/Bangkok");
        FRIENDLY_NAMES.put("Jakarta", "Asia/Jakarta");
        FRIENDLY_NAMES.put("Beijing", "Asia/Shanghai");
        FRIENDLY_NAMES.put("Hong Kong", "Asia/Hong_Kong");
        FRIENDLY_NAMES.put("Singapore", "Asia/Singapore");
        FRIENDLY_NAMES.put("Taipei", "Asia/Taipei");
        FRIENDLY_NAMES.put("Seoul", "Asia/Seoul");
        FRIENDLY_NAMES.put("Tokyo", "Asia/Tokyo");
        FRIENDLY_NAMES.put("Perth", "Australia/Perth");
        FRIENDLY_NAMES.put("Adelaide", "Australia/Adelaide");
        FRIENDLY_NAMES.put("Brisbane", "Australia/Brisbane");
        FRIENDLY_NAMES.put("Sydney", "Australia/Sydney");
        FRIENDLY_NAMES.put("Melbourne", "Australia/Melbourne");
        FRIENDLY_NAMES.put("Auckland", "Pacific/Auckland");
        FRIENDLY_NAMES.put("Wellington", "Pacific/Auckland");
    }

    private SchoolTimeZones() {
    }

    /**
     * @param name school time zone name or IANA zone id
     * @return the zone, or null when the name is blank
     * @throws IllegalArgumentException if the name is neither a known school zone nor a zone id
     */
    public static ZoneId resolve(String name) {
        if (StringUtils.isBlank(name)) {
            return null;
        }
        String trimmed = name.trim();
        String zoneId = FRIENDLY_NAMES.getOrDefault(trimmed, trimmed);
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + name, e);
        }
    }
}
