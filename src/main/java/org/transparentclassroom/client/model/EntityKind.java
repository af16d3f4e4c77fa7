package org.transparentclassroom.client.model;

import java.util.HashMap;
import java.util.Map;

/**
 * The entity kinds exposed by the Transparent Classroom read API.
 * <p>
 * Each kind carries the resource name used in its API route
 * (e.g. {@code api/v1/children.json}).
 * </p>
 */
public enum EntityKind {

    ACTIVITY("activity"),
    CHILD("children"),
    CLASSROOM("classrooms"),
    CONFERENCE_REPORT("conference_reports"),
    EVENT("events"),
    FORM("forms"),
    FORM_TEMPLATE("form_templates"),
    LESSON_SET("lesson_sets"),
    LEVEL("levels"),
    ONLINE_APPLICATION("online_applications"),
    SCHOOL("schools"),
    SESSION("sessions"),
    USER("users");

    /** Resource name as it appears in the route */
    private final String resourceName;

    private static final Map<String, EntityKind> MAP = new HashMap<>();

    static {
        for (EntityKind value : values()) {
            MAP.put(value.resourceName, value);
        }
    }

    EntityKind(String resourceName) {
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }

    /**
     * Looks up the kind by its route resource name.
     * @param resourceName resource name (e.g. "children")
     * @return matching kind, or null if not found
     */
    public static EntityKind of(String resourceName) {
        return MAP.get(resourceName);
    }
}
