package org.transparentclassroom.client.model;

/**
 * Under which call shapes a field may legitimately be missing from a payload.
 */
public enum Presence {

    /** Populated by both detail and list calls. */
    ALWAYS,
    /** List calls return a reduced projection and may omit it. */
    DETAIL_ONLY,
    /** May be absent or null in any call shape. */
    OPTIONAL;

    public boolean isRequired() {
        return this == ALWAYS;
    }

}
