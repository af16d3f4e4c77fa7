package org.transparentclassroom.client.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of coerced field values read from one JSON object.
 * <p>
 * Tracks which fields were actually present in the payload separately from the values,
 * so list-typed fields can read as empty lists without being reported as present.
 * </p>
 */
@EqualsAndHashCode
@ToString
public final class FieldValues {

    /** Coerced values in schema order, including list defaults for absent list fields */
    private final Map<String, Object> values;
    /** Names of the fields present in the source payload, in schema order */
    private final Set<String> present;

    public FieldValues(Map<String, Object> values, Set<String> present) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.present = Collections.unmodifiableSet(new LinkedHashSet<>(present));
    }

    public static FieldValues empty() {
        return new FieldValues(Collections.emptyMap(), Collections.emptySet());
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return present.contains(name);
    }

    public Set<String> getPresentFields() {
        return present;
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
