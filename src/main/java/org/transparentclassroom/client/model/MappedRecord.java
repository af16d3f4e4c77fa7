package org.transparentclassroom.client.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * Base class of the typed records produced by the entity mapper.
 * <p>
 * Records are immutable value objects built fresh per API response. Every field is optional
 * at the type level: list calls return a reduced projection of the detail payload, and some
 * fields only exist for certain entity states. Use {@link #has(String)} to tell an absent field
 * from one the API sent as {@code null}.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class MappedRecord {

    /** Kind of entity this record was mapped as */
    private final EntityKind kind;
    /** Coerced field values and presence */
    private final FieldValues values;

    protected MappedRecord(EntityKind kind, FieldValues values) {
        this.kind = kind;
        this.values = values;
    }

    /**
     * @param name field name as declared in the entity schema
     * @return true if the source payload carried the field (even as {@code null})
     */
    public boolean has(String name) {
        return values.has(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Set<String> getPresentFields() {
        return values.getPresentFields();
    }

    @SuppressWarnings("unchecked")
    protected <T> T value(String name) {
        return (T) values.get(name);
    }
}
