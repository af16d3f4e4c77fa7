package org.transparentclassroom.client.rest.exception;

import lombok.Getter;
import org.transparentclassroom.client.model.EntityKind;

/**
 * Base exception for failures turning a raw JSON payload into a typed record.
 * <p>
 * Always identifies the entity kind being mapped and, where applicable, the offending
 * field path (e.g. {@code widgets[2].options}) and raw value, so upstream schema drift
 * can be debugged without inspecting the raw payload. When raised while mapping a
 * collection, {@link #getIndex()} is the position of the failing element.
 * </p>
 */
@Getter
public abstract class MappingException extends RuntimeException {

    /** Kind of the entity being mapped */
    private final EntityKind entityKind;
    /** Field path within the entity, or null when the whole value is at fault */
    private final String field;
    /** Raw offending value, as received */
    private final transient Object rawValue;
    /** Source index within a collection payload, or null for single-object mapping */
    private Integer index;

    protected MappingException(String message, EntityKind entityKind, String field, Object rawValue) {
        super(message);
        this.entityKind = entityKind;
        this.field = field;
        this.rawValue = rawValue;
    }

    protected MappingException(String message, EntityKind entityKind, String field, Object rawValue, Throwable cause) {
        super(message, cause);
        this.entityKind = entityKind;
        this.field = field;
        this.rawValue = rawValue;
    }

    /**
     * Tags this exception with the index of the collection element it was raised for.
     *
     * @param index source index
     * @return this exception
     */
    public MappingException atIndex(int index) {
        this.index = index;
        return this;
    }

    @Override
    public String getMessage() {
        return index == null ? super.getMessage() : "[" + index + "] " + super.getMessage();
    }
}
