package org.transparentclassroom.client.rest.exception;

import org.transparentclassroom.client.model.EntityKind;

/**
 * A field the schema marks as always present was absent (or null) in the payload.
 * <p>
 * Signals a breaking change of the upstream API contract rather than a usage error;
 * not retryable.
 * </p>
 */
public class MissingRequiredFieldException extends MappingException {

    MissingRequiredFieldException(EntityKind entityKind, String field, Object rawValue) {
        super("Missing required field '" + field + "' on " + entityKind, entityKind, field, rawValue);
    }

    /**
     * Factory method for an absent or null required field.
     *
     * @param entityKind kind of the entity being mapped
     * @param field      field path
     * @return a new MissingRequiredFieldException
     */
    public static MissingRequiredFieldException buildMissingRequiredFieldException(EntityKind entityKind, String field) {
        return new MissingRequiredFieldException(entityKind, field, null);
    }

}
