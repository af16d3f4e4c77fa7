package org.transparentclassroom.client.rest.exception;

import org.transparentclassroom.client.model.EntityKind;

/**
 * A present value could not be coerced to the type its schema declares.
 */
public class MalformedFieldException extends MappingException {

    MalformedFieldException(String message, EntityKind entityKind, String field, Object rawValue, Throwable cause) {
        super(message, entityKind, field, rawValue, cause);
    }

    /**
     * Factory method for a value that does not fit the declared type.
     *
     * @param entityKind kind of the entity being mapped
     * @param field      field path, or null when the whole payload is at fault
     * @param rawValue   offending raw value
     * @param reason     what was expected
     * @return a new MalformedFieldException
     */
    public static MalformedFieldException buildMalformedFieldException(
            EntityKind entityKind, String field, Object rawValue, String reason) {
        return buildMalformedFieldException(entityKind, field, rawValue, reason, null);
    }

    public static MalformedFieldException buildMalformedFieldException(
            EntityKind entityKind, String field, Object rawValue, String reason, Throwable cause) {
        String where = field == null ? String.valueOf(entityKind) : "'" + field + "' on " + entityKind;
        return new MalformedFieldException(
                "Malformed field " + where + ": " + reason + " (got " + describe(rawValue) + ")",
                entityKind, field, rawValue, cause);
    }

    private static String describe(Object rawValue) {
        if (rawValue == null) {
            return "null";
        }
        if (rawValue instanceof String) {
            return "\"" + rawValue + "\"";
        }
        return rawValue.getClass().getSimpleName() + " " + rawValue;
    }
}
