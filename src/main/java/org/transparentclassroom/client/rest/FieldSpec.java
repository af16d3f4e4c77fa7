package org.transparentclassroom.client.rest;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.transparentclassroom.client.model.Presence;

/**
 * Declaration of one field of an entity or widget schema.
 * <p>
 * Describes the field name exposed on the record, the payload key it is read from,
 * the coercion rule and the presence policy.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class FieldSpec {

    /** Field name on the mapped record */
    private final String name;
    /** Key of the value in the raw JSON object; usually equal to the name */
    private final String jsonKey;
    /** Coercion rule */
    private final FieldType fieldType;
    /** Under which call shapes the field may be absent */
    private final Presence presence;

    /**
     * Constructs a field read from a payload key of a different name.
     *
     * @param name      Field name on the record.
     * @param jsonKey   Key in the raw payload.
     * @param fieldType Coercion rule.
     * @param presence  Presence policy.
     */
    public FieldSpec(String name, String jsonKey, FieldType fieldType, Presence presence) {
        this.name = name;
        this.jsonKey = jsonKey;
        this.fieldType = fieldType;
        this.presence = presence;
    }

    public FieldSpec(String name, FieldType fieldType, Presence presence) {
        this(name, name, fieldType, presence);
    }

    public static FieldSpec always(String name, FieldType fieldType) {
        return new FieldSpec(name, fieldType, Presence.ALWAYS);
    }

    public static FieldSpec detailOnly(String name, FieldType fieldType) {
        return new FieldSpec(name, fieldType, Presence.DETAIL_ONLY);
    }

    public static FieldSpec optional(String name, FieldType fieldType) {
        return new FieldSpec(name, fieldType, Presence.OPTIONAL);
    }
}
