package org.transparentclassroom.client.rest;

/**
 * Semantic field types of the Transparent Classroom payloads.
 * <p>
 * List types carry their element type; {@link ValueConverter} coerces each element by
 * the element type's rule.
 * </p>
 */
public enum FieldType {

    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime"),
    OBJECT("object"),
    ANY("any"),
    WIDGET("widget"),
    STRING_LIST(STRING),
    INTEGER_LIST(INTEGER),
    OBJECT_LIST(OBJECT),
    WIDGET_LIST(WIDGET);

    /** Simple type identifier used in messages */
    private final String simpleName;
    /** Element type for list types, null otherwise */
    private final FieldType elementType;

    /**
     * Constructs a scalar (or object) type.
     */
    FieldType(String simpleName) {
        this.simpleName = simpleName;
        this.elementType = null;
    }

    /**
     * Constructs a list-of-T type.
     */
    FieldType(FieldType elementType) {
        this.simpleName = "list<" + elementType.simpleName + ">";
        this.elementType = elementType;
    }

    public String getSimpleName() {
        return simpleName;
    }

    public FieldType getElementType() {
        return elementType;
    }

    public boolean isList() {
        return elementType != null;
    }
}
