package org.transparentclassroom.client.rest;

import lombok.Getter;
import lombok.ToString;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.FieldValues;
import org.transparentclassroom.client.model.MappedRecord;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Declarative schema of one entity kind: its fields and how to build the typed record.
 *
 * @param <R> record type produced for this kind
 */
@Getter
@ToString(exclude = "factory")
public class EntitySchema<R extends MappedRecord> {

    private final EntityKind kind;
    private final List<FieldSpec> fields;
    private final Function<FieldValues, R> factory;

    public EntitySchema(EntityKind kind, List<FieldSpec> fields, Function<FieldValues, R> factory) {
        this.kind = kind;
        this.fields = Collections.unmodifiableList(fields);
        this.factory = factory;
    }

    /**
     * @param name field name
     * @return the declared field, or null if the schema has no such field
     */
    public FieldSpec getField(String name) {
        for (FieldSpec field : fields) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    R create(FieldValues values) {
        return factory.apply(values);
    }
}
