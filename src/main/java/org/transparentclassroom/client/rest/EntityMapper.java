package org.transparentclassroom.client.rest;

import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.MappedRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

import static org.transparentclassroom.client.rest.exception.MalformedFieldException.buildMalformedFieldException;

/**
 * Maps one raw JSON object to the typed record of its entity kind.
 *
 * <p>Looks up the schema of the kind and applies it field by field:</p>
 * <ul>
 *   <li>absent {@code ALWAYS} field: {@link org.transparentclassroom.client.rest.exception.MissingRequiredFieldException}</li>
 *   <li>absent {@code DETAIL_ONLY} or {@code OPTIONAL} field: left absent (lists read as empty)</li>
 *   <li>present field: coerced, propagating any
 *       {@link org.transparentclassroom.client.rest.exception.MalformedFieldException}</li>
 * </ul>
 *
 * <p>Raw keys the schema does not declare are ignored and reported to the
 * {@link MappingDiagnostics} of the context.</p>
 *
 * <p>Stateless; one instance may be shared between threads.</p>
 */
public class EntityMapper {

    private final MappingContext context;

    public EntityMapper() {
        this(MappingContext.defaults());
    }

    public EntityMapper(MappingContext context) {
        this.context = context;
    }

    public MappingContext getContext() {
        return context;
    }

    /**
     * Maps a detail payload of the given kind.
     *
     * @param kind Entity kind
     * @param raw  Raw JSON object
     * @return the typed record
     */
    public MappedRecord map(EntityKind kind, Object raw) {
        return map(EntitySchemas.forKind(kind), raw, CallShape.DETAIL);
    }

    /**
     * Maps a payload of the given kind returned by the given call shape.
     *
     * @param kind  Entity kind
     * @param raw   Raw JSON object
     * @param shape Call shape the payload came from
     * @return the typed record
     */
    public MappedRecord map(EntityKind kind, Object raw, CallShape shape) {
        return map(EntitySchemas.forKind(kind), raw, shape);
    }

    /**
     * Maps a payload with the given schema.
     *
     * @param schema Schema of the entity
     * @param raw    Raw JSON object
     * @param shape  Call shape the payload came from
     * @param <R>    Record type
     * @return the typed record
     */
    public <R extends MappedRecord> R map(EntitySchema<R> schema, Object raw, CallShape shape) {
        return map(schema, raw, shape, Collections.emptySet());
    }

    /**
     * Maps a payload whose listed keys are consumed by the caller and must not be
     * reported as schema drift.
     */
    <R extends MappedRecord> R map(EntitySchema<R> schema, Object raw, CallShape shape,
                                   Collection<String> consumedKeys) {
        if (!(raw instanceof Map)) {
            throw buildMalformedFieldException(schema.getKind(), null, raw, "expected a JSON object");
        }

        FieldReader.Result result = FieldReader.read(
                schema.getFields(), (Map<?, ?>) raw, schema.getKind(), "", shape, consumedKeys, context);

        for (Map.Entry<String, Object> entry : result.getUndeclared().entrySet()) {
            context.getDiagnostics().unknownField(schema.getKind(), entry.getKey(), entry.getValue());
        }
        return schema.create(result.getValues());
    }
}
