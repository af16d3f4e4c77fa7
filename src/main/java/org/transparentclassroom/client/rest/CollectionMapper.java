package org.transparentclassroom.client.rest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.rest.exception.MappingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.transparentclassroom.client.rest.exception.MalformedFieldException.buildMalformedFieldException;

/**
 * Maps a collection payload element by element, preserving source order.
 *
 * <p>Under {@link MappingPolicy#BEST_EFFORT} failing elements are collected next to the
 * successful ones; under {@link MappingPolicy#FAIL_FAST} the first failure is thrown,
 * tagged with its source index.</p>
 */
public class CollectionMapper {

    private static final Logger logger = LoggerFactory.getLogger(CollectionMapper.class);

    private final EntityMapper entityMapper;

    public CollectionMapper() {
        this(new EntityMapper());
    }

    public CollectionMapper(EntityMapper entityMapper) {
        this.entityMapper = entityMapper;
    }

    /**
     * Maps a list payload with the policy of the mapping context.
     *
     * @param kind Entity kind of the elements
     * @param raw  Raw JSON array
     * @return outcomes in source order
     */
    public MappingBatch<? extends MappedRecord> mapMany(EntityKind kind, Object raw) {
        return mapMany(EntitySchemas.forKind(kind), raw, CallShape.LIST, entityMapper.getContext().getPolicy());
    }

    public MappingBatch<? extends MappedRecord> mapMany(EntityKind kind, Object raw, MappingPolicy policy) {
        return mapMany(EntitySchemas.forKind(kind), raw, CallShape.LIST, policy);
    }

    public <R extends MappedRecord> MappingBatch<R> mapMany(EntitySchema<R> schema, Object raw) {
        return mapMany(schema, raw, CallShape.LIST, entityMapper.getContext().getPolicy());
    }

    /**
     * Maps every element of a collection payload.
     *
     * @param schema Schema of the elements
     * @param raw    Raw JSON array (a single JSON object is treated as a one-element array)
     * @param shape  Call shape the payload came from
     * @param policy Failure policy
     * @param <R>    Record type
     * @return outcomes in source order
     * @throws MappingException under {@link MappingPolicy#FAIL_FAST}, for the first failing element
     */
    public <R extends MappedRecord> MappingBatch<R> mapMany(EntitySchema<R> schema, Object raw, CallShape shape,
                                                            MappingPolicy policy) {
        List<?> elements = toElements(schema.getKind(), raw);
        List<MappingOutcome<R>> outcomes = new ArrayList<>(elements.size());

        for (int i = 0; i < elements.size(); i++) {
            try {
                outcomes.add(MappingOutcome.success(i, entityMapper.map(schema, elements.get(i), shape)));
            } catch (MappingException e) {
                e.atIndex(i);
                if (policy == MappingPolicy.FAIL_FAST) {
                    throw e;
                }
                if (logger.isDebugEnabled()) {
                    logger.debug("Skipping {} at index {}: field={}, value={}: {}",
                            schema.getKind(), i, e.getField(), e.getRawValue(), e.getMessage());
                }
                outcomes.add(MappingOutcome.failure(i, e));
            }
        }

        MappingBatch<R> batch = new MappingBatch<>(outcomes);
        if (batch.hasFailures()) {
            logger.debug("Mapped {} {} element(s), {} failed", batch.size(), schema.getKind(),
                    batch.getFailures().size());
        }
        return batch;
    }

    private static List<?> toElements(EntityKind kind, Object raw) {
        if (raw instanceof List) {
            return (List<?>) raw;
        }
        if (raw instanceof Map) {
            return Collections.singletonList(raw);
        }
        throw buildMalformedFieldException(kind, null, raw, "expected a JSON array");
    }
}
