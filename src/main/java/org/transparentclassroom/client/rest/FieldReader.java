package org.transparentclassroom.client.rest;

import lombok.Getter;
import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.FieldValues;
import org.transparentclassroom.client.model.Presence;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.transparentclassroom.client.rest.exception.MissingRequiredFieldException.buildMissingRequiredFieldException;

/**
 * Applies a list of {@link FieldSpec}s to one raw JSON object.
 *
 * <p>For each declared field:</p>
 * <ul>
 *   <li>absent or {@code null} and {@link Presence#ALWAYS}: missing required field</li>
 *   <li>absent otherwise: left absent (list types read as an empty list)</li>
 *   <li>present: coerced by the field's rule</li>
 * </ul>
 *
 * <p>Keys the specs do not declare are returned as the undeclared remainder; the caller
 * decides whether to report or keep them.</p>
 */
public class FieldReader {

    private FieldReader() {
    }

    /**
     * Reads the declared fields of a raw object.
     *
     * @param fields       Declared fields, in order
     * @param raw          Raw JSON object
     * @param kind         Entity kind being mapped
     * @param path         Path of the object within the entity ("" for the entity itself)
     * @param shape        Call shape the payload came from
     * @param ignoredKeys  Keys consumed elsewhere (e.g. a discriminator), never undeclared
     * @param context      Mapping context
     * @return coerced values plus undeclared keys
     */
    public static Result read(List<FieldSpec> fields, Map<?, ?> raw, EntityKind kind, String path,
                              CallShape shape, Collection<String> ignoredKeys, MappingContext context) {
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> present = new LinkedHashSet<>();
        Set<String> declaredKeys = new HashSet<>(ignoredKeys);

        for (FieldSpec spec : fields) {
            declaredKeys.add(spec.getJsonKey());
            String fieldPath = path.isEmpty() ? spec.getName() : path + "." + spec.getName();
            boolean hasKey = raw.containsKey(spec.getJsonKey());
            Object rawValue = raw.get(spec.getJsonKey());

            if (!hasKey || rawValue == null) {
                if (spec.getPresence().isRequired()) {
                    throw buildMissingRequiredFieldException(kind, fieldPath);
                }
                if (!hasKey) {
                    if (spec.getPresence() == Presence.DETAIL_ONLY && shape == CallShape.DETAIL) {
                        context.getDiagnostics().missingDetailField(kind, fieldPath);
                    }
                    if (spec.getFieldType().isList()) {
                        values.put(spec.getName(), Collections.emptyList());
                    }
                    continue;
                }
            }

            values.put(spec.getName(), ValueConverter.convert(rawValue, spec.getFieldType(), kind, fieldPath, context));
            present.add(spec.getName());
        }

        Map<String, Object> undeclared = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!declaredKeys.contains(key)) {
                undeclared.put(key, entry.getValue());
            }
        }

        return new Result(new FieldValues(values, present), undeclared);
    }

    /**
     * Outcome of reading one object.
     */
    @Getter
    public static class Result {
        private final FieldValues values;
        private final Map<String, Object> undeclared;

        Result(FieldValues values, Map<String, Object> undeclared) {
            this.values = values;
            this.undeclared = undeclared;
        }
    }
}
