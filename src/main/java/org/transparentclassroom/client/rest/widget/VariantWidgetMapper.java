package org.transparentclassroom.client.rest.widget;

import org.transparentclassroom.client.model.CallShape;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.FieldValues;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.FieldReader;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.FieldType;
import org.transparentclassroom.client.rest.MappingContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a known widget variant from its declared attributes.
 *
 * <p>Every variant shares the common attributes {@code id}, {@code name}, {@code label}
 * and {@code required}; the variant adds its own. Undeclared attributes are kept on the
 * widget rather than discarded.</p>
 */
public class VariantWidgetMapper implements WidgetMapper {

    /** Attributes every variant may carry */
    static final List<FieldSpec> COMMON_FIELDS = Collections.unmodifiableList(Arrays.asList(
            FieldSpec.optional("id", FieldType.INTEGER),
            FieldSpec.optional("name", FieldType.STRING),
            FieldSpec.optional("label", FieldType.STRING),
            FieldSpec.optional("required", FieldType.BOOLEAN)
    ));

    private static final Set<String> DISCRIMINATOR = Collections.singleton("type");

    /**
     * Creates the variant from its discriminator, declared values and undeclared attributes.
     */
    @FunctionalInterface
    public interface Factory {
        Widget create(String type, FieldValues values, Map<String, Object> extra);
    }

    private final String name;
    private final Set<String> types;
    private final List<FieldSpec> fields;
    private final Factory factory;

    /**
     * @param name          Mapper name for debugging
     * @param types         Discriminator values handled (the first is the canonical one)
     * @param variantFields Attributes of the variant on top of the common ones
     * @param factory       Variant constructor
     */
    public VariantWidgetMapper(String name, List<String> types, List<FieldSpec> variantFields, Factory factory) {
        this.name = name;
        this.types = new HashSet<>(types);
        List<FieldSpec> all = new ArrayList<>(COMMON_FIELDS);
        all.addAll(variantFields);
        this.fields = Collections.unmodifiableList(all);
        this.factory = factory;
    }

    @Override
    public boolean canHandle(String type) {
        return type != null && types.contains(type);
    }

    @Override
    public Widget map(Map<?, ?> raw, EntityKind kind, String path, MappingContext context) {
        FieldReader.Result result = FieldReader.read(fields, raw, kind, path, CallShape.DETAIL, DISCRIMINATOR, context);
        return factory.create((String) raw.get("type"), result.getValues(), result.getUndeclared());
    }

    @Override
    public List<FieldSpec> getFields() {
        return fields;
    }

    @Override
    public int getPriority() {
        return 10; // Specific variant, check early
    }

    @Override
    public String getName() {
        return name;
    }
}
