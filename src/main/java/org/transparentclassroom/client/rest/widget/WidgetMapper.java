package org.transparentclassroom.client.rest.widget;

import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.MappingContext;

import java.util.List;
import java.util.Map;

/**
 * Maps raw widget objects of one or more discriminator values to a widget variant.
 *
 * <p>Use {@link WidgetMapperChain} to select the mapper for a discriminator.</p>
 */
public interface WidgetMapper {

    /**
     * Checks if this mapper can handle the given discriminator.
     *
     * @param type value of the {@code type} key (may be null)
     * @return true if this mapper builds the variant for it
     */
    boolean canHandle(String type);

    /**
     * Maps a raw widget object.
     *
     * @param raw     Raw widget object
     * @param kind    Kind of the entity embedding the widget
     * @param path    Path of the widget within the entity (e.g. {@code fields[3]})
     * @param context Mapping context
     * @return the widget variant
     */
    Widget map(Map<?, ?> raw, EntityKind kind, String path, MappingContext context);

    /**
     * Attributes declared by the variant, used to write widgets back to JSON.
     *
     * @return declared attributes, in order
     */
    List<FieldSpec> getFields();

    /**
     * Returns mapper priority for chain ordering.
     * Lower values are checked first (specific variants before the fallback).
     *
     * @return priority value (default: 50)
     */
    default int getPriority() {
        return 50;
    }

    /**
     * Returns mapper name for debugging.
     *
     * @return mapper name
     */
    String getName();
}
