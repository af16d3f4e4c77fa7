package org.transparentclassroom.client.rest.widget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.widget.AnswerWidget;
import org.transparentclassroom.client.model.widget.CheckboxWidget;
import org.transparentclassroom.client.model.widget.ChoiceWidget;
import org.transparentclassroom.client.model.widget.DateWidget;
import org.transparentclassroom.client.model.widget.HeaderWidget;
import org.transparentclassroom.client.model.widget.MultiChoiceWidget;
import org.transparentclassroom.client.model.widget.TextAreaWidget;
import org.transparentclassroom.client.model.widget.TextWidget;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.FieldType;
import org.transparentclassroom.client.rest.MappingContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.transparentclassroom.client.rest.exception.MalformedFieldException.buildMalformedFieldException;

/**
 * Selects the widget mapper for a raw widget object based on its {@code type} discriminator.
 *
 * <p>Mappers are checked in priority order (lower priority values first).
 * The first mapper that can handle the discriminator is used.</p>
 *
 * <p><b>Priority guidelines:</b></p>
 * <ul>
 *   <li>0-19: Known variants (text, choice, date, ...)</li>
 *   <li>100+: Fallback mappers</li>
 * </ul>
 *
 * <p>A chain is immutable; {@link #addMapper} returns a new chain, so one instance can be
 * shared by every mapping context and thread.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * WidgetMapperChain chain = WidgetMapperChain.defaultChain().addMapper(ratingMapper);
 * Widget widget = chain.map(raw, EntityKind.FORM, "fields[0]", context);
 * }</pre>
 */
public class WidgetMapperChain {

    private static final Logger logger = LoggerFactory.getLogger(WidgetMapperChain.class);

    /** Chain of every known variant, shared by contexts that do not register their own */
    public static final WidgetMapperChain DEFAULT = defaultChain();

    private final List<WidgetMapper> mappers;

    /**
     * Creates an empty chain.
     */
    public WidgetMapperChain() {
        this(Collections.emptyList());
    }

    private WidgetMapperChain(List<WidgetMapper> mappers) {
        this.mappers = Collections.unmodifiableList(mappers);
    }

    /**
     * Builds the chain of every widget variant this client knows, with
     * {@link UnknownWidgetMapper} as the fallback.
     *
     * @return a new chain
     */
    public static WidgetMapperChain defaultChain() {
        return new WidgetMapperChain()
                .addMapper(new VariantWidgetMapper("TextWidgetMapper",
                        Collections.singletonList("text"),
                        Arrays.asList(
                                FieldSpec.optional("value", FieldType.STRING),
                                FieldSpec.optional("placeholder", FieldType.STRING),
                                FieldSpec.optional("max_length", FieldType.INTEGER)),
                        TextWidget::new))
                .addMapper(new VariantWidgetMapper("TextAreaWidgetMapper",
                        Collections.singletonList("textarea"),
                        Arrays.asList(
                                FieldSpec.optional("value", FieldType.STRING),
                                FieldSpec.optional("rows", FieldType.INTEGER)),
                        TextAreaWidget::new))
                .addMapper(new VariantWidgetMapper("ChoiceWidgetMapper",
                        Arrays.asList("choice", "select", "radio"),
                        Arrays.asList(
                                FieldSpec.always("options", FieldType.STRING_LIST),
                                FieldSpec.optional("value", FieldType.STRING)),
                        ChoiceWidget::new))
                .addMapper(new VariantWidgetMapper("MultiChoiceWidgetMapper",
                        Arrays.asList("multi_choice", "multi_select"),
                        Arrays.asList(
                                FieldSpec.always("options", FieldType.STRING_LIST),
                                FieldSpec.optional("value", FieldType.STRING_LIST)),
                        MultiChoiceWidget::new))
                .addMapper(new VariantWidgetMapper("CheckboxWidgetMapper",
                        Collections.singletonList("checkbox"),
                        Collections.singletonList(FieldSpec.optional("value", FieldType.BOOLEAN)),
                        CheckboxWidget::new))
                .addMapper(new VariantWidgetMapper("DateWidgetMapper",
                        Collections.singletonList("date"),
                        Collections.singletonList(FieldSpec.optional("value", FieldType.DATE)),
                        DateWidget::new))
                .addMapper(new VariantWidgetMapper("HeaderWidgetMapper",
                        Collections.singletonList("header"),
                        Arrays.asList(
                                FieldSpec.always("text", FieldType.STRING),
                                FieldSpec.optional("level", FieldType.INTEGER)),
                        HeaderWidget::new))
                .addMapper(new VariantWidgetMapper("AnswerWidgetMapper",
                        Collections.singletonList(AnswerWidget.TYPE),
                        Collections.singletonList(FieldSpec.optional("value", FieldType.ANY)),
                        AnswerWidget::new))
                .addMapper(new UnknownWidgetMapper());
    }

    /**
     * Returns a chain holding this chain's mappers plus the given one, sorted by priority.
     * This chain is left unchanged.
     *
     * @param mapper Mapper to add
     * @return a new chain
     */
    public WidgetMapperChain addMapper(WidgetMapper mapper) {
        List<WidgetMapper> sorted = new ArrayList<>(mappers);
        sorted.add(mapper);
        // Stable sort: equal priorities keep insertion order
        sorted.sort(Comparator.comparingInt(WidgetMapper::getPriority));
        return new WidgetMapperChain(sorted);
    }

    /**
     * Maps one raw widget element using the first matching mapper.
     *
     * @param value   Raw element (must be a JSON object)
     * @param kind    Kind of the entity embedding the widget
     * @param path    Path of the element (e.g. {@code widgets[2]})
     * @param context Mapping context
     * @return the widget variant
     */
    public Widget map(Object value, EntityKind kind, String path, MappingContext context) {
        if (!(value instanceof Map)) {
            throw buildMalformedFieldException(kind, path, value, "expected a widget object");
        }
        Map<?, ?> raw = (Map<?, ?>) value;
        Object discriminator = raw.get("type");
        String type = discriminator instanceof String ? (String) discriminator : null;

        WidgetMapper mapper = getMapperForType(type);
        if (mapper == null) {
            throw buildMalformedFieldException(kind, path, discriminator, "no widget mapper registered");
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Mapping widget {} of type '{}' with {}", path, type, mapper.getName());
        }
        return mapper.map(raw, kind, path, context);
    }

    /**
     * Gets the mapper that would handle the given discriminator.
     *
     * @param type Widget discriminator (can be null)
     * @return The mapper that can handle it, or null if none found
     */
    public WidgetMapper getMapperForType(String type) {
        return mappers.stream()
                .filter(m -> m.canHandle(type))
                .findFirst()
                .orElse(null);
    }

    /**
     * Returns all registered mappers in priority order.
     *
     * @return Unmodifiable list of mappers
     */
    public List<WidgetMapper> getMappers() {
        return mappers;
    }
}
