package org.transparentclassroom.client.model.widget;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.transparentclassroom.client.model.FieldValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single labeled question/answer unit embedded in form templates, forms, conference
 * reports and online applications.
 * <p>
 * Widgets are a tagged variant keyed by the {@code type} discriminator of the payload.
 * Each known variant is a subclass exposing its own attributes; {@link UnknownWidget}
 * carries any discriminator this client does not know yet.
 * </p>
 * <p>
 * Attributes the variant does not declare are kept in {@link #getExtra()} so nothing the
 * API sends is lost when its schema evolves.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class Widget {

    /** Discriminator exactly as sent by the API (may be null for unknown widgets) */
    private final String type;
    /** Declared attributes of the variant */
    private final FieldValues values;
    /** Undeclared attributes, verbatim */
    private final Map<String, Object> extra;

    protected Widget(String type, FieldValues values, Map<String, Object> extra) {
        this.type = type;
        this.values = values;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * @return false only for {@link UnknownWidget}
     */
    public boolean isKnown() {
        return true;
    }

    public boolean has(String attribute) {
        return values.has(attribute);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public String getLabel() {
        return value("label");
    }

    public Boolean getRequired() {
        return value("required");
    }

    @SuppressWarnings("unchecked")
    protected <T> T value(String attribute) {
        return (T) values.get(attribute);
    }
}
