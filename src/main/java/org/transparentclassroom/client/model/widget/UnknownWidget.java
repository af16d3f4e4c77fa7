package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

/**
 * Passthrough for widget kinds this client does not model. All raw attributes,
 * the discriminator included, are kept verbatim.
 */
public class UnknownWidget extends Widget {

    public UnknownWidget(String type, Map<String, Object> attributes) {
        super(type, FieldValues.empty(), attributes);
    }

    @Override
    public boolean isKnown() {
        return false;
    }

    public Map<String, Object> getAttributes() {
        return getExtra();
    }

    @Override
    public Integer getId() {
        Object id = getExtra().get("id");
        return id instanceof Integer ? (Integer) id : null;
    }

    @Override
    public String getName() {
        Object name = getExtra().get("name");
        return name instanceof String ? (String) name : null;
    }

    @Override
    public String getLabel() {
        Object label = getExtra().get("label");
        return label instanceof String ? (String) label : null;
    }
}
