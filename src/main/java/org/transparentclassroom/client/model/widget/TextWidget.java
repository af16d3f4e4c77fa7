package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

/**
 * Single-line text input.
 */
public class TextWidget extends Widget {

    public TextWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public String getValue() {
        return value("value");
    }

    public String getPlaceholder() {
        return value("placeholder");
    }

    public Integer getMaxLength() {
        return value("max_length");
    }
}
