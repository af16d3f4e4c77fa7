package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

/**
 * Multi-line text input.
 */
public class TextAreaWidget extends Widget {

    public TextAreaWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public String getValue() {
        return value("value");
    }

    public Integer getRows() {
        return value("rows");
    }
}
