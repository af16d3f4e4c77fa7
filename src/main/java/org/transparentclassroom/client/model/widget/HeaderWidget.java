package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

/**
 * Section heading. Carries no answer.
 */
public class HeaderWidget extends Widget {

    public HeaderWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public String getText() {
        return value("text");
    }

    public Integer getLevel() {
        return value("level");
    }
}
