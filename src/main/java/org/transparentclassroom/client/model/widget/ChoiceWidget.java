package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.List;
import java.util.Map;

/**
 * Single choice out of a fixed option list (select box or radio buttons).
 */
public class ChoiceWidget extends Widget {

    public ChoiceWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public List<String> getOptions() {
        return value("options");
    }

    public String getValue() {
        return value("value");
    }
}
