package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.List;
import java.util.Map;

/**
 * Any number of choices out of a fixed option list.
 */
public class MultiChoiceWidget extends Widget {

    public MultiChoiceWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public List<String> getOptions() {
        return value("options");
    }

    public List<String> getSelected() {
        return value("value");
    }
}
