package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

public class CheckboxWidget extends Widget {

    public CheckboxWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public Boolean getValue() {
        return value("value");
    }
}
