package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.time.LocalDate;
import java.util.Map;

public class DateWidget extends Widget {

    public DateWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public LocalDate getValue() {
        return value("value");
    }
}
