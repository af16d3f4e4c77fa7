package org.transparentclassroom.client.model.widget;

import org.transparentclassroom.client.model.FieldValues;

import java.util.Map;

/**
 * A bare named answer. Form and online application detail payloads may send their
 * {@code fields} as a {@code name -> answer} object instead of widget objects; each
 * entry becomes one of these.
 */
public class AnswerWidget extends Widget {

    public static final String TYPE = "answer";

    public AnswerWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    /** The raw JSON answer (string, number, boolean, list or object). */
    public Object getValue() {
        return value("value");
    }
}
