package org.transparentclassroom.client.tests.base;

import org.transparentclassroom.client.model.Presence;
import org.transparentclassroom.client.rest.EntitySchema;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.FieldType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds raw payloads for an entity schema, as the API would send them for a detail
 * call (every field) or a list call (only the fields both call shapes carry).
 */
public final class SamplePayloads {

    private SamplePayloads() {
    }

    public static Map<String, Object> detail(EntitySchema<?> schema) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (FieldSpec field : schema.getFields()) {
            payload.put(field.getJsonKey(), sample(field.getFieldType(), field.getName()));
        }
        return payload;
    }

    public static Map<String, Object> list(EntitySchema<?> schema) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (FieldSpec field : schema.getFields()) {
            if (field.getPresence() == Presence.ALWAYS) {
                payload.put(field.getJsonKey(), sample(field.getFieldType(), field.getName()));
            }
        }
        return payload;
    }

    public static Object sample(FieldType type, String name) {
        switch (type) {
            case STRING:
                return "sample " + name;
            case INTEGER:
                return 7;
            case BOOLEAN:
                return true;
            case DATE:
                return "2021-09-01";
            case DATETIME:
                return "2021-09-01T08:30:00Z";
            case OBJECT:
                Map<String, Object> object = new LinkedHashMap<>();
                object.put("key", "value");
                return object;
            case WIDGET:
                return textWidget(name);
            case STRING_LIST:
                return new ArrayList<>(Arrays.asList("a", "b"));
            case INTEGER_LIST:
                return new ArrayList<>(Arrays.asList(1, 2));
            case OBJECT_LIST:
                Map<String, Object> lesson = new LinkedHashMap<>();
                lesson.put("id", 1);
                lesson.put("name", "Pouring");
                return new ArrayList<>(List.of(lesson));
            case WIDGET_LIST:
                Map<String, Object> unknown = new LinkedHashMap<>();
                unknown.put("type", "signature_pad_v2");
                unknown.put("strokes", new ArrayList<>(Arrays.asList(1, 2, 3)));
                return new ArrayList<>(Arrays.asList(textWidget(name), unknown));
            case ANY:
            default:
                return "any " + name;
        }
    }

    private static Map<String, Object> textWidget(String name) {
        Map<String, Object> widget = new LinkedHashMap<>();
        widget.put("type", "text");
        widget.put("name", name);
        widget.put("value", "answer");
        widget.put("position", 1);
        return widget;
    }
}
