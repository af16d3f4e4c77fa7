package org.transparentclassroom.client.rest;

import org.transparentclassroom.client.model.MappedRecord;
import org.transparentclassroom.client.model.widget.UnknownWidget;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.widget.WidgetMapper;
import org.transparentclassroom.client.rest.widget.WidgetMapperChain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes mapped records and widgets back to raw JSON values.
 *
 * <p>Only fields present in the source payload are written, under their payload keys,
 * so mapping the output again with the same context yields an equal record. Widgets are
 * written through the chain they were mapped with.</p>
 */
public class RecordWriter {

    private RecordWriter() {
    }

    /**
     * Writes a record mapped with the default widget chain.
     *
     * @param record mapped record
     * @return raw JSON object of the record's present fields
     */
    public static Map<String, Object> write(MappedRecord record) {
        return write(record, WidgetMapperChain.DEFAULT);
    }

    /**
     * @param record  mapped record
     * @param context context the record was mapped with
     * @return raw JSON object of the record's present fields
     */
    public static Map<String, Object> write(MappedRecord record, MappingContext context) {
        return write(record, context.getWidgetMappers());
    }

    public static Map<String, Object> write(MappedRecord record, WidgetMapperChain widgetMappers) {
        Map<String, Object> json = new LinkedHashMap<>();
        for (FieldSpec field : EntitySchemas.forKind(record.getKind()).getFields()) {
            if (record.has(field.getName())) {
                json.put(field.getJsonKey(),
                        ValueConverter.toJson(record.get(field.getName()), field.getFieldType(), widgetMappers));
            }
        }
        return json;
    }

    /**
     * Writes a widget mapped with the default widget chain.
     *
     * @param widget mapped widget
     * @return raw JSON object of the widget, undeclared attributes included
     */
    public static Map<String, Object> write(Widget widget) {
        return write(widget, WidgetMapperChain.DEFAULT);
    }

    /**
     * @param widget        mapped widget
     * @param widgetMappers chain the widget was mapped with
     * @return raw JSON object of the widget, undeclared attributes included
     */
    public static Map<String, Object> write(Widget widget, WidgetMapperChain widgetMappers) {
        if (widget instanceof UnknownWidget) {
            return new LinkedHashMap<>(((UnknownWidget) widget).getAttributes());
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", widget.getType());
        WidgetMapper mapper = widgetMappers.getMapperForType(widget.getType());
        if (mapper != null) {
            for (FieldSpec field : mapper.getFields()) {
                if (widget.has(field.getName())) {
                    json.put(field.getJsonKey(), ValueConverter.toJson(
                            widget.getValues().get(field.getName()), field.getFieldType(), widgetMappers));
                }
            }
        }
        json.putAll(widget.getExtra());
        return json;
    }
}
