package org.transparentclassroom.client.rest.widget;

import org.transparentclassroom.client.model.EntityKind;
import org.transparentclassroom.client.model.widget.UnknownWidget;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.MappingContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fallback mapper for discriminators no other mapper handles.
 *
 * <p>Never fails: keeps every raw attribute verbatim so a new widget kind upstream does
 * not break ingestion of the rest of the payload.</p>
 *
 * <p><b>Priority:</b> 100 (checked last)</p>
 */
public class UnknownWidgetMapper implements WidgetMapper {

    @Override
    public boolean canHandle(String type) {
        return true; // Handles everything as fallback
    }

    @Override
    public Widget map(Map<?, ?> raw, EntityKind kind, String path, MappingContext context) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            attributes.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        Object type = raw.get("type");
        return new UnknownWidget(type instanceof String ? (String) type : null, attributes);
    }

    @Override
    public List<FieldSpec> getFields() {
        return Collections.emptyList();
    }

    @Override
    public int getPriority() {
        return 100; // Check last (default fallback)
    }

    @Override
    public String getName() {
        return "UnknownWidgetMapper";
    }
}
