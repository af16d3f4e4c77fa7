package org.transparentclassroom.client.rest.service;

import freemarker.template.TemplateModel;
import lombok.Getter;
import org.transparentclassroom.client.freemarker.FreeMarkerEngine;
import org.transparentclassroom.client.model.EntityKind;

import java.util.HashMap;
import java.util.Map;

/**
 * Relative URL template of an API endpoint, rendered with FreeMarker.
 *
 * <p>Templates may reference {@code model_name} (the resource name of the entity kind)
 * and {@code object_id}.</p>
 */
@Getter
public class Route {

    public static final Route AUTHENTICATE = new Route("api/v1/authenticate.json");
    public static final Route LIST = new Route("api/v1/${model_name}.json");
    public static final Route SHOW = new Route("api/v1/${model_name}/${object_id}.json");
    public static final Route LEVELS_BY_DATE = new Route("api/v1/levels/by_date.json");

    private final String template;

    public Route(String template) {
        this.template = template;
    }

    /**
     * Renders the route of a collection endpoint.
     */
    public String render(EntityKind kind) {
        return render(kind, null);
    }

    /**
     * Renders the route of an endpoint.
     *
     * @param kind     Entity kind, bound as {@code model_name}
     * @param objectId Object id, bound as {@code object_id} when not null
     * @return the relative URL
     */
    public String render(EntityKind kind, Integer objectId) {
        Map<String, TemplateModel> variables = new HashMap<>();
        if (kind != null) {
            variables.put("model_name", FreeMarkerEngine.convert(kind.getResourceName()));
        }
        if (objectId != null) {
            variables.put("object_id", FreeMarkerEngine.convert(objectId));
        }
        return FreeMarkerEngine.getInstance().process(template, variables);
    }

    @Override
    public String toString() {
        return template;
    }
}
