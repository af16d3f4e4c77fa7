package org.transparentclassroom.client.tests.base;

import org.transparentclassroom.client.model.FieldValues;
import org.transparentclassroom.client.model.widget.Widget;
import org.transparentclassroom.client.rest.FieldSpec;
import org.transparentclassroom.client.rest.FieldType;
import org.transparentclassroom.client.rest.widget.VariantWidgetMapper;

import java.util.Collections;
import java.util.Map;

/**
 * Star rating widget, a variant registered by tests on top of the default chain.
 */
public class RatingWidget extends Widget {

    public static final VariantWidgetMapper MAPPER = new VariantWidgetMapper("RatingWidgetMapper",
            Collections.singletonList("rating"),
            Collections.singletonList(FieldSpec.optional("stars", FieldType.INTEGER)),
            RatingWidget::new);

    public RatingWidget(String type, FieldValues values, Map<String, Object> extra) {
        super(type, values, extra);
    }

    public Integer getStars() {
        return value("stars");
    }
}
