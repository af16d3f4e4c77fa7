package org.transparentclassroom.client.model;

import org.transparentclassroom.client.model.widget.Widget;

import java.util.List;

public class FormTemplate extends MappedRecord {

    public FormTemplate(FieldValues values) {
        super(EntityKind.FORM_TEMPLATE, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public List<Widget> getWidgets() {
        return value("widgets");
    }
}
