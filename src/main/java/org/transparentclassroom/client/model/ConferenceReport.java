package org.transparentclassroom.client.model;

import org.transparentclassroom.client.model.widget.Widget;

import java.util.List;

/**
 * A conference report filed for a child. The upstream payload carries the report
 * widgets under the {@code data} key.
 */
public class ConferenceReport extends MappedRecord {

    public ConferenceReport(FieldValues values) {
        super(EntityKind.CONFERENCE_REPORT, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public Integer getChildId() {
        return value("child_id");
    }

    public List<Widget> getWidgets() {
        return value("widgets");
    }
}
