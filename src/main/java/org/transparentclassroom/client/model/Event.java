package org.transparentclassroom.client.model;

import java.time.ZonedDateTime;

/**
 * A classroom event logged for a child (toileting, nap, meal, ...).
 */
public class Event extends MappedRecord {

    public Event(FieldValues values) {
        super(EntityKind.EVENT, values);
    }

    public Integer getId() {
        return value("id");
    }

    public Integer getClassroomId() {
        return value("classroom_id");
    }

    public Integer getChildId() {
        return value("child_id");
    }

    public String getEventType() {
        return value("event_type");
    }

    public String getValue() {
        return value("value");
    }

    public String getValue2() {
        return value("value2");
    }

    public Integer getCreatedById() {
        return value("created_by_id");
    }

    public String getCreatedByName() {
        return value("created_by_name");
    }

    public ZonedDateTime getTime() {
        return value("time");
    }
}
