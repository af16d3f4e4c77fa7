package org.transparentclassroom.client.model;

import java.time.LocalDate;

/**
 * A session (term) of instruction.
 */
public class Session extends MappedRecord {

    public Session(FieldValues values) {
        super(EntityKind.SESSION, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public LocalDate getStartDate() {
        return value("start_date");
    }

    public LocalDate getStopDate() {
        return value("stop_date");
    }

    /** Number of children enrolled during the session. */
    public Integer getChildren() {
        return value("children");
    }

    public Boolean getCurrent() {
        return value("current");
    }

    public Boolean getInactive() {
        return value("inactive");
    }
}
