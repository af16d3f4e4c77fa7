package org.transparentclassroom.client.model;

import java.time.LocalDate;

/**
 * A proficiency level recorded for a child on a lesson.
 */
public class Level extends MappedRecord {

    public Level(FieldValues values) {
        super(EntityKind.LEVEL, values);
    }

    public Integer getId() {
        return value("id");
    }

    public Integer getChildId() {
        return value("child_id");
    }

    public Integer getLessonId() {
        return value("lesson_id");
    }

    public Integer getProficiency() {
        return value("proficiency");
    }

    public LocalDate getDate() {
        return value("date");
    }

    public Boolean getPlanned() {
        return value("planned");
    }
}
