package org.transparentclassroom.client.model;

public class Classroom extends MappedRecord {

    public Classroom(FieldValues values) {
        super(EntityKind.CLASSROOM, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public Integer getLessonSetId() {
        return value("lesson_set_id");
    }

    /** Grade levels taught in the classroom, as free text. */
    public String getLevel() {
        return value("level");
    }

    public Boolean getActive() {
        return value("active");
    }
}
