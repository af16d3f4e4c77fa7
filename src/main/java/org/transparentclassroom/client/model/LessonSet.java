package org.transparentclassroom.client.model;

import java.util.List;
import java.util.Map;

/**
 * A lesson set (curriculum). The area/group/lesson tree below it is kept as raw
 * JSON objects.
 */
public class LessonSet extends MappedRecord {

    public LessonSet(FieldValues values) {
        super(EntityKind.LESSON_SET, values);
    }

    public Integer getId() {
        return value("id");
    }

    public String getName() {
        return value("name");
    }

    public List<Map<String, Object>> getChildren() {
        return value("children");
    }

    /** Proficiency scales keyed by scale name. */
    public Map<String, Object> getScales() {
        return value("scales");
    }
}
