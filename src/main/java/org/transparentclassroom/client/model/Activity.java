package org.transparentclassroom.client.model;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * An observation, presentation or photo recorded for a child or classroom.
 */
public class Activity extends MappedRecord {

    public Activity(FieldValues values) {
        super(EntityKind.ACTIVITY, values);
    }

    public Integer getId() {
        return value("id");
    }

    public Integer getAuthorId() {
        return value("author_id");
    }

    public Integer getClassroomId() {
        return value("classroom_id");
    }

    public String getText() {
        return value("text");
    }

    public String getHtml() {
        return value("html");
    }

    public LocalDate getDate() {
        return value("date");
    }

    public ZonedDateTime getCreatedAt() {
        return value("created_at");
    }

    public Boolean getStaffUnprocessed() {
        return value("staff_unprocessed");
    }

    public String getPhotoUrl() {
        return value("photo_url");
    }

    public String getMediumPhotoUrl() {
        return value("medium_photo_url");
    }

    public String getLargePhotoUrl() {
        return value("large_photo_url");
    }

    public String getOriginalPhotoUrl() {
        return value("original_photo_url");
    }
}
