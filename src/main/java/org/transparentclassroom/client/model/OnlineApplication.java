package org.transparentclassroom.client.model;

import org.transparentclassroom.client.model.widget.Widget;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

public class OnlineApplication extends MappedRecord {

    public OnlineApplication(FieldValues values) {
        super(EntityKind.ONLINE_APPLICATION, values);
    }

    public Integer getId() {
        return value("id");
    }

    public Integer getSchoolId() {
        return value("school_id");
    }

    public String getState() {
        return value("state");
    }

    public String getProgram() {
        return value("program");
    }

    public String getChildFirstName() {
        return value("child_first_name");
    }

    public String getChildLastName() {
        return value("child_last_name");
    }

    public LocalDate getChildBirthDate() {
        return value("child_birth_date");
    }

    public String getChildGender() {
        return value("child_gender");
    }

    public String getMotherEmail() {
        return value("mother_email");
    }

    public Integer getSessionId() {
        return value("session_id");
    }

    public ZonedDateTime getCreatedAt() {
        return value("created_at");
    }

    /** Application answers; only the detail endpoint sends them. */
    public List<Widget> getFields() {
        return value("fields");
    }
}
