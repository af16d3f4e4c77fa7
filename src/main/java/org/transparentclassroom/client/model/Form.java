package org.transparentclassroom.client.model;

import org.transparentclassroom.client.model.widget.Widget;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * A submitted (or in-progress) response to a form template.
 */
public class Form extends MappedRecord {

    public Form(FieldValues values) {
        super(EntityKind.FORM, values);
    }

    public Integer getId() {
        return value("id");
    }

    public Integer getFormTemplateId() {
        return value("form_template_id");
    }

    public String getState() {
        return value("state");
    }

    public Integer getChildId() {
        return value("child_id");
    }

    public String getStudentFirstName() {
        return value("student_first_name");
    }

    public String getStudentLastName() {
        return value("student_last_name");
    }

    public String getParentName() {
        return value("parent_name");
    }

    /** Name of the classroom the form was submitted to */
    public String getClassroom() {
        return value("classroom");
    }

    /** Photo and media release the parent agreed to */
    public String getRelease() {
        return value("release");
    }

    public String getSignature() {
        return value("signature");
    }

    public ZonedDateTime getCreatedAt() {
        return value("created_at");
    }

    /** Answered fields; only the detail endpoint sends them. */
    public List<Widget> getFields() {
        return value("fields");
    }
}
